/**
 * Core domain model of the chat-to-speech pipeline.
 *
 * <p>{@link com.phillippitts.streamtalker.domain.QueuedMessage} is the unit that flows through the
 * pipeline; its lifecycle is governed by the pure transition function in
 * {@link com.phillippitts.streamtalker.domain.MessageStateMachine}.
 * {@link com.phillippitts.streamtalker.domain.CacheKeys} derives the content address that the
 * audio cache and the synthesis deduplication share.
 *
 * @since 1.0
 */
package com.phillippitts.streamtalker.domain;
