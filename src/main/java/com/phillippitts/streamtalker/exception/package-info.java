/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.streamtalker.exception.StreamTalkerException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.streamtalker.exception.SynthesisException} - Thrown when a remote
 *       synthesis batch fails (transport, server error, timeout or malformed response)</li>
 *   <li>{@link com.phillippitts.streamtalker.exception.CacheStorageException} - Thrown when a
 *       cache blob cannot be written; treated as a cache miss</li>
 *   <li>{@link com.phillippitts.streamtalker.exception.CacheInitializationException} - Thrown when
 *       the cache directory is unusable at startup (fatal)</li>
 *   <li>{@link com.phillippitts.streamtalker.exception.IllegalStateTransitionException} - Thrown
 *       when a lifecycle event is applied in a state that does not accept it</li>
 *   <li>{@link com.phillippitts.streamtalker.exception.MessageNotFoundException} - Thrown when a
 *       command refers to an unknown message</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, support exception chaining and carry a context field
 * (voice, cache key, directory, state) for logging. HTTP mapping happens in
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.streamtalker.exception.StreamTalkerException
 * @since 1.0
 */
package com.phillippitts.streamtalker.exception;
