/**
 * Application events published by the voice queue manager.
 */
package com.phillippitts.streamtalker.service.queue.event;
