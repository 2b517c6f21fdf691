package com.phillippitts.streamtalker.exception;

/**
 * Base exception for all StreamTalker application-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class StreamTalkerException extends RuntimeException {

    public StreamTalkerException(String message) {
        super(message);
    }

    public StreamTalkerException(String message, Throwable cause) {
        super(message, cause);
    }

    public StreamTalkerException(Throwable cause) {
        super(cause);
    }
}
