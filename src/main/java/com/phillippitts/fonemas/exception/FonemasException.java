package com.phillippitts.fonemas.exception;

/**
 * Base exception for all fonemas application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class FonemasException extends RuntimeException {

    public FonemasException(String message) {
        super(message);
    }

    public FonemasException(String message, Throwable cause) {
        super(message, cause);
    }

    public FonemasException(Throwable cause) {
        super(cause);
    }
}
