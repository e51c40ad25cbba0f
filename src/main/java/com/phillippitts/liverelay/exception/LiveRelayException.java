package com.phillippitts.liverelay.exception;

/**
 * Base exception for all Live Relay application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class LiveRelayException extends RuntimeException {

    public LiveRelayException(String message) {
        super(message);
    }

    public LiveRelayException(String message, Throwable cause) {
        super(message, cause);
    }

    public LiveRelayException(Throwable cause) {
        super(cause);
    }
}
