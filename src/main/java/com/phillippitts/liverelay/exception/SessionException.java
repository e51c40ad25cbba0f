package com.phillippitts.liverelay.exception;

/**
 * Thrown when the realtime AI session cannot be opened or has failed irrecoverably.
 */
public class SessionException extends LiveRelayException {

    public SessionException(String message) {
        super(message);
    }

    public SessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
