package com.phillippitts.liverelay.exception;

/**
 * Thrown when a controller command line cannot be decoded: malformed JSON,
 * an unknown command name, or a missing/invalid required field.
 */
public class InvalidCommandException extends LiveRelayException {

    private final String command;

    public InvalidCommandException(String message) {
        super(message);
        this.command = null;
    }

    public InvalidCommandException(String command, String message) {
        super(message);
        this.command = command;
    }

    public InvalidCommandException(String message, Throwable cause) {
        super(message, cause);
        this.command = null;
    }

    /** Command name when it could be read before the failure, otherwise {@code null}. */
    public String getCommand() {
        return command;
    }
}
