package com.phillippitts.liverelay.exception;

/**
 * Thrown when a JSON-RPC exchange with a tool server process fails.
 * This may occur because the process is not running, the request timed out,
 * the pipe closed, or the response line was not valid JSON.
 */
public class ToolRpcException extends LiveRelayException {

    private final String serverName;

    public ToolRpcException(String message) {
        super(message);
        this.serverName = "unknown";
    }

    public ToolRpcException(String message, String serverName) {
        super(message);
        this.serverName = serverName;
    }

    public ToolRpcException(String message, String serverName, Throwable cause) {
        super(message, cause);
        this.serverName = serverName;
    }

    public String getServerName() {
        return serverName;
    }
}
