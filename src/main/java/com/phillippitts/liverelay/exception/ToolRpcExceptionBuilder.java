package com.phillippitts.liverelay.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing {@link ToolRpcException} with contextual information.
 *
 * <p>Keeps the exception message format identical across every failure path of the
 * JSON-RPC client (timeout, closed pipe, malformed line).
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw ToolRpcExceptionBuilder.create("Request timeout")
 *         .server("calc")
 *         .method("tools/call")
 *         .requestId(7)
 *         .durationMs(30000)
 *         .build();
 *
 * throw ToolRpcExceptionBuilder.create("Malformed response")
 *         .server("calc")
 *         .cause(jsonException)
 *         .metadata("line", snippet)
 *         .build();
 * </pre>
 */
public final class ToolRpcExceptionBuilder {

    private final String message;
    private String serverName;
    private Throwable cause;
    private String method;
    private Long requestId;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ToolRpcExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static ToolRpcExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ToolRpcExceptionBuilder(message);
    }

    public ToolRpcExceptionBuilder server(String serverName) {
        this.serverName = serverName;
        return this;
    }

    public ToolRpcExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ToolRpcExceptionBuilder method(String method) {
        this.method = method;
        return this;
    }

    public ToolRpcExceptionBuilder requestId(long requestId) {
        this.requestId = requestId;
        return this;
    }

    public ToolRpcExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message.
     *
     * @param key metadata key
     * @param value metadata value; ignored when null
     * @return this builder for chaining
     */
    public ToolRpcExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception.
     *
     * <p>The message starts with the base message, so callers that surface
     * {@link Throwable#getMessage()} (for example in a tool result envelope) still lead with
     * "Request timeout" or similar. Details follow in parentheses:
     * <pre>
     * {message} (method={method}, id={id}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     *
     * @return constructed ToolRpcException
     */
    public ToolRpcException build() {
        String detailed = buildDetailedMessage();
        String server = serverName != null ? serverName : "unknown";
        if (cause != null) {
            return new ToolRpcException(detailed, server, cause);
        }
        return new ToolRpcException(detailed, server);
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (method != null) {
            details.put("method", method);
        }
        if (requestId != null) {
            details.put("id", String.valueOf(requestId));
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);
        if (details.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
