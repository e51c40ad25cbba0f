package com.phillippitts.liverelay.service.tools;

import org.json.JSONObject;

/**
 * JSON-RPC 2.0 message construction for the tool server protocol.
 *
 * <p>Every message is serialized as a single line; org.json escapes embedded newlines.
 */
final class JsonRpcMessages {

    static final String VERSION = "2.0";

    static final String INITIALIZE = "initialize";
    static final String INITIALIZED = "notifications/initialized";
    static final String TOOLS_LIST = "tools/list";
    static final String TOOLS_CALL = "tools/call";

    private JsonRpcMessages() {}

    /**
     * @param params request parameters, or {@code null} to omit the member
     */
    static String request(long id, String method, JSONObject params) {
        JSONObject msg = new JSONObject()
                .put("jsonrpc", VERSION)
                .put("id", id)
                .put("method", method);
        if (params != null) {
            msg.put("params", params);
        }
        return msg.toString();
    }

    /** Notification: no id, no response expected. */
    static String notification(String method) {
        return new JSONObject()
                .put("jsonrpc", VERSION)
                .put("method", method)
                .toString();
    }

    static JSONObject initializeParams(String protocolVersion, String clientName, String clientVersion) {
        return new JSONObject()
                .put("protocolVersion", protocolVersion)
                .put("capabilities", new JSONObject())
                .put("clientInfo", new JSONObject()
                        .put("name", clientName)
                        .put("version", clientVersion));
    }

    static JSONObject callParams(String toolName, JSONObject arguments) {
        return new JSONObject()
                .put("name", toolName)
                .put("arguments", arguments == null ? new JSONObject() : arguments);
    }

    /**
     * Extracts the numeric id of a response.
     *
     * @return the id, or {@code -1} for notifications and server requests without a numeric id
     */
    static long responseId(JSONObject message) {
        if (!message.has("id") || message.isNull("id")) {
            return -1;
        }
        Object id = message.get("id");
        if (id instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(String.valueOf(id));
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
