package com.phillippitts.liverelay.service.tools;

import org.json.JSONObject;

/**
 * Outcome envelope of a tool invocation; never thrown, always returned.
 *
 * @param success whether the server returned a result
 * @param data    the JSON-RPC {@code result} on success, otherwise {@code null}
 * @param error   failure message, otherwise {@code null}
 * @param server  server name
 * @param tool    tool name
 */
public record ToolResult(boolean success, Object data, String error, String server, String tool) {

    public static ToolResult success(Object data, String server, String tool) {
        return new ToolResult(true, data, null, server, tool);
    }

    public static ToolResult failure(String error, String server, String tool) {
        return new ToolResult(false, null, error == null ? "Unknown error" : error, server, tool);
    }

    /** Wire form: {@code {success, data or error, server, tool}}. */
    public JSONObject toJson() {
        JSONObject json = new JSONObject().put("success", success);
        if (success) {
            json.put("data", data == null ? JSONObject.NULL : data);
        } else {
            json.put("error", error);
        }
        return json.put("server", server == null ? JSONObject.NULL : server)
                .put("tool", tool == null ? JSONObject.NULL : tool);
    }
}
