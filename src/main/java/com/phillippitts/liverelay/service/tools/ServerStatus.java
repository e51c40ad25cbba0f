package com.phillippitts.liverelay.service.tools;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;

/**
 * Snapshot of one tool server connection.
 */
public record ServerStatus(String server, boolean connected, int toolCount, List<String> tools) {

    public ServerStatus {
        tools = List.copyOf(tools);
    }

    public JSONObject toJson() {
        return new JSONObject()
                .put("server", server)
                .put("connected", connected)
                .put("tool_count", toolCount)
                .put("tools", new JSONArray(tools));
    }
}
