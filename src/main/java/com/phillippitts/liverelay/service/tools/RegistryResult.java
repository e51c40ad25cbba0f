package com.phillippitts.liverelay.service.tools;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;

/**
 * Outcome of a registration change ({@code addServer} / {@code removeServer}).
 *
 * @param success whether the change was applied
 * @param server  server name for successful additions, otherwise {@code null}
 * @param tools   catalog of an added server; empty otherwise
 * @param error   failure message, otherwise {@code null}
 */
public record RegistryResult(boolean success, String server, List<ToolDescriptor> tools, String error) {

    public RegistryResult {
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public static RegistryResult added(String server, List<ToolDescriptor> tools) {
        return new RegistryResult(true, server, tools, null);
    }

    public static RegistryResult removed() {
        return new RegistryResult(true, null, List.of(), null);
    }

    public static RegistryResult failure(String error) {
        return new RegistryResult(false, null, List.of(), error);
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject().put("success", success);
        if (!success) {
            return json.put("error", error);
        }
        if (server != null) {
            JSONArray catalog = new JSONArray();
            for (ToolDescriptor tool : tools) {
                catalog.put(tool.toCatalogJson());
            }
            json.put("server", server).put("tools", catalog);
        }
        return json;
    }
}
