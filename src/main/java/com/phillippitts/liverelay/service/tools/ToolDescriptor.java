package com.phillippitts.liverelay.service.tools;

import org.json.JSONObject;

import java.util.Objects;

/**
 * Tool advertised by a server in its {@code tools/list} catalog.
 *
 * @param serverId    name of the hosting server
 * @param name        tool name, unique within its server
 * @param description human-readable description (may be empty)
 * @param inputSchema JSON schema of the arguments (may be empty)
 */
public record ToolDescriptor(String serverId, String name, String description, JSONObject inputSchema) {

    public ToolDescriptor {
        Objects.requireNonNull(serverId, "serverId");
        Objects.requireNonNull(name, "name");
        description = description == null ? "" : description;
        inputSchema = inputSchema == null ? new JSONObject() : new JSONObject(inputSchema.toString());
    }

    /**
     * Reads one catalog entry.
     *
     * @return the descriptor, or {@code null} when the entry has no name
     */
    static ToolDescriptor fromCatalogEntry(String serverId, JSONObject entry) {
        String name = entry.optString("name", "");
        if (name.isEmpty()) {
            return null;
        }
        return new ToolDescriptor(serverId, name, entry.optString("description", ""),
                entry.optJSONObject("inputSchema"));
    }

    @Override
    public JSONObject inputSchema() {
        return new JSONObject(inputSchema.toString());
    }

    /** Key of this tool in the aggregate registry: {@code server_tool}. */
    public String registryKey() {
        return serverId + "_" + name;
    }

    /** Catalog form: {@code {name, description, inputSchema}}. */
    public JSONObject toCatalogJson() {
        return new JSONObject()
                .put("name", name)
                .put("description", description)
                .put("inputSchema", inputSchema());
    }

    /** Aggregate registry form: {@code {server, name, description, inputSchema}}. */
    public JSONObject toRegistryJson() {
        return toCatalogJson().put("server", serverId);
    }
}
