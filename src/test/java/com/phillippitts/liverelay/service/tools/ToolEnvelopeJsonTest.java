package com.phillippitts.liverelay.service.tools;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ToolEnvelopeJsonTest {

    private static final ToolDescriptor ADD = new ToolDescriptor("calc", "add", "Add two numbers",
            new JSONObject().put("type", "object"));

    @Test
    void catalogEntryWithoutNameIsSkipped() {
        assertThat(ToolDescriptor.fromCatalogEntry("calc", new JSONObject().put("description", "x"))).isNull();
    }

    @Test
    void catalogEntryDefaultsOptionalMembers() {
        ToolDescriptor tool = ToolDescriptor.fromCatalogEntry("calc", new JSONObject().put("name", "add"));

        assertThat(tool.description()).isEmpty();
        assertThat(tool.inputSchema().isEmpty()).isTrue();
        assertThat(tool.registryKey()).isEqualTo("calc_add");
    }

    @Test
    void descriptorJsonForms() {
        JSONObject catalog = ADD.toCatalogJson();
        JSONObject registry = ADD.toRegistryJson();

        assertThat(catalog.keySet()).containsExactlyInAnyOrder("name", "description", "inputSchema");
        assertThat(registry.getString("server")).isEqualTo("calc");
        assertThat(registry.getJSONObject("inputSchema").getString("type")).isEqualTo("object");
    }

    @Test
    void inputSchemaIsDefensivelyCopied() {
        ADD.inputSchema().put("mutated", true);

        assertThat(ADD.inputSchema().has("mutated")).isFalse();
    }

    @Test
    void inputSchemaKeepsExplicitNullMembers() {
        // Arrange
        JSONObject schema = new JSONObject("{\"type\":\"object\",\"properties\":"
                + "{\"unit\":{\"type\":\"string\",\"default\":null}}}");

        // Act
        ToolDescriptor tool = new ToolDescriptor("weather", "forecast", "", schema);

        // Assert
        JSONObject unit = tool.toRegistryJson().getJSONObject("inputSchema")
                .getJSONObject("properties").getJSONObject("unit");
        assertThat(unit.has("default")).isTrue();
        assertThat(unit.isNull("default")).isTrue();
    }

    @Test
    void toolResultSuccessCarriesData() {
        JSONObject json = ToolResult.success(new JSONObject().put("value", 5), "calc", "add").toJson();

        assertThat(json.getBoolean("success")).isTrue();
        assertThat(json.getJSONObject("data").getInt("value")).isEqualTo(5);
        assertThat(json.has("error")).isFalse();
        assertThat(json.getString("server")).isEqualTo("calc");
        assertThat(json.getString("tool")).isEqualTo("add");
    }

    @Test
    void toolResultFailureCarriesError() {
        JSONObject json = ToolResult.failure(null, "calc", "add").toJson();

        assertThat(json.getBoolean("success")).isFalse();
        assertThat(json.getString("error")).isEqualTo("Unknown error");
        assertThat(json.has("data")).isFalse();
    }

    @Test
    void registryResultForms() {
        JSONObject added = RegistryResult.added("calc", List.of(ADD)).toJson();
        JSONObject failed = RegistryResult.failure("Server calc already connected").toJson();

        assertThat(added.getBoolean("success")).isTrue();
        assertThat(added.getString("server")).isEqualTo("calc");
        assertThat(added.getJSONArray("tools").getJSONObject(0).getString("name")).isEqualTo("add");
        assertThat(failed.getBoolean("success")).isFalse();
        assertThat(failed.getString("error")).isEqualTo("Server calc already connected");
    }

    @Test
    void serverStatusJson() {
        JSONObject json = new ServerStatus("calc", true, 2, List.of("add", "echo")).toJson();

        assertThat(json.getInt("tool_count")).isEqualTo(2);
        assertThat(json.getJSONArray("tools").toList()).containsExactly("add", "echo");
        assertThat(json.getBoolean("connected")).isTrue();
    }
}
