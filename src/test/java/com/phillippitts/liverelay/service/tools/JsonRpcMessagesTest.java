package com.phillippitts.liverelay.service.tools;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonRpcMessagesTest {

    @Test
    void requestCarriesIdMethodAndParams() {
        JSONObject msg = new JSONObject(JsonRpcMessages.request(7, "tools/call",
                JsonRpcMessages.callParams("add", new JSONObject().put("a", 1))));

        assertThat(msg.getString("jsonrpc")).isEqualTo("2.0");
        assertThat(msg.getLong("id")).isEqualTo(7L);
        assertThat(msg.getString("method")).isEqualTo("tools/call");
        assertThat(msg.getJSONObject("params").getString("name")).isEqualTo("add");
        assertThat(msg.getJSONObject("params").getJSONObject("arguments").getInt("a")).isEqualTo(1);
    }

    @Test
    void requestWithoutParamsOmitsMember() {
        JSONObject msg = new JSONObject(JsonRpcMessages.request(1, "tools/list", null));

        assertThat(msg.has("params")).isFalse();
    }

    @Test
    void messagesAreSingleLine() {
        String line = JsonRpcMessages.request(3, "tools/call",
                JsonRpcMessages.callParams("echo", new JSONObject().put("text", "line one\nline two")));

        assertThat(line).doesNotContain("\n");
    }

    @Test
    void notificationHasNoId() {
        JSONObject msg = new JSONObject(JsonRpcMessages.notification(JsonRpcMessages.INITIALIZED));

        assertThat(msg.has("id")).isFalse();
        assertThat(msg.getString("method")).isEqualTo("notifications/initialized");
    }

    @Test
    void callParamsDefaultsMissingArguments() {
        JSONObject params = JsonRpcMessages.callParams("add", null);

        assertThat(params.getJSONObject("arguments").isEmpty()).isTrue();
    }

    @Test
    void initializeParamsAnnounceClient() {
        JSONObject params = JsonRpcMessages.initializeParams("2024-11-05", "live-relay", "1.0.0");

        assertThat(params.getString("protocolVersion")).isEqualTo("2024-11-05");
        assertThat(params.getJSONObject("capabilities").isEmpty()).isTrue();
        assertThat(params.getJSONObject("clientInfo").getString("version")).isEqualTo("1.0.0");
    }

    @Test
    void responseIdHandlesNumbersStringsAndMissingIds() {
        assertThat(JsonRpcMessages.responseId(new JSONObject("{\"id\":5}"))).isEqualTo(5L);
        assertThat(JsonRpcMessages.responseId(new JSONObject("{\"id\":\"6\"}"))).isEqualTo(6L);
        assertThat(JsonRpcMessages.responseId(new JSONObject("{\"id\":\"abc\"}"))).isEqualTo(-1L);
        assertThat(JsonRpcMessages.responseId(new JSONObject("{\"id\":null}"))).isEqualTo(-1L);
        assertThat(JsonRpcMessages.responseId(new JSONObject("{\"method\":\"ping\"}"))).isEqualTo(-1L);
    }
}
