package com.phillippitts.liverelay.service.tools;

import com.phillippitts.liverelay.config.properties.ToolHostProperties;
import com.phillippitts.liverelay.testutil.ScriptedToolProcess;
import com.phillippitts.liverelay.testutil.ScriptedToolProcessFactory;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class ToolRpcClientTest {

    private ToolRpcClient client;

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.disconnect();
        }
    }

    private ToolRpcClient newClient(ScriptedToolProcessFactory factory, ToolHostProperties props) {
        client = new ToolRpcClient("calc", "calc-server", List.of("--stdio"), Map.of("CALC_MODE", "test"),
                factory, props);
        return client;
    }

    private ToolRpcClient newClient(ScriptedToolProcessFactory factory) {
        return newClient(factory, ToolHostProperties.defaults());
    }

    @Test
    void connectPerformsHandshakeAndListsTools() {
        // Arrange
        ScriptedToolProcessFactory factory = new ScriptedToolProcessFactory(ScriptedToolProcess::calculator);
        ToolRpcClient c = newClient(factory);

        // Act
        boolean connected = c.connect();

        // Assert
        assertThat(connected).isTrue();
        assertThat(c.isConnected()).isTrue();
        assertThat(c.getTools()).extracting(ToolDescriptor::name).containsExactly("add", "echo");
        assertThat(c.getTools()).allSatisfy(t -> assertThat(t.serverId()).isEqualTo("calc"));
        assertThat(factory.commands()).containsExactly(List.of("calc-server", "--stdio"));
        assertThat(factory.envs().get(0)).containsEntry("CALC_MODE", "test");

        ScriptedToolProcess server = factory.last();
        assertThat(server.receivedMethods())
                .containsExactly("initialize", "notifications/initialized", "tools/list");
        JSONObject init = server.received().get(0);
        assertThat(init.getString("jsonrpc")).isEqualTo("2.0");
        JSONObject params = init.getJSONObject("params");
        assertThat(params.getString("protocolVersion")).isEqualTo("2024-11-05");
        assertThat(params.getJSONObject("clientInfo").getString("name")).isEqualTo("live-relay");
        assertThat(server.received().get(1).has("id")).isFalse();
    }

    @Test
    void connectIsNoOpWhenAlreadyConnected() {
        ScriptedToolProcessFactory factory = new ScriptedToolProcessFactory(ScriptedToolProcess::calculator);
        ToolRpcClient c = newClient(factory);

        assertThat(c.connect()).isTrue();
        assertThat(c.connect()).isTrue();

        assertThat(factory.started()).hasSize(1);
    }

    @Test
    void requestIdsStrictlyIncrease() {
        ScriptedToolProcessFactory factory = new ScriptedToolProcessFactory(ScriptedToolProcess::calculator);
        ToolRpcClient c = newClient(factory);
        c.connect();

        c.executeTool("add", new JSONObject().put("a", 1).put("b", 1));
        c.executeTool("echo", new JSONObject().put("text", "x"));

        assertThat(factory.last().requestIds()).containsExactly(1L, 2L, 3L, 4L);
    }

    @Test
    void executeToolReturnsServerResult() {
        // Arrange
        ScriptedToolProcessFactory factory = new ScriptedToolProcessFactory(ScriptedToolProcess::calculator);
        ToolRpcClient c = newClient(factory);
        c.connect();

        // Act
        ToolResult result = c.executeTool("add", new JSONObject().put("a", 2).put("b", 3));

        // Assert
        assertThat(result.success()).isTrue();
        assertThat(result.server()).isEqualTo("calc");
        assertThat(result.tool()).isEqualTo("add");
        JSONObject data = (JSONObject) result.data();
        assertThat(data.getJSONArray("content").getJSONObject(0).getString("text")).isEqualTo("5");
        JSONObject call = factory.last().received().get(3);
        assertThat(call.getString("method")).isEqualTo("tools/call");
        assertThat(call.getJSONObject("params").getString("name")).isEqualTo("add");
        assertThat(call.getJSONObject("params").getJSONObject("arguments").getInt("b")).isEqualTo(3);
    }

    @Test
    void serverErrorBecomesFailureEnvelope() {
        ScriptedToolProcessFactory factory = new ScriptedToolProcessFactory(ScriptedToolProcess::calculator);
        ToolRpcClient c = newClient(factory);
        c.connect();

        ToolResult result = c.executeTool("multiply", new JSONObject());

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Unknown tool: multiply");
        assertThat(c.isConnected()).isTrue();
    }

    @Test
    void unrelatedLinesAreSkippedWhileAwaitingResponse() {
        ScriptedToolProcessFactory factory = new ScriptedToolProcessFactory(
                () -> ScriptedToolProcess.calculator().withNoise());
        ToolRpcClient c = newClient(factory);

        assertThat(c.connect()).isTrue();
        ToolResult result = c.executeTool("echo", new JSONObject().put("text", "hi"));

        assertThat(result.success()).isTrue();
        assertThat(((JSONObject) result.data()).getJSONArray("content").getJSONObject(0).getString("text"))
                .isEqualTo("hi");
    }

    @Test
    void unansweredRequestTimesOut() {
        // Arrange
        ScriptedToolProcessFactory factory = new ScriptedToolProcessFactory(
                () -> ScriptedToolProcess.calculator().silentOn("tools/call"));
        ToolRpcClient c = newClient(factory, new ToolHostProperties(200L, 200L, null, null, null));
        c.connect();

        // Act
        long start = System.nanoTime();
        ToolResult result = c.executeTool("add", new JSONObject().put("a", 1).put("b", 2));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        // Assert
        assertThat(result.success()).isFalse();
        assertThat(result.error()).startsWith("Request timeout").contains("method=tools/call");
        assertThat(elapsedMs).isGreaterThanOrEqualTo(150);
    }

    @Test
    void closedOutputFailsPendingRequestAndMarksDisconnected() {
        ScriptedToolProcessFactory factory = new ScriptedToolProcessFactory(
                () -> ScriptedToolProcess.calculator().exitOn("tools/call"));
        ToolRpcClient c = newClient(factory);
        c.connect();

        ToolResult result = c.executeTool("add", new JSONObject().put("a", 1).put("b", 2));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).startsWith("No response from server");
        await().atMost(2, TimeUnit.SECONDS).until(() -> !c.isConnected());
    }

    @Test
    void malformedResponseFailsTheRequest() {
        ScriptedToolProcessFactory factory = new ScriptedToolProcessFactory(
                () -> ScriptedToolProcess.calculator().malformedOn("tools/call"));
        ToolRpcClient c = newClient(factory);
        c.connect();

        ToolResult result = c.executeTool("add", new JSONObject());

        assertThat(result.success()).isFalse();
        assertThat(result.error()).startsWith("Malformed response");
    }

    @Test
    void failedHandshakeLeavesClientDisconnected() {
        // Arrange
        ScriptedToolProcessFactory factory = new ScriptedToolProcessFactory(
                () -> ScriptedToolProcess.calculator().errorOn("initialize", "unsupported protocol"));
        ToolRpcClient c = newClient(factory);

        // Act
        boolean connected = c.connect();

        // Assert
        assertThat(connected).isFalse();
        assertThat(c.isConnected()).isFalse();
        assertThat(c.getTools()).isEmpty();
        assertThat(factory.last().wasDestroyCalled()).isTrue();
        assertThat(factory.last().isAlive()).isFalse();
    }

    @Test
    void processStartFailureLeavesClientDisconnected() {
        ScriptedToolProcessFactory factory = new ScriptedToolProcessFactory(ScriptedToolProcess::calculator)
                .failWith(new IOException("Cannot run program \"calc-server\""));
        ToolRpcClient c = newClient(factory);

        assertThat(c.connect()).isFalse();
        assertThat(c.isConnected()).isFalse();
        assertThat(factory.started()).isEmpty();
    }

    @Test
    void failingToolListStillConnectsWithEmptyCatalog() {
        ScriptedToolProcessFactory factory = new ScriptedToolProcessFactory(
                () -> ScriptedToolProcess.calculator().errorOn("tools/list", "listing disabled"));
        ToolRpcClient c = newClient(factory);

        assertThat(c.connect()).isTrue();

        assertThat(c.getTools()).isEmpty();
    }

    @Test
    void executeToolBeforeConnectFailsWithoutIo() {
        ScriptedToolProcessFactory factory = new ScriptedToolProcessFactory(ScriptedToolProcess::calculator);
        ToolRpcClient c = newClient(factory);

        ToolResult result = c.executeTool("add", new JSONObject());

        assertThat(result.success()).isFalse();
        assertThat(result.error()).startsWith("Server process not started");
        assertThat(factory.started()).isEmpty();
    }

    @Test
    void disconnectIsIdempotentAndClearsState() {
        ScriptedToolProcessFactory factory = new ScriptedToolProcessFactory(ScriptedToolProcess::calculator);
        ToolRpcClient c = newClient(factory);
        c.connect();

        c.disconnect();
        c.disconnect();

        assertThat(c.isConnected()).isFalse();
        assertThat(c.getTools()).isEmpty();
        assertThat(c.getStatus().toolCount()).isZero();
        assertThat(factory.last().wasDestroyCalled()).isTrue();
        assertThat(factory.last().wasForciblyDestroyed()).isFalse();
    }

    @Test
    void disconnectKillsServerIgnoringTermination() {
        ScriptedToolProcessFactory factory = new ScriptedToolProcessFactory(
                () -> ScriptedToolProcess.calculator().ignoringTerminate());
        ToolRpcClient c = newClient(factory, new ToolHostProperties(1_000L, 100L, null, null, null));
        c.connect();

        c.disconnect();

        assertThat(factory.last().wasForciblyDestroyed()).isTrue();
        assertThat(factory.last().isAlive()).isFalse();
    }

    @Test
    void stderrOutputDoesNotDisturbTheProtocol() {
        ScriptedToolProcessFactory factory = new ScriptedToolProcessFactory(
                () -> ScriptedToolProcess.calculator().logToStderr("starting calc").logToStderr("ready"));
        ToolRpcClient c = newClient(factory);

        assertThat(c.connect()).isTrue();
        assertThat(c.executeTool("add", new JSONObject().put("a", 1).put("b", 1)).success()).isTrue();
    }

    @Test
    void statusReflectsConnectionAndCatalog() {
        ScriptedToolProcessFactory factory = new ScriptedToolProcessFactory(ScriptedToolProcess::calculator);
        ToolRpcClient c = newClient(factory);
        c.connect();

        ServerStatus status = c.getStatus();

        assertThat(status.server()).isEqualTo("calc");
        assertThat(status.connected()).isTrue();
        assertThat(status.toolCount()).isEqualTo(2);
        assertThat(status.tools()).containsExactly("add", "echo");
    }
}
