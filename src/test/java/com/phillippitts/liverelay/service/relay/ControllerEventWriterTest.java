package com.phillippitts.liverelay.service.relay;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ControllerEventWriterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(1_730_390_400_125L), ZoneOffset.UTC);

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final ControllerEventWriter writer =
            new ControllerEventWriter(new PrintStream(buffer, true, StandardCharsets.UTF_8), CLOCK);

    private List<JSONObject> lines() {
        List<JSONObject> events = new ArrayList<>();
        for (String line : buffer.toString(StandardCharsets.UTF_8).split("\n")) {
            if (!line.isBlank()) {
                events.add(new JSONObject(line));
            }
        }
        return events;
    }

    @Test
    void emitWritesTypeDataAndTimestamp() {
        writer.emit("text", new JSONObject().put("text", "hi"));

        JSONObject event = lines().get(0);
        assertThat(event.getString("type")).isEqualTo("text");
        assertThat(event.getJSONObject("data").getString("text")).isEqualTo("hi");
        assertThat(event.getDouble("timestamp")).isEqualTo(1_730_390_400.125);
    }

    @Test
    void nullDataBecomesEmptyObject() {
        writer.emit("transcription_stopped", null);

        assertThat(lines().get(0).getJSONObject("data").isEmpty()).isTrue();
    }

    @Test
    void errorAndStatusShapes() {
        writer.error("boom");
        writer.status(false, "Stopped");

        List<JSONObject> events = lines();
        assertThat(events.get(0).getString("type")).isEqualTo("error");
        assertThat(events.get(0).getJSONObject("data").getString("message")).isEqualTo("boom");
        assertThat(events.get(1).getString("type")).isEqualTo("status");
        assertThat(events.get(1).getJSONObject("data").getBoolean("running")).isFalse();
        assertThat(events.get(1).getJSONObject("data").getString("message")).isEqualTo("Stopped");
    }

    @Test
    void embeddedNewlinesStayOnOneLine() {
        writer.emit("text", new JSONObject().put("text", "line one\nline two"));

        assertThat(lines()).singleElement()
                .satisfies(e -> assertThat(e.getJSONObject("data").getString("text")).isEqualTo("line one\nline two"));
    }

    @Test
    void concurrentEmittersNeverInterleave() throws Exception {
        // Arrange
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch go = new CountDownLatch(1);
        String payload = "x".repeat(2_000);

        // Act
        for (int t = 0; t < 4; t++) {
            pool.submit(() -> {
                go.await();
                for (int i = 0; i < 50; i++) {
                    writer.emit("audio", new JSONObject().put("data", payload));
                }
                return null;
            });
        }
        go.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        // Assert: every line parses on its own
        assertThat(lines()).hasSize(200)
                .allSatisfy(e -> assertThat(e.getJSONObject("data").getString("data")).hasSize(2_000));
    }
}
