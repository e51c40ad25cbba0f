package com.phillippitts.liverelay.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for tool invocations and tool server registrations.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Tool call latency per server</li>
 *   <li>Success/failure counts per server (failures tagged with a reason)</li>
 *   <li>Server registration outcomes</li>
 * </ul>
 */
public class ToolCallMetrics {

    private static final String METRIC_PREFIX = "liverelay.tools";

    private final MeterRegistry registry;

    public ToolCallMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records tool call latency.
     *
     * @param server server name
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String server, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".call.latency")
                .description("Time taken by a tool call")
                .tag("server", server)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String server) {
        Counter.builder(METRIC_PREFIX + ".call.success")
                .description("Number of successful tool calls")
                .tag("server", server)
                .register(registry)
                .increment();
    }

    /**
     * @param reason short failure reason (not_connected, error)
     */
    public void incrementFailure(String server, String reason) {
        Counter.builder(METRIC_PREFIX + ".call.failure")
                .description("Number of failed tool calls")
                .tag("server", server)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome added, rejected or failed
     */
    public void recordRegistration(String outcome) {
        Counter.builder(METRIC_PREFIX + ".registration")
                .description("Tool server registration attempts by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
