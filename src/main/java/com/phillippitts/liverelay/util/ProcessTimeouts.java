package com.phillippitts.liverelay.util;

import java.time.Duration;

/**
 * Standard timeout values for process and thread management.
 *
 * <p>Used by {@link com.phillippitts.liverelay.service.tools.ToolRpcClient} for tool-server
 * subprocess teardown and by {@link com.phillippitts.liverelay.service.pipeline.StreamPipeline}
 * for task teardown. Request timeouts are configurable and live in
 * {@link com.phillippitts.liverelay.config.properties.ToolHostProperties}.
 *
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Default wait for a tool server to exit after {@link Process#destroy()} before it is
     * forcibly killed.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Wait after {@link Process#destroyForcibly()}. Processes that survive this are reported
     * and abandoned.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Wait for the stdout/stderr reader threads of a tool server once its pipes are closed.
     */
    public static final Duration READER_JOIN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Wait for the realtime session to close its transport.
     */
    public static final Duration SESSION_CLOSE_TIMEOUT = Duration.ofSeconds(2);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
