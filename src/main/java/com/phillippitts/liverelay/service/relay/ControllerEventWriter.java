package com.phillippitts.liverelay.service.relay;

import com.phillippitts.liverelay.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.io.PrintStream;
import java.time.Clock;
import java.util.Objects;

/**
 * Writes controller events to stdout, one JSON object per line:
 * {@code {"type": ..., "data": {...}, "timestamp": 1730390400.125}}.
 *
 * <p>Called from the relay thread and from pipeline tasks; lines are never interleaved.
 */
public class ControllerEventWriter {

    private static final Logger LOG = LogManager.getLogger(ControllerEventWriter.class);

    private final PrintStream out;
    private final Clock clock;

    public ControllerEventWriter(PrintStream out) {
        this(out, Clock.systemUTC());
    }

    public ControllerEventWriter(PrintStream out, Clock clock) {
        this.out = Objects.requireNonNull(out, "out");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void emit(String type, JSONObject data) {
        JSONObject event = new JSONObject();
        event.put("type", type);
        event.put("data", data == null ? new JSONObject() : data);
        event.put("timestamp", TimeUtils.epochSeconds(clock.instant()));
        String line = event.toString();
        synchronized (this) {
            out.println(line);
            out.flush();
        }
        if (!"audio".equals(type) && LOG.isDebugEnabled()) {
            LOG.debug("Event {}: {}", type, line.length() > 200 ? line.substring(0, 200) + "..." : line);
        }
    }

    public void error(String message) {
        emit("error", new JSONObject().put("message", message));
    }

    public void status(boolean running, String message) {
        emit("status", new JSONObject().put("running", running).put("message", message));
    }
}
