package com.phillippitts.liverelay.service.relay;

import com.phillippitts.liverelay.config.properties.PipelineProperties;
import com.phillippitts.liverelay.domain.VideoMode;
import com.phillippitts.liverelay.exception.InvalidCommandException;
import com.phillippitts.liverelay.service.capture.CaptureErrorEvent;
import com.phillippitts.liverelay.service.channel.ChannelClosedException;
import com.phillippitts.liverelay.service.pipeline.QueuedTurnIntake;
import com.phillippitts.liverelay.service.pipeline.StreamPipeline;
import com.phillippitts.liverelay.service.pipeline.StreamPipelineFactory;
import com.phillippitts.liverelay.service.tools.ServerStatus;
import com.phillippitts.liverelay.service.tools.ToolDescriptor;
import com.phillippitts.liverelay.service.tools.ToolHostRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.context.event.EventListener;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Bridges an external controller (stdin commands, stdout events) to the streaming pipeline and
 * the tool host registry.
 *
 * <p>Commands are handled one at a time on the thread calling {@link #run(InputStream)}; model
 * output reaches the controller through a {@link ControllerEventSink} on pipeline threads.
 *
 * <p>End of input stops the pipeline and disconnects every tool server.
 *
 * @since 1.0
 */
public class CommandRelay implements CommandHandler {

    private static final Logger LOG = LogManager.getLogger(CommandRelay.class);

    static final String MDC_COMMAND = "command";

    private final StreamPipeline pipeline;
    private final ToolHostRegistry registry;
    private final ControllerEventWriter events;
    private final TranscriptionTracker transcription;
    private final VideoMode defaultMode;

    private volatile boolean active;
    private QueuedTurnIntake intake;

    public CommandRelay(StreamPipelineFactory pipelineFactory,
                        ToolHostRegistry registry,
                        ControllerEventWriter events,
                        PipelineProperties props) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.events = Objects.requireNonNull(events, "events");
        this.defaultMode = props.getDefaultVideoMode();
        this.transcription = new TranscriptionTracker();
        this.pipeline = pipelineFactory.create(new ControllerEventSink(events, transcription));
    }

    /**
     * Emits {@code ready}, then processes command lines until end of input.
     */
    public void run(InputStream in) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        active = true;
        events.emit("ready", new JSONObject().put("message", "Gemini Live service ready"));
        LOG.info("Controller relay ready");
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                handleLine(line);
            }
            LOG.info("Controller input closed");
        } finally {
            active = false;
            shutdown();
        }
    }

    /**
     * Decodes and dispatches one command line. Failures become {@code error} events.
     */
    void handleLine(String line) {
        ControllerCommand command;
        try {
            command = CommandDecoder.decode(line);
        } catch (InvalidCommandException e) {
            LOG.warn("Rejected controller command: {}", e.getMessage());
            events.error(e.getMessage());
            return;
        }
        ThreadContext.put(MDC_COMMAND, command.name());
        try {
            LOG.debug("Dispatching {}", command.name());
            command.dispatch(this);
        } catch (RuntimeException e) {
            LOG.error("Command {} failed", command.name(), e);
            events.error(e.getMessage() == null ? e.toString() : e.getMessage());
        } finally {
            ThreadContext.remove(MDC_COMMAND);
        }
    }

    /** Relay-side cleanup; safe to call more than once. */
    public void shutdown() {
        stopPipeline();
        registry.shutdown();
    }

    public boolean isPipelineRunning() {
        return pipeline.isRunning();
    }

    @Override
    public void onStart(ControllerCommand.Start command) {
        if (pipeline.isRunning()) {
            events.error("Session already running");
            return;
        }
        VideoMode mode = command.mode() == null ? defaultMode : command.mode();
        QueuedTurnIntake newIntake = new QueuedTurnIntake();
        try {
            pipeline.start(mode, newIntake);
        } catch (IOException e) {
            LOG.warn("Failed to start live session: {}", e.getMessage());
            events.error("Failed to start session: " + e.getMessage());
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            events.error("Interrupted while starting session");
            return;
        }
        synchronized (this) {
            intake = newIntake;
        }
        events.emit("status", new JSONObject()
                .put("running", true)
                .put("message", "Starting Gemini Live session")
                .put("mode", mode.wireName()));
    }

    @Override
    public void onStop(ControllerCommand.Stop command) {
        stopPipeline();
        events.status(false, "Stopped Gemini Live session");
    }

    @Override
    public void onMessage(ControllerCommand.Message command) {
        QueuedTurnIntake current;
        synchronized (this) {
            current = intake;
        }
        if (!pipeline.isRunning() || current == null) {
            events.error("Cannot send message: session not running");
            return;
        }
        if (command.image() != null) {
            try {
                pipeline.enqueue(command.image());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                events.error("Interrupted while queueing image");
                return;
            }
        }
        if (command.text() != null && !command.text().isEmpty()) {
            try {
                current.submit(transcription.prepare(command.text()));
            } catch (ChannelClosedException e) {
                events.error("Cannot send message: session not running");
            }
        }
    }

    @Override
    public void onInterrupt(ControllerCommand.Interrupt command) {
        int discarded = pipeline.interrupt();
        LOG.info("Playback interrupted; {} fragments discarded", discarded);
        events.emit("status", new JSONObject()
                .put("running", pipeline.isRunning())
                .put("message", "Playback interrupted")
                .put("discarded", discarded));
    }

    @Override
    public void onStartTranscription(ControllerCommand.StartTranscription command) {
        transcription.start();
        if (pipeline.isRunning()) {
            events.emit("transcription_started",
                    new JSONObject().put("message", "Transcription mode enabled, listening for audio"));
        } else {
            events.error("Cannot start transcription: session not ready");
        }
    }

    @Override
    public void onStopTranscription(ControllerCommand.StopTranscription command) {
        Optional<String> text = transcription.stop();
        text.ifPresent(t -> events.emit("transcription_final", new JSONObject().put("text", t)));
        events.emit("transcription_stopped", new JSONObject());
    }

    @Override
    public void onAddServer(ControllerCommand.AddServer command) {
        events.emit("mcp_server_added", registry.addServer(
                command.serverName(), command.serverCommand(), command.serverArgs(), command.serverEnv())
                .toJson());
    }

    @Override
    public void onRemoveServer(ControllerCommand.RemoveServer command) {
        events.emit("mcp_server_removed", registry.removeServer(command.serverName()).toJson());
    }

    @Override
    public void onGetTools(ControllerCommand.GetTools command) {
        JSONObject tools = new JSONObject();
        for (Map.Entry<String, ToolDescriptor> e : registry.getAllTools().entrySet()) {
            tools.put(e.getKey(), e.getValue().toRegistryJson());
        }
        events.emit("mcp_tools_response", new JSONObject().put("tools", tools));
    }

    @Override
    public void onGetServerTools(ControllerCommand.GetServerTools command) {
        Optional<List<ToolDescriptor>> tools = registry.getServerTools(command.serverName());
        if (tools.isEmpty()) {
            events.error("Server " + command.serverName() + " not found");
            return;
        }
        JSONArray catalog = new JSONArray();
        for (ToolDescriptor tool : tools.get()) {
            catalog.put(tool.toCatalogJson());
        }
        events.emit("mcp_server_tools_response", new JSONObject()
                .put("server", command.serverName())
                .put("tools", catalog));
    }

    @Override
    public void onExecuteTool(ControllerCommand.ExecuteTool command) {
        events.emit("mcp_tool_result",
                registry.executeTool(command.server(), command.tool(), command.params()).toJson());
    }

    @Override
    public void onGetStatus(ControllerCommand.GetStatus command) {
        if (command.serverName() != null) {
            Optional<ServerStatus> status = registry.getStatus(command.serverName());
            events.emit("mcp_status_response", status.map(ServerStatus::toJson)
                    .orElseGet(() -> new JSONObject().put("error", "Server " + command.serverName() + " not found")));
            return;
        }
        JSONObject all = new JSONObject();
        for (Map.Entry<String, ServerStatus> e : registry.getStatus().entrySet()) {
            all.put(e.getKey(), e.getValue().toJson());
        }
        events.emit("mcp_status_response", all);
    }

    /**
     * Reports device failures to the controller while the relay is running.
     */
    @EventListener
    public void onCaptureError(CaptureErrorEvent event) {
        if (!active) {
            return;
        }
        events.emit("status", new JSONObject()
                .put("running", pipeline.isRunning())
                .put("message", "Device error: " + event.source() + " " + event.reason())
                .put("source", event.source())
                .put("reason", event.reason()));
    }

    private void stopPipeline() {
        pipeline.stop();
        synchronized (this) {
            intake = null;
        }
    }
}
