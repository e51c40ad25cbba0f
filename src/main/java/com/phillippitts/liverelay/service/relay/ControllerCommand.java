package com.phillippitts.liverelay.service.relay;

import com.phillippitts.liverelay.domain.MediaFrame;
import com.phillippitts.liverelay.domain.VideoMode;
import org.json.JSONObject;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Closed set of commands a controller may send, one JSON object per stdin line.
 *
 * <p>Instances are produced by {@link CommandDecoder}, which has already validated every
 * required field, and are routed with {@link #dispatch(CommandHandler)}.
 */
public sealed interface ControllerCommand {

    /** Wire name, e.g. {@code mcp_add_server}. */
    String name();

    void dispatch(CommandHandler handler);

    /** @param mode requested video mode, or {@code null} for the configured default */
    record Start(VideoMode mode) implements ControllerCommand {
        public String name() { return "start"; }
        public void dispatch(CommandHandler h) { h.onStart(this); }
    }

    record Stop() implements ControllerCommand {
        public String name() { return "stop"; }
        public void dispatch(CommandHandler h) { h.onStop(this); }
    }

    /**
     * @param text  user text, or {@code null}
     * @param image image to queue before the text, or {@code null}
     */
    record Message(String text, MediaFrame image) implements ControllerCommand {
        public String name() { return "message"; }
        public void dispatch(CommandHandler h) { h.onMessage(this); }
    }

    record Interrupt() implements ControllerCommand {
        public String name() { return "interrupt"; }
        public void dispatch(CommandHandler h) { h.onInterrupt(this); }
    }

    record StartTranscription() implements ControllerCommand {
        public String name() { return "start_transcription"; }
        public void dispatch(CommandHandler h) { h.onStartTranscription(this); }
    }

    record StopTranscription() implements ControllerCommand {
        public String name() { return "stop_transcription"; }
        public void dispatch(CommandHandler h) { h.onStopTranscription(this); }
    }

    record AddServer(String serverName, String serverCommand, List<String> serverArgs,
                     Map<String, String> serverEnv) implements ControllerCommand {
        public AddServer {
            Objects.requireNonNull(serverName, "serverName");
            Objects.requireNonNull(serverCommand, "serverCommand");
            serverArgs = serverArgs == null ? List.of() : List.copyOf(serverArgs);
            serverEnv = serverEnv == null ? Map.of() : Map.copyOf(serverEnv);
        }
        public String name() { return "mcp_add_server"; }
        public void dispatch(CommandHandler h) { h.onAddServer(this); }
    }

    record RemoveServer(String serverName) implements ControllerCommand {
        public String name() { return "mcp_remove_server"; }
        public void dispatch(CommandHandler h) { h.onRemoveServer(this); }
    }

    record GetTools() implements ControllerCommand {
        public String name() { return "mcp_get_tools"; }
        public void dispatch(CommandHandler h) { h.onGetTools(this); }
    }

    record GetServerTools(String serverName) implements ControllerCommand {
        public String name() { return "mcp_get_server_tools"; }
        public void dispatch(CommandHandler h) { h.onGetServerTools(this); }
    }

    record ExecuteTool(String server, String tool, JSONObject params) implements ControllerCommand {
        public ExecuteTool {
            params = params == null ? new JSONObject() : params;
        }
        public String name() { return "mcp_execute_tool"; }
        public void dispatch(CommandHandler h) { h.onExecuteTool(this); }
    }

    /** @param serverName one server, or {@code null} for all */
    record GetStatus(String serverName) implements ControllerCommand {
        public String name() { return "mcp_get_status"; }
        public void dispatch(CommandHandler h) { h.onGetStatus(this); }
    }
}
