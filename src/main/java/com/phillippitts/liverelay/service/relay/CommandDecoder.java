package com.phillippitts.liverelay.service.relay;

import com.phillippitts.liverelay.domain.MediaFrame;
import com.phillippitts.liverelay.domain.VideoMode;
import com.phillippitts.liverelay.exception.InvalidCommandException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes one controller stdin line into a {@link ControllerCommand}.
 *
 * <p>Expected shape: {@code {"command": "<name>", ...fields}}. All validation happens here so
 * handlers only see well-formed commands.
 *
 * <p>Thread-safe (stateless).
 */
public final class CommandDecoder {

    private CommandDecoder() {
        // Utility class - prevent instantiation
    }

    /**
     * @param line one line of controller input
     * @return decoded command
     * @throws InvalidCommandException on malformed JSON, unknown command names or invalid fields
     */
    public static ControllerCommand decode(String line) {
        if (line == null || line.isBlank()) {
            throw new InvalidCommandException("Invalid JSON command: empty line");
        }
        JSONObject json;
        try {
            json = new JSONObject(line);
        } catch (JSONException e) {
            throw new InvalidCommandException("Invalid JSON command: " + e.getMessage(), e);
        }
        String command = json.optString("command", null);
        if (command == null || command.isBlank()) {
            throw new InvalidCommandException("Invalid JSON command: missing 'command'");
        }

        switch (command) {
            case "start":
                return decodeStart(json);
            case "stop":
                return new ControllerCommand.Stop();
            case "message":
                return decodeMessage(json);
            case "interrupt":
                return new ControllerCommand.Interrupt();
            case "start_transcription":
                return new ControllerCommand.StartTranscription();
            case "stop_transcription":
                return new ControllerCommand.StopTranscription();
            case "mcp_add_server":
                return new ControllerCommand.AddServer(
                        requireString(json, command, "server_name"),
                        requireString(json, command, "server_command"),
                        stringList(json, command, "server_args"),
                        stringMap(json, command, "server_env"));
            case "mcp_remove_server":
                return new ControllerCommand.RemoveServer(requireString(json, command, "server_name"));
            case "mcp_get_tools":
                return new ControllerCommand.GetTools();
            case "mcp_get_server_tools":
                return new ControllerCommand.GetServerTools(requireString(json, command, "server_name"));
            case "mcp_execute_tool":
                return new ControllerCommand.ExecuteTool(
                        requireString(json, command, "server"),
                        requireString(json, command, "tool"),
                        optionalObject(json, command, "params"));
            case "mcp_get_status":
                return new ControllerCommand.GetStatus(optionalString(json, command, "server_name"));
            default:
                throw new InvalidCommandException(command, "Unknown command: " + command);
        }
    }

    private static ControllerCommand.Start decodeStart(JSONObject json) {
        JSONObject options = optionalObject(json, "start", "options");
        if (options == null) {
            return new ControllerCommand.Start(null);
        }
        String mode = optionalString(options, "start", "mode");
        if (mode == null) {
            return new ControllerCommand.Start(null);
        }
        try {
            return new ControllerCommand.Start(VideoMode.parse(mode));
        } catch (IllegalArgumentException e) {
            throw new InvalidCommandException("start", e.getMessage());
        }
    }

    private static ControllerCommand.Message decodeMessage(JSONObject json) {
        String text = optionalString(json, "message", "text");
        JSONObject image = optionalObject(json, "message", "image");
        MediaFrame frame = null;
        if (image != null) {
            String mimeType = requireString(image, "message", "mime_type");
            String data = requireString(image, "message", "data");
            byte[] bytes;
            try {
                bytes = Base64.getDecoder().decode(data);
            } catch (IllegalArgumentException e) {
                throw new InvalidCommandException("message", "Invalid image data: " + e.getMessage());
            }
            try {
                frame = new MediaFrame(mimeType, bytes, Instant.now());
            } catch (IllegalArgumentException e) {
                throw new InvalidCommandException("message", "Invalid image: " + e.getMessage());
            }
        }
        if (text == null && frame == null) {
            throw new InvalidCommandException("message", "message requires 'text' or 'image'");
        }
        return new ControllerCommand.Message(text, frame);
    }

    private static String requireString(JSONObject json, String command, String field) {
        String value = optionalString(json, command, field);
        if (value == null) {
            throw new InvalidCommandException(command, command + " requires '" + field + "'");
        }
        return value;
    }

    private static String optionalString(JSONObject json, String command, String field) {
        if (!json.has(field) || json.isNull(field)) {
            return null;
        }
        Object value = json.get(field);
        if (!(value instanceof String s)) {
            throw new InvalidCommandException(command, "'" + field + "' must be a string");
        }
        return s;
    }

    private static JSONObject optionalObject(JSONObject json, String command, String field) {
        if (!json.has(field) || json.isNull(field)) {
            return null;
        }
        Object value = json.get(field);
        if (!(value instanceof JSONObject o)) {
            throw new InvalidCommandException(command, "'" + field + "' must be an object");
        }
        return o;
    }

    private static List<String> stringList(JSONObject json, String command, String field) {
        if (!json.has(field) || json.isNull(field)) {
            return List.of();
        }
        Object value = json.get(field);
        if (!(value instanceof JSONArray array)) {
            throw new InvalidCommandException(command, "'" + field + "' must be an array of strings");
        }
        List<String> out = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            Object element = array.get(i);
            if (!(element instanceof String s)) {
                throw new InvalidCommandException(command, "'" + field + "' must be an array of strings");
            }
            out.add(s);
        }
        return out;
    }

    private static Map<String, String> stringMap(JSONObject json, String command, String field) {
        JSONObject object = optionalObject(json, command, field);
        if (object == null) {
            return Map.of();
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (String key : object.keySet()) {
            Object value = object.get(key);
            if (!(value instanceof String s)) {
                throw new InvalidCommandException(command, "'" + field + "." + key + "' must be a string");
            }
            out.put(key, s);
        }
        return out;
    }
}
