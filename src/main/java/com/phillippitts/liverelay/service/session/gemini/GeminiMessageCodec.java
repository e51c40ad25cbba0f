package com.phillippitts.liverelay.service.session.gemini;

import com.phillippitts.liverelay.config.properties.LiveSessionProperties;
import com.phillippitts.liverelay.domain.AudioChunk;
import com.phillippitts.liverelay.domain.InboundEvent;
import com.phillippitts.liverelay.domain.MediaFrame;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Builds and parses Gemini Live (BidiGenerateContent) WebSocket messages.
 *
 * <p>Client messages: {@code setup}, {@code realtimeInput} (audio and images as base64
 * {@code mediaChunks}) and {@code clientContent} (text turns). Server messages:
 * {@code setupComplete} and {@code serverContent} carrying {@code modelTurn.parts} plus the
 * {@code turnComplete}/{@code interrupted} flags.
 */
final class GeminiMessageCodec {

    private static final Logger LOG = LogManager.getLogger(GeminiMessageCodec.class);

    private GeminiMessageCodec() {}

    static String setup(LiveSessionProperties props) {
        JSONObject generationConfig = new JSONObject()
                .put("responseModalities", new JSONArray(props.getResponseModalities()))
                .put("mediaResolution", props.getMediaResolution());
        JSONObject setup = new JSONObject()
                .put("model", props.getModel())
                .put("generationConfig", generationConfig);
        return new JSONObject().put("setup", setup).toString();
    }

    static String realtimeAudio(AudioChunk chunk) {
        return realtimeInput(chunk.mimeTypeWithRate(), chunk.pcm());
    }

    static String realtimeMedia(MediaFrame frame) {
        return realtimeInput(frame.mimeType(), frame.payload());
    }

    private static String realtimeInput(String mimeType, byte[] data) {
        JSONObject chunk = new JSONObject()
                .put("mimeType", mimeType)
                .put("data", Base64.getEncoder().encodeToString(data));
        JSONObject input = new JSONObject().put("mediaChunks", new JSONArray().put(chunk));
        return new JSONObject().put("realtimeInput", input).toString();
    }

    static String clientText(String text, boolean turnComplete) {
        JSONObject turn = new JSONObject()
                .put("role", "user")
                .put("parts", new JSONArray().put(new JSONObject().put("text", text)));
        JSONObject content = new JSONObject()
                .put("turns", new JSONArray().put(turn))
                .put("turnComplete", turnComplete);
        return new JSONObject().put("clientContent", content).toString();
    }

    static boolean isSetupComplete(String message) {
        try {
            return new JSONObject(message).has("setupComplete");
        } catch (JSONException e) {
            return false;
        }
    }

    /**
     * Decodes one server message into inbound events, in order: audio and text parts first,
     * then a turn-complete marker when the turn ended or was interrupted. An audio part with
     * invalid base64 is dropped on its own.
     *
     * @return events; empty for messages that carry no content (setup acks, usage metadata)
     * @throws JSONException if the message is not a JSON object
     */
    static List<InboundEvent> decode(String message) {
        JSONObject obj = new JSONObject(message);
        JSONObject content = obj.optJSONObject("serverContent");
        if (content == null) {
            return List.of();
        }
        List<InboundEvent> events = new ArrayList<>();
        JSONObject modelTurn = content.optJSONObject("modelTurn");
        JSONArray parts = modelTurn == null ? null : modelTurn.optJSONArray("parts");
        if (parts != null) {
            for (int i = 0; i < parts.length(); i++) {
                JSONObject part = parts.optJSONObject(i);
                if (part == null) {
                    continue;
                }
                JSONObject inline = part.optJSONObject("inlineData");
                if (inline != null) {
                    String data = inline.optString("data", "");
                    if (!data.isEmpty()) {
                        try {
                            events.add(new InboundEvent.AudioData(Base64.getDecoder().decode(data)));
                        } catch (IllegalArgumentException e) {
                            // Only this part is lost; siblings and the turn flags still apply
                            LOG.warn("Skipping audio part {} with invalid base64: {}", i, e.getMessage());
                        }
                    }
                }
                String text = part.optString("text", "");
                if (!text.isEmpty()) {
                    events.add(new InboundEvent.TextDelta(text));
                }
            }
        }
        if (content.optBoolean("turnComplete", false) || content.optBoolean("interrupted", false)) {
            events.add(InboundEvent.TurnComplete.INSTANCE);
        }
        return List.copyOf(events);
    }
}
