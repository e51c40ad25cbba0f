package com.phillippitts.liverelay.service.relay;

import com.phillippitts.liverelay.domain.MediaFrame;
import com.phillippitts.liverelay.service.pipeline.ResponseSink;
import org.json.JSONObject;

import java.util.Base64;
import java.util.Objects;

/**
 * Forwards pipeline output to the controller as events.
 */
public class ControllerEventSink implements ResponseSink {

    private final ControllerEventWriter writer;
    private final TranscriptionTracker transcription;

    public ControllerEventSink(ControllerEventWriter writer, TranscriptionTracker transcription) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.transcription = Objects.requireNonNull(transcription, "transcription");
    }

    @Override
    public void onAudio(byte[] pcm) {
        writer.emit("audio", new JSONObject().put("data", Base64.getEncoder().encodeToString(pcm)));
    }

    @Override
    public void onText(String text) {
        if (transcription.offer(text)) {
            writer.emit("transcription_partial", new JSONObject().put("text", text));
        } else {
            writer.emit("text", new JSONObject().put("text", text));
        }
    }

    @Override
    public void onTurnComplete() {
        writer.emit("turn_complete", new JSONObject().put("completed", true));
    }

    @Override
    public void onFrameCaptured(String source, MediaFrame frame) {
        writer.emit(source + "_frame", new JSONObject()
                .put("size", "captured")
                .put("bytes", frame.size()));
    }
}
