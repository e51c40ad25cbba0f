package com.phillippitts.liverelay.service.relay;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Transcription mode flag and the partial-text buffer collected while it is on.
 *
 * <p>Thread-safe: toggled by the relay thread, appended to by the receiver task.
 */
public class TranscriptionTracker {

    static final String PROMPT_PREFIX =
            "Please transcribe this audio to text. Only return the transcribed text, nothing else: ";

    private boolean active;
    private final List<String> buffer = new ArrayList<>();

    public synchronized void start() {
        active = true;
        buffer.clear();
    }

    /**
     * Turns transcription mode off.
     *
     * @return buffered text joined with single spaces, or empty if nothing was buffered
     */
    public synchronized Optional<String> stop() {
        active = false;
        if (buffer.isEmpty()) {
            return Optional.empty();
        }
        String text = String.join(" ", buffer);
        buffer.clear();
        return Optional.of(text);
    }

    public synchronized boolean isActive() {
        return active;
    }

    /**
     * Buffers a text delta if transcription mode is on.
     *
     * @return true if the text was buffered
     */
    public synchronized boolean offer(String text) {
        if (!active) {
            return false;
        }
        buffer.add(text);
        return true;
    }

    /** Wraps user text in the transcription instruction when the mode is on. */
    public synchronized String prepare(String text) {
        return active ? PROMPT_PREFIX + text : text;
    }
}
