package com.phillippitts.liverelay.service.session;

/**
 * Piece of a model turn: audio data, text, or both.
 *
 * @param data PCM audio (24 kHz, 16-bit mono), or {@code null}
 * @param text text delta, or {@code null}
 */
public record ResponseFragment(byte[] data, String text) {

    public static ResponseFragment audio(byte[] data) {
        return new ResponseFragment(data, null);
    }

    public static ResponseFragment text(String text) {
        return new ResponseFragment(null, text);
    }

    public boolean hasData() {
        return data != null && data.length > 0;
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }
}
