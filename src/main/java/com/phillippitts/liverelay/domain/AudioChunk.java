package com.phillippitts.liverelay.domain;

import java.util.Objects;

/**
 * Fixed-size block of microphone PCM (16-bit signed, mono, little-endian).
 *
 * @param pcm        raw PCM bytes (copied on construction and on access)
 * @param sampleRate sample rate in Hz, e.g. 16000
 */
public record AudioChunk(byte[] pcm, int sampleRate) implements OutboundItem {

    /** MIME type advertised to the session for microphone audio. */
    public static final String MIME_TYPE = "audio/pcm";

    public AudioChunk {
        Objects.requireNonNull(pcm, "pcm must not be null");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
        pcm = pcm.clone();
    }

    @Override
    public byte[] pcm() {
        return pcm.clone();
    }

    /** Number of PCM bytes without copying the buffer. */
    public int size() {
        return pcm.length;
    }

    /** MIME type including the rate parameter, e.g. {@code audio/pcm;rate=16000}. */
    public String mimeTypeWithRate() {
        return MIME_TYPE + ";rate=" + sampleRate;
    }

    @Override
    public String toString() {
        return "AudioChunk[" + pcm.length + "B @" + sampleRate + "Hz]";
    }
}
