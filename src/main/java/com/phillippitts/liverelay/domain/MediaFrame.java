package com.phillippitts.liverelay.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable encoded media blob (typically a JPEG camera or screen frame).
 *
 * @param mimeType   MIME type of the payload, e.g. {@code image/jpeg}
 * @param payload    encoded bytes (copied on construction and on access)
 * @param capturedAt capture time
 */
public record MediaFrame(String mimeType, byte[] payload, Instant capturedAt) implements OutboundItem {

    public static final String JPEG = "image/jpeg";

    public MediaFrame {
        Objects.requireNonNull(mimeType, "mimeType must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(capturedAt, "capturedAt must not be null");
        if (mimeType.isBlank()) {
            throw new IllegalArgumentException("mimeType must not be blank");
        }
        payload = payload.clone();
    }

    /**
     * Creates a JPEG frame stamped with the current time.
     */
    public static MediaFrame jpeg(byte[] payload) {
        return new MediaFrame(JPEG, payload, Instant.now());
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public int size() {
        return payload.length;
    }

    @Override
    public String toString() {
        return "MediaFrame[" + mimeType + ", " + payload.length + "B, " + capturedAt + "]";
    }
}
