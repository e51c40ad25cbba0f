package com.phillippitts.liverelay.service.capture;

import java.time.Instant;

/**
 * Published when a capture or playback device fails (permissions, missing device, read errors).
 *
 * Payload contains a short reason code, the source name and a timestamp. Avoids any PII.
 *
 * @param reason short code such as {@code MIC_UNAVAILABLE} or {@code CAMERA_UNAVAILABLE}
 * @param source name of the failing source ({@code microphone}, {@code camera}, {@code screen}, {@code speaker})
 * @param at     time of failure
 */
public record CaptureErrorEvent(String reason, String source, Instant at) {

    public static CaptureErrorEvent now(String reason, String source) {
        return new CaptureErrorEvent(reason, source, Instant.now());
    }
}
