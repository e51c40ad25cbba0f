package com.phillippitts.liverelay.service.events;

import com.phillippitts.liverelay.service.capture.CaptureErrorEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for device error events. Privacy-safe and throttled to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onCaptureError(CaptureErrorEvent e) {
        String key = "capture-" + e.source() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Device error: source={}, reason={}. {}", e.source(), e.reason(), hint(e.reason()));
        }
    }

    private static String hint(String reason) {
        if (reason.endsWith("PERMISSION_DENIED")) {
            return "Grant microphone access in the OS privacy settings and restart.";
        }
        if (reason.startsWith("SPEAKER")) {
            return "Check the default output device.";
        }
        if (reason.startsWith("CAMERA")) {
            return "Check capture.camera-index and that no other application holds the camera.";
        }
        if (reason.startsWith("SCREEN")) {
            return "Screen capture needs a graphical session (and screen recording permission on macOS).";
        }
        return "Check device & permissions.";
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
