package com.phillippitts.liverelay.cli;

import com.phillippitts.liverelay.domain.VideoMode;

import java.util.Locale;
import java.util.Optional;

/**
 * How the application is driven: an interactive console with a fixed video mode, or an external
 * controller over stdin/stdout.
 *
 * @param videoMode console video mode; empty in controller mode
 */
public record RunMode(Optional<VideoMode> videoMode) {

    public static final RunMode CONTROLLER = new RunMode(Optional.empty());

    public boolean isController() {
        return videoMode.isEmpty();
    }

    /**
     * Parses {@code camera|screen|none|controller}; {@code electron} is accepted as an alias of
     * {@code controller}.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static RunMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Run mode must not be blank");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        if ("controller".equals(v) || "electron".equals(v)) {
            return CONTROLLER;
        }
        try {
            return new RunMode(Optional.of(VideoMode.parse(v)));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown mode: " + value + " (expected camera, screen, none or controller)", e);
        }
    }

    @Override
    public String toString() {
        return videoMode.map(VideoMode::wireName).orElse("controller");
    }
}
