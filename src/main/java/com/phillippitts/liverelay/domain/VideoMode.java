package com.phillippitts.liverelay.domain;

import java.util.Locale;

/**
 * Which image source, if any, feeds the outbound queue alongside the microphone.
 * At most one image source runs per pipeline.
 */
public enum VideoMode {
    CAMERA,
    SCREEN,
    NONE;

    /**
     * Parses a wire/CLI value case-insensitively ({@code "camera"}, {@code "Screen"}, ...).
     *
     * @throws IllegalArgumentException for blank or unknown values
     */
    public static VideoMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("video mode must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown video mode: " + value
                    + " (expected camera, screen or none)", e);
        }
    }

    public boolean capturesImages() {
        return this != NONE;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
