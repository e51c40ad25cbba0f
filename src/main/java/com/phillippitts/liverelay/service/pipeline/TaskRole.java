package com.phillippitts.liverelay.service.pipeline;

import java.util.Locale;

/**
 * Concurrent activities of a running pipeline. At most one task per role.
 */
public enum TaskRole {
    /** Reads user turns and sends them as text; its end stops the pipeline. */
    INTAKE,
    /** Forwards outbound items to the session. */
    SENDER,
    MICROPHONE,
    /** Camera or screen capture. */
    CAPTURE,
    /** Reads model turns into the playback queue and the response sink. */
    RECEIVER,
    /** Writes playback audio to the speaker. */
    PLAYER;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
