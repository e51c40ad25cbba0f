package com.phillippitts.liverelay.service.pipeline;

import com.phillippitts.liverelay.domain.MediaFrame;

/**
 * Consumer of model output and capture notifications for one pipeline.
 *
 * <p>Called from pipeline task threads; implementations must be thread-safe and must not block
 * for long.
 */
public interface ResponseSink {

    /** Model audio fragment (PCM 24 kHz); local playback is handled by the pipeline. */
    void onAudio(byte[] pcm);

    void onText(String text);

    void onTurnComplete();

    /** A camera or screen frame was captured and is about to be queued. */
    default void onFrameCaptured(String source, MediaFrame frame) {
    }
}
