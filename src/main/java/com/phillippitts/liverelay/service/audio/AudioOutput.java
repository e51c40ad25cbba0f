package com.phillippitts.liverelay.service.audio;

import java.io.IOException;

/**
 * Open playback device accepting 16-bit mono PCM at the receive rate.
 */
public interface AudioOutput extends AutoCloseable {

    /**
     * Writes PCM bytes, blocking until the device has accepted them.
     */
    void write(byte[] pcm) throws IOException;

    /** Releases the device. Idempotent. */
    @Override
    void close();
}
