package com.phillippitts.liverelay.testutil;

import com.phillippitts.liverelay.service.audio.AudioOutput;
import com.phillippitts.liverelay.service.audio.AudioOutputProvider;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Speaker double recording written fragments. Writes can be gated so tests can keep audio
 * waiting in the playback queue.
 */
public class RecordingAudioOutputProvider implements AudioOutputProvider {

    private final List<byte[]> written = new CopyOnWriteArrayList<>();
    private final AtomicInteger opened = new AtomicInteger();
    private final AtomicInteger closed = new AtomicInteger();
    private volatile Semaphore gate;
    private volatile boolean unavailable;

    /** Every write waits for a permit from {@link #release(int)}. */
    public RecordingAudioOutputProvider gated() {
        this.gate = new Semaphore(0);
        return this;
    }

    public RecordingAudioOutputProvider unavailable() {
        this.unavailable = true;
        return this;
    }

    public void release(int writes) {
        gate.release(writes);
    }

    @Override
    public AudioOutput open() throws IOException {
        if (unavailable) {
            throw new IOException("Speaker unavailable: no device");
        }
        opened.incrementAndGet();
        return new AudioOutput() {
            @Override
            public void write(byte[] pcm) throws IOException {
                Semaphore g = gate;
                if (g != null) {
                    try {
                        g.acquire();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IOException("interrupted", e);
                    }
                }
                written.add(pcm.clone());
            }

            @Override
            public void close() {
                closed.incrementAndGet();
            }
        };
    }

    public List<byte[]> written() {
        return written;
    }

    public int openCount() {
        return opened.get();
    }

    public int closeCount() {
        return closed.get();
    }
}
