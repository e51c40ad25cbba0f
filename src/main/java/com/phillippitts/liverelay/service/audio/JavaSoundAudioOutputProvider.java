package com.phillippitts.liverelay.service.audio;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.SourceDataLine;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Java Sound speaker output: PCM16LE mono @24kHz, the rate of the model's audio.
 */
public class JavaSoundAudioOutputProvider implements AudioOutputProvider {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioOutputProvider.class);

    public static final int SAMPLE_RATE = 24_000;

    public static AudioFormat playbackFormat() {
        return new AudioFormat(SAMPLE_RATE, 16, 1, true, false);
    }

    @Override
    public AudioOutput open() throws IOException {
        AudioFormat format = playbackFormat();
        try {
            SourceDataLine line = (SourceDataLine) AudioSystem.getLine(new DataLine.Info(SourceDataLine.class, format));
            line.open(format);
            line.start();
            LOG.info("Speaker opened: {} Hz, buffer={}B", SAMPLE_RATE, line.getBufferSize());
            return new LineOutput(line);
        } catch (LineUnavailableException | IllegalArgumentException | SecurityException e) {
            throw new IOException("Speaker unavailable: " + e.getMessage(), e);
        }
    }

    private static final class LineOutput implements AudioOutput {
        private final SourceDataLine line;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        LineOutput(SourceDataLine line) {
            this.line = line;
        }

        @Override
        public void write(byte[] pcm) throws IOException {
            if (closed.get()) {
                throw new IOException("Speaker closed");
            }
            // Writes must be whole frames
            int length = pcm.length - (pcm.length % 2);
            line.write(pcm, 0, length);
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                line.stop();
                line.flush();
                line.close();
                LOG.info("Speaker closed");
            }
        }
    }
}
