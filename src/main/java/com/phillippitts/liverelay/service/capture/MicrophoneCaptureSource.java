package com.phillippitts.liverelay.service.capture;

import com.phillippitts.liverelay.domain.AudioChunk;
import com.phillippitts.liverelay.domain.OutboundItem;
import com.phillippitts.liverelay.service.channel.BlockingIo;
import com.phillippitts.liverelay.service.channel.BoundedChannel;
import com.phillippitts.liverelay.service.channel.ChannelClosedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.io.IOException;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Java Sound microphone capture producing PCM16LE mono @16kHz in fixed-size chunks.
 *
 * <p>Chunks are read back to back with no delay; the outbound queue provides backpressure.
 */
public class MicrophoneCaptureSource implements CaptureSource {

    private static final Logger LOG = LogManager.getLogger(MicrophoneCaptureSource.class);

    public static final int SAMPLE_RATE = 16_000;
    public static final int BITS_PER_SAMPLE = 16;
    public static final int CHANNELS = 1;

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(AudioFormat format, Optional<String> deviceName) throws LineUnavailableException;
    }

    private final DataLineProvider provider;
    private final Optional<String> deviceName;
    private final int chunkBytes;
    private final BlockingIo io;
    private final ApplicationEventPublisher publisher;

    /**
     * @param chunkFrames sample frames per chunk (1024 frames = 2048 bytes)
     */
    public MicrophoneCaptureSource(DataLineProvider provider,
                                   String deviceName,
                                   int chunkFrames,
                                   BlockingIo io,
                                   ApplicationEventPublisher publisher) {
        if (chunkFrames <= 0) {
            throw new IllegalArgumentException("chunkFrames must be > 0, got: " + chunkFrames);
        }
        this.provider = Objects.requireNonNull(provider, "provider");
        this.deviceName = Optional.ofNullable(deviceName);
        this.chunkBytes = chunkFrames * CHANNELS * (BITS_PER_SAMPLE / 8);
        this.io = Objects.requireNonNull(io, "io");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    public static AudioFormat captureFormat() {
        return new AudioFormat(SAMPLE_RATE, BITS_PER_SAMPLE, CHANNELS, true, false);
    }

    /**
     * Default provider: the named mixer when one matches, otherwise the system default line.
     */
    public static DataLineProvider defaultProvider() {
        return (format, device) -> {
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
                if (line == null) {
                    LOG.warn("Input device '{}' not found; using system default", device.get());
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    @Override
    public String name() {
        return "microphone";
    }

    @Override
    public void run(BoundedChannel<OutboundItem> out) throws InterruptedException {
        TargetDataLine line = null;
        long written = 0;
        try {
            line = provider.open(captureFormat(), deviceName);
            line.start();
            LOG.info("Microphone opened: device='{}', chunk={}B", deviceName.orElse("default"), chunkBytes);
            final TargetDataLine active = line;
            byte[] buf = new byte[chunkBytes];
            while (true) {
                int n = io.call(() -> active.read(buf, 0, buf.length));
                if (n < 0) {
                    LOG.info("Microphone stream ended after {} bytes", written);
                    return;
                }
                if (n == 0) {
                    continue;
                }
                byte[] pcm = n == buf.length ? buf : Arrays.copyOf(buf, n);
                out.put(new AudioChunk(pcm, SAMPLE_RATE));
                written += n;
            }
        } catch (LineUnavailableException e) {
            LOG.warn("Microphone unavailable: {}", e.getMessage());
            publisher.publishEvent(CaptureErrorEvent.now("MIC_UNAVAILABLE", name()));
        } catch (SecurityException se) {
            LOG.warn("Microphone access denied: {}", se.getMessage());
            publisher.publishEvent(CaptureErrorEvent.now("MIC_PERMISSION_DENIED", name()));
        } catch (ChannelClosedException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            LOG.warn("Microphone capture failed after {} bytes: {}", written, e.toString());
            publisher.publishEvent(CaptureErrorEvent.now("CAPTURE_ERROR", name()));
        } finally {
            if (line != null) {
                closeLine(line);
            }
        }
    }

    private static void closeLine(TargetDataLine line) {
        try {
            line.stop();
            line.close();
        } catch (RuntimeException e) {
            LOG.debug("Failed to close microphone line: {}", e.toString());
        }
    }
}
