package com.phillippitts.liverelay.service.capture;

import com.phillippitts.liverelay.domain.MediaFrame;
import com.phillippitts.liverelay.domain.OutboundItem;
import com.phillippitts.liverelay.service.channel.BlockingIo;
import com.phillippitts.liverelay.service.channel.BoundedChannel;
import com.phillippitts.liverelay.service.channel.ChannelClosedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Periodic camera or screen capture.
 *
 * <p>Each cycle grabs one image through the device pool, encodes it, notifies the frame listener,
 * waits the frame interval and then enqueues the frame. A full queue therefore slows capture
 * down instead of dropping frames.
 */
public class ImageCaptureSource implements CaptureSource {

    private static final Logger LOG = LogManager.getLogger(ImageCaptureSource.class);

    /** Callback invoked for every captured frame, before it is queued. */
    @FunctionalInterface
    public interface FrameListener {
        void onFrameCaptured(String source, MediaFrame frame);

        FrameListener NONE = (source, frame) -> { };
    }

    private final FrameGrabber grabber;
    private final JpegFrameEncoder encoder;
    private final Duration interval;
    private final BlockingIo io;
    private final ApplicationEventPublisher publisher;
    private final FrameListener listener;

    public ImageCaptureSource(FrameGrabber grabber,
                              JpegFrameEncoder encoder,
                              Duration interval,
                              BlockingIo io,
                              ApplicationEventPublisher publisher,
                              FrameListener listener) {
        this.grabber = Objects.requireNonNull(grabber, "grabber");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.io = Objects.requireNonNull(io, "io");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.listener = listener == null ? FrameListener.NONE : listener;
    }

    @Override
    public String name() {
        return grabber.name();
    }

    @Override
    public void run(BoundedChannel<OutboundItem> out) throws InterruptedException {
        try {
            io.run(() -> {
                grabber.open();
                return null;
            });
        } catch (IOException | RuntimeException | LinkageError e) {
            LOG.warn("{} unavailable: {}", name(), e.toString());
            publisher.publishEvent(CaptureErrorEvent.now(reasonPrefix() + "_UNAVAILABLE", name()));
            closeGrabber();
            return;
        }

        long frames = 0;
        try {
            while (true) {
                BufferedImage image = io.call(grabber::grab);
                if (image == null) {
                    LOG.info("{} source ended after {} frames", name(), frames);
                    return;
                }
                MediaFrame frame = MediaFrame.jpeg(encoder.encode(image));
                listener.onFrameCaptured(name(), frame);
                Thread.sleep(interval.toMillis());
                out.put(frame);
                frames++;
                LOG.debug("{} frame queued: {}", name(), frame);
            }
        } catch (ChannelClosedException e) {
            throw e;
        } catch (IOException | RuntimeException | LinkageError e) {
            LOG.warn("{} capture failed after {} frames: {}", name(), frames, e.toString());
            publisher.publishEvent(CaptureErrorEvent.now("CAPTURE_ERROR", name()));
        } finally {
            closeGrabber();
        }
    }

    private void closeGrabber() {
        try {
            grabber.close();
        } catch (IOException | RuntimeException e) {
            LOG.debug("Failed to close {} grabber: {}", name(), e.toString());
        }
    }

    private String reasonPrefix() {
        return name().toUpperCase(Locale.ROOT);
    }
}
