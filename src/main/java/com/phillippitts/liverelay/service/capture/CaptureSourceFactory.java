package com.phillippitts.liverelay.service.capture;

import com.phillippitts.liverelay.config.properties.CaptureProperties;
import com.phillippitts.liverelay.domain.VideoMode;
import com.phillippitts.liverelay.service.channel.BlockingIo;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Creates the capture sources of one pipeline run.
 *
 * <p>Grabbers are created per run because devices are opened and released with each pipeline.
 */
public class CaptureSourceFactory {

    private final CaptureProperties props;
    private final BlockingIo io;
    private final ApplicationEventPublisher publisher;
    private final MicrophoneCaptureSource.DataLineProvider lineProvider;
    private final Supplier<FrameGrabber> cameraGrabbers;
    private final Supplier<FrameGrabber> screenGrabbers;

    public CaptureSourceFactory(CaptureProperties props,
                                BlockingIo io,
                                ApplicationEventPublisher publisher,
                                MicrophoneCaptureSource.DataLineProvider lineProvider,
                                Supplier<FrameGrabber> cameraGrabbers,
                                Supplier<FrameGrabber> screenGrabbers) {
        this.props = Objects.requireNonNull(props, "props");
        this.io = Objects.requireNonNull(io, "io");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.lineProvider = Objects.requireNonNull(lineProvider, "lineProvider");
        this.cameraGrabbers = Objects.requireNonNull(cameraGrabbers, "cameraGrabbers");
        this.screenGrabbers = Objects.requireNonNull(screenGrabbers, "screenGrabbers");
    }

    public CaptureSource microphone() {
        return new MicrophoneCaptureSource(lineProvider, props.getMicDeviceName(),
                props.getMicChunkFrames(), io, publisher);
    }

    /**
     * Creates the image source for a mode.
     *
     * @return empty for {@link VideoMode#NONE}
     */
    public Optional<CaptureSource> imageSource(VideoMode mode, ImageCaptureSource.FrameListener listener) {
        Objects.requireNonNull(mode, "mode");
        Duration interval = Duration.ofMillis(props.getFrameIntervalMs());
        switch (mode) {
            case CAMERA:
                return Optional.of(new ImageCaptureSource(cameraGrabbers.get(),
                        JpegFrameEncoder.forCamera(props.getCameraMaxDimension(), props.getJpegQuality()),
                        interval, io, publisher, listener));
            case SCREEN:
                return Optional.of(new ImageCaptureSource(screenGrabbers.get(),
                        JpegFrameEncoder.forScreen(props.getScreenMaxWidth(), props.getJpegQuality()),
                        interval, io, publisher, listener));
            default:
                return Optional.empty();
        }
    }
}
