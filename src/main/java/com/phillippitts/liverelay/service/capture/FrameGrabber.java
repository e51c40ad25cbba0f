package com.phillippitts.liverelay.service.capture;

import java.awt.image.BufferedImage;
import java.io.Closeable;
import java.io.IOException;

/**
 * Source of raw images (camera or screen). Not thread-safe; used by one capture task at a time.
 */
public interface FrameGrabber extends Closeable {

    /** Source name used in logs and frame events ({@code camera} or {@code screen}). */
    String name();

    void open() throws IOException;

    /**
     * Grabs one image.
     *
     * @return the image, or {@code null} when the source has no more frames
     */
    BufferedImage grab() throws IOException;

    @Override
    void close() throws IOException;
}
