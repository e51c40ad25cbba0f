package com.phillippitts.liverelay.service.capture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bytedeco.javacv.Frame;
import org.bytedeco.javacv.Java2DFrameConverter;
import org.bytedeco.javacv.OpenCVFrameGrabber;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Camera grabber backed by JavaCV's OpenCV capture.
 */
public class CameraFrameGrabber implements FrameGrabber {

    private static final Logger LOG = LogManager.getLogger(CameraFrameGrabber.class);

    private final int deviceIndex;
    private final Java2DFrameConverter converter = new Java2DFrameConverter();
    private OpenCVFrameGrabber grabber;

    public CameraFrameGrabber(int deviceIndex) {
        this.deviceIndex = deviceIndex;
    }

    @Override
    public String name() {
        return "camera";
    }

    @Override
    public void open() throws IOException {
        OpenCVFrameGrabber g;
        try {
            g = new OpenCVFrameGrabber(deviceIndex);
            g.start();
        } catch (LinkageError | RuntimeException e) {
            // Missing OpenCV natives surface as UnsatisfiedLinkError
            throw new IOException("Camera " + deviceIndex + " unavailable: " + e, e);
        }
        grabber = g;
        LOG.info("Camera opened: index={}, size={}x{}", deviceIndex, g.getImageWidth(), g.getImageHeight());
    }

    @Override
    public BufferedImage grab() throws IOException {
        if (grabber == null) {
            throw new IOException("Camera not opened");
        }
        try {
            Frame frame = grabber.grab();
            if (frame == null || frame.image == null) {
                return null;
            }
            BufferedImage image = converter.convert(frame);
            return image == null ? null : copy(image);
        } catch (LinkageError | RuntimeException e) {
            throw new IOException("Camera grab failed: " + e, e);
        }
    }

    @Override
    public void close() throws IOException {
        OpenCVFrameGrabber g = grabber;
        grabber = null;
        if (g != null) {
            try {
                g.stop();
            } finally {
                g.release();
            }
            LOG.info("Camera released: index={}", deviceIndex);
        }
    }

    // The converter reuses its buffer on every grab
    private static BufferedImage copy(BufferedImage source) {
        BufferedImage copy = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = copy.createGraphics();
        try {
            g.drawImage(source, 0, 0, null);
        } finally {
            g.dispose();
        }
        return copy;
    }
}
