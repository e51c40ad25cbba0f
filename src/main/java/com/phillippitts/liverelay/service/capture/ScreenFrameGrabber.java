package com.phillippitts.liverelay.service.capture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.AWTException;
import java.awt.GraphicsDevice;
import java.awt.GraphicsEnvironment;
import java.awt.HeadlessException;
import java.awt.Rectangle;
import java.awt.Robot;
import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Captures the full virtual desktop (all monitors) with {@link Robot}.
 */
public class ScreenFrameGrabber implements FrameGrabber {

    private static final Logger LOG = LogManager.getLogger(ScreenFrameGrabber.class);

    private Robot robot;
    private Rectangle bounds;

    @Override
    public String name() {
        return "screen";
    }

    @Override
    public void open() throws IOException {
        try {
            GraphicsEnvironment env = GraphicsEnvironment.getLocalGraphicsEnvironment();
            if (GraphicsEnvironment.isHeadless()) {
                throw new IOException("Screen capture unavailable in headless mode");
            }
            Rectangle all = new Rectangle();
            for (GraphicsDevice device : env.getScreenDevices()) {
                all = all.union(device.getDefaultConfiguration().getBounds());
            }
            robot = new Robot();
            bounds = all;
            LOG.info("Screen capture ready: bounds={}x{} at ({},{})", all.width, all.height, all.x, all.y);
        } catch (AWTException | HeadlessException | SecurityException e) {
            throw new IOException("Screen capture unavailable: " + e.getMessage(), e);
        }
    }

    @Override
    public BufferedImage grab() throws IOException {
        if (robot == null) {
            throw new IOException("Screen capture not opened");
        }
        try {
            return robot.createScreenCapture(bounds);
        } catch (SecurityException e) {
            throw new IOException("Screen capture denied: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        robot = null;
        bounds = null;
    }
}
