package com.phillippitts.liverelay.service.capture;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Objects;

/**
 * Downscales an image to fit a bounding box (never upscaling, aspect ratio kept) and encodes
 * it as JPEG.
 *
 * <p>Camera frames use a 1024x1024 box; screen frames a 640-pixel width with unbounded height.
 * Thread-safe: no mutable state.
 */
public class JpegFrameEncoder {

    private final int maxWidth;
    private final int maxHeight;
    private final float quality;

    /**
     * @param maxWidth  maximum output width in pixels
     * @param maxHeight maximum output height in pixels, or {@link Integer#MAX_VALUE} for no limit
     * @param quality   JPEG quality in (0, 1]
     */
    public JpegFrameEncoder(int maxWidth, int maxHeight, float quality) {
        if (maxWidth <= 0 || maxHeight <= 0) {
            throw new IllegalArgumentException("bounds must be positive: " + maxWidth + "x" + maxHeight);
        }
        if (quality <= 0f || quality > 1f) {
            throw new IllegalArgumentException("quality must be in (0, 1], got: " + quality);
        }
        this.maxWidth = maxWidth;
        this.maxHeight = maxHeight;
        this.quality = quality;
    }

    public static JpegFrameEncoder forCamera(int maxDimension, float quality) {
        return new JpegFrameEncoder(maxDimension, maxDimension, quality);
    }

    public static JpegFrameEncoder forScreen(int maxWidth, float quality) {
        return new JpegFrameEncoder(maxWidth, Integer.MAX_VALUE, quality);
    }

    /**
     * Scales (if needed) and encodes the image.
     *
     * @return JPEG bytes
     * @throws IOException if no JPEG writer is available or encoding fails
     */
    public byte[] encode(BufferedImage image) throws IOException {
        Objects.requireNonNull(image, "image");
        BufferedImage rgb = scaleToRgb(image);

        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);
            writer.write(null, new IIOImage(rgb, null, null), param);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }

    /**
     * Computes the output size for a source image.
     *
     * @return {@code {width, height}}, each at least 1
     */
    int[] targetSize(int width, int height) {
        double scale = Math.min(1.0, Math.min((double) maxWidth / width, (double) maxHeight / height));
        int w = Math.max(1, (int) Math.round(width * scale));
        int h = Math.max(1, (int) Math.round(height * scale));
        return new int[] {Math.min(w, maxWidth), Math.min(h, maxHeight)};
    }

    // JPEG has no alpha channel, so every frame is redrawn as RGB
    private BufferedImage scaleToRgb(BufferedImage image) {
        int[] size = targetSize(image.getWidth(), image.getHeight());
        BufferedImage target = new BufferedImage(size[0], size[1], BufferedImage.TYPE_INT_RGB);
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(image, 0, 0, size[0], size[1], null);
        } finally {
            g.dispose();
        }
        return target;
    }
}
