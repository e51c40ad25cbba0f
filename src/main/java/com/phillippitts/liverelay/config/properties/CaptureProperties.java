package com.phillippitts.liverelay.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for microphone, camera and screen capture.
 *
 * Microphone format is fixed: 16 kHz, 16-bit PCM, mono, little-endian.
 */
@Validated
@ConfigurationProperties(prefix = "capture")
public class CaptureProperties {

    /** Delay between an image grab and the enqueue of the encoded frame. */
    @Min(10)
    @Max(60_000)
    private final long frameIntervalMs;

    /** Camera frames are scaled to fit within a square of this size. */
    @Min(16)
    @Max(8192)
    private final int cameraMaxDimension;

    /** Screen frames are scaled to at most this width, aspect ratio kept. */
    @Min(16)
    @Max(8192)
    private final int screenMaxWidth;

    @DecimalMin("0.05")
    @DecimalMax("1.0")
    private final float jpegQuality;

    /** OpenCV device index of the camera. */
    @Min(0)
    private final int cameraIndex;

    /** Microphone read size in sample frames. */
    @Min(64)
    @Max(16_384)
    private final int micChunkFrames;

    /** Optional input device name hint; falls back to system default when null/blank. */
    private final String micDeviceName;

    @ConstructorBinding
    public CaptureProperties(Long frameIntervalMs,
                             Integer cameraMaxDimension,
                             Integer screenMaxWidth,
                             Float jpegQuality,
                             Integer cameraIndex,
                             Integer micChunkFrames,
                             String micDeviceName) {
        this.frameIntervalMs = frameIntervalMs == null ? 1000L : frameIntervalMs;
        this.cameraMaxDimension = cameraMaxDimension == null ? 1024 : cameraMaxDimension;
        this.screenMaxWidth = screenMaxWidth == null ? 640 : screenMaxWidth;
        this.jpegQuality = jpegQuality == null ? 0.75f : jpegQuality;
        this.cameraIndex = cameraIndex == null ? 0 : cameraIndex;
        this.micChunkFrames = micChunkFrames == null ? 1024 : micChunkFrames;
        this.micDeviceName = (micDeviceName == null || micDeviceName.isBlank()) ? null : micDeviceName;
    }

    public long getFrameIntervalMs() { return frameIntervalMs; }
    public int getCameraMaxDimension() { return cameraMaxDimension; }
    public int getScreenMaxWidth() { return screenMaxWidth; }
    public float getJpegQuality() { return jpegQuality; }
    public int getCameraIndex() { return cameraIndex; }
    public int getMicChunkFrames() { return micChunkFrames; }
    public String getMicDeviceName() { return micDeviceName; }
}
