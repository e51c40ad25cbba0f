package com.phillippitts.liverelay.config.properties;

import com.phillippitts.liverelay.domain.VideoMode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the streaming pipeline.
 */
@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /** Capacity of the outbound queue shared by all capture sources. */
    @Min(1)
    @Max(1000)
    private final int outboundCapacity;

    /** Maximum wait for each task to confirm completion during stop. */
    @Min(100)
    @Max(60_000)
    private final long stopTimeoutMs;

    /** Video mode used by controller {@code start} commands that carry no mode. */
    @NotNull
    private final VideoMode defaultVideoMode;

    @ConstructorBinding
    public PipelineProperties(Integer outboundCapacity, Long stopTimeoutMs, VideoMode defaultVideoMode) {
        this.outboundCapacity = outboundCapacity == null ? 5 : outboundCapacity;
        this.stopTimeoutMs = stopTimeoutMs == null ? 5000L : stopTimeoutMs;
        this.defaultVideoMode = defaultVideoMode == null ? VideoMode.SCREEN : defaultVideoMode;
    }

    public int getOutboundCapacity() { return outboundCapacity; }
    public long getStopTimeoutMs() { return stopTimeoutMs; }
    public VideoMode getDefaultVideoMode() { return defaultVideoMode; }
}
