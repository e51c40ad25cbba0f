package com.phillippitts.liverelay.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for hosted tool servers (JSON-RPC over stdio).
 */
@Validated
@ConfigurationProperties(prefix = "tools")
public class ToolHostProperties {

    /** Maximum wait for the response line of one request. */
    @Min(1)
    @Max(600_000)
    private final long requestTimeoutMs;

    /** Wait for a tool process to exit after a graceful termination request. */
    @Min(1)
    @Max(60_000)
    private final long shutdownTimeoutMs;

    @NotBlank
    private final String protocolVersion;

    @NotBlank
    private final String clientName;

    @NotBlank
    private final String clientVersion;

    @ConstructorBinding
    public ToolHostProperties(Long requestTimeoutMs,
                              Long shutdownTimeoutMs,
                              String protocolVersion,
                              String clientName,
                              String clientVersion) {
        this.requestTimeoutMs = requestTimeoutMs == null ? 30_000L : requestTimeoutMs;
        this.shutdownTimeoutMs = shutdownTimeoutMs == null ? 5_000L : shutdownTimeoutMs;
        this.protocolVersion = (protocolVersion == null || protocolVersion.isBlank())
                ? "2024-11-05" : protocolVersion;
        this.clientName = (clientName == null || clientName.isBlank()) ? "live-relay" : clientName;
        this.clientVersion = (clientVersion == null || clientVersion.isBlank()) ? "1.0.0" : clientVersion;
    }

    /** Defaults for every field; convenient in tests and standalone use. */
    public static ToolHostProperties defaults() {
        return new ToolHostProperties(null, null, null, null, null);
    }

    public long getRequestTimeoutMs() { return requestTimeoutMs; }
    public long getShutdownTimeoutMs() { return shutdownTimeoutMs; }
    public String getProtocolVersion() { return protocolVersion; }
    public String getClientName() { return clientName; }
    public String getClientVersion() { return clientVersion; }
}
