package com.phillippitts.liverelay.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed properties for the realtime AI session (Gemini Live).
 *
 * <p>The API key is read from {@code GEMINI_API_KEY} by default and is never logged.
 */
@Validated
@ConfigurationProperties(prefix = "live.session")
public class LiveSessionProperties {

    public static final String DEFAULT_ENDPOINT = "wss://generativelanguage.googleapis.com/ws/"
            + "google.ai.generativelanguage.v1beta.GenerativeService.BidiGenerateContent";

    @NotBlank
    private final String model;

    private final String apiKey;

    @NotBlank
    private final String endpoint;

    private final List<String> responseModalities;

    private final String mediaResolution;

    @Min(100)
    @Max(120_000)
    private final long connectTimeoutMs;

    @ConstructorBinding
    public LiveSessionProperties(String model,
                                 String apiKey,
                                 String endpoint,
                                 List<String> responseModalities,
                                 String mediaResolution,
                                 Long connectTimeoutMs) {
        this.model = (model == null || model.isBlank()) ? "models/gemini-2.0-flash-exp" : model;
        this.apiKey = (apiKey == null || apiKey.isBlank()) ? null : apiKey;
        this.endpoint = (endpoint == null || endpoint.isBlank()) ? DEFAULT_ENDPOINT : endpoint;
        this.responseModalities = (responseModalities == null || responseModalities.isEmpty())
                ? List.of("AUDIO") : List.copyOf(responseModalities);
        this.mediaResolution = (mediaResolution == null || mediaResolution.isBlank())
                ? "MEDIA_RESOLUTION_MEDIUM" : mediaResolution;
        this.connectTimeoutMs = connectTimeoutMs == null ? 10_000L : connectTimeoutMs;
    }

    public String getModel() { return model; }
    public String getApiKey() { return apiKey; }
    public String getEndpoint() { return endpoint; }
    public List<String> getResponseModalities() { return responseModalities; }
    public String getMediaResolution() { return mediaResolution; }
    public long getConnectTimeoutMs() { return connectTimeoutMs; }

    public boolean hasApiKey() {
        return apiKey != null;
    }
}
