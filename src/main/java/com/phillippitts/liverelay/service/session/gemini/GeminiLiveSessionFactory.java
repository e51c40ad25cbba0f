package com.phillippitts.liverelay.service.session.gemini;

import com.phillippitts.liverelay.config.properties.LiveSessionProperties;
import com.phillippitts.liverelay.exception.SessionException;
import com.phillippitts.liverelay.service.session.LiveSession;
import com.phillippitts.liverelay.service.session.LiveSessionFactory;
import com.phillippitts.liverelay.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Opens Gemini Live sessions configured by {@code live.session.*}.
 */
public class GeminiLiveSessionFactory implements LiveSessionFactory {

    private static final Logger LOG = LogManager.getLogger(GeminiLiveSessionFactory.class);

    private final LiveSessionProperties props;
    private final HttpClient httpClient;

    public GeminiLiveSessionFactory(LiveSessionProperties props) {
        this.props = Objects.requireNonNull(props, "props");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
                .build();
    }

    @Override
    public LiveSession connect() throws IOException, InterruptedException {
        if (!props.hasApiKey()) {
            throw new SessionException("No API key configured (set GEMINI_API_KEY or live.session.api-key)");
        }
        URI uri = URI.create(props.getEndpoint() + "?key="
                + URLEncoder.encode(props.getApiKey(), StandardCharsets.UTF_8));
        GeminiLiveSession session = new GeminiLiveSession();
        long start = System.nanoTime();
        WebSocket ws;
        try {
            ws = httpClient.newWebSocketBuilder()
                    .connectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
                    .buildAsync(uri, session)
                    .get(props.getConnectTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IOException("Live session connect failed: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new IOException("Live session connect timed out after " + props.getConnectTimeoutMs() + "ms", e);
        }
        session.attach(ws);
        try {
            session.awaitSetup(GeminiMessageCodec.setup(props), props.getConnectTimeoutMs());
        } catch (IOException | InterruptedException e) {
            session.close();
            throw e;
        }
        LOG.info("Live session connected: model={}, modalities={}, setupMs={}",
                props.getModel(), props.getResponseModalities(), TimeUtils.elapsedMillis(start));
        return session;
    }
}
