package com.phillippitts.liverelay.service.session.gemini;

import com.phillippitts.liverelay.domain.AudioChunk;
import com.phillippitts.liverelay.domain.InboundEvent;
import com.phillippitts.liverelay.domain.MediaFrame;
import com.phillippitts.liverelay.service.session.LiveSession;
import com.phillippitts.liverelay.service.session.ResponseFragment;
import com.phillippitts.liverelay.service.session.ResponseTurn;
import com.phillippitts.liverelay.util.LogSanitizer;
import com.phillippitts.liverelay.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Gemini Live session over a JDK WebSocket.
 *
 * <p>The listener decodes server messages into {@link InboundEvent}s on the WebSocket's own
 * thread and queues them; {@link #receive()} hands them out turn by turn. Sends are serialized
 * because a JDK WebSocket allows only one outstanding send.
 */
final class GeminiLiveSession implements LiveSession, WebSocket.Listener {

    private static final Logger LOG = LogManager.getLogger(GeminiLiveSession.class);

    /** Queue entry: an event, or the end of the stream with an optional failure. */
    private record Inbound(InboundEvent event, Throwable failure) {
        static final Inbound CLOSED = new Inbound(null, null);

        boolean isEnd() {
            return event == null;
        }
    }

    private final LinkedBlockingQueue<Inbound> inbox = new LinkedBlockingQueue<>();
    private final CompletableFuture<Void> setupComplete = new CompletableFuture<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Object sendLock = new Object();

    private final StringBuilder textBuffer = new StringBuilder();
    private final ByteArrayOutputStream binaryBuffer = new ByteArrayOutputStream();

    private volatile WebSocket webSocket;

    void attach(WebSocket ws) {
        this.webSocket = ws;
    }

    /**
     * Sends the setup message and waits for the server's acknowledgement.
     */
    void awaitSetup(String setupMessage, long timeoutMs) throws IOException, InterruptedException {
        sendRaw(setupMessage);
        try {
            setupComplete.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new IOException("Session setup not acknowledged within " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            throw new IOException("Session setup failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    @Override
    public void sendAudio(AudioChunk chunk) throws IOException, InterruptedException {
        sendRaw(GeminiMessageCodec.realtimeAudio(chunk));
    }

    @Override
    public void sendMedia(MediaFrame frame) throws IOException, InterruptedException {
        sendRaw(GeminiMessageCodec.realtimeMedia(frame));
    }

    @Override
    public void sendText(String text, boolean turnComplete) throws IOException, InterruptedException {
        LOG.debug("Sending text turn: '{}'", LogSanitizer.truncate(text, 60));
        sendRaw(GeminiMessageCodec.clientText(text, turnComplete));
    }

    private void sendRaw(String message) throws IOException, InterruptedException {
        WebSocket ws = webSocket;
        if (ws == null || closed.get()) {
            throw new IOException("Session closed");
        }
        synchronized (sendLock) {
            try {
                ws.sendText(message, true).get();
            } catch (ExecutionException e) {
                throw new IOException("Send failed: " + e.getCause().getMessage(), e.getCause());
            }
        }
    }

    @Override
    public ResponseTurn receive() throws IOException, InterruptedException {
        Inbound first = inbox.take();
        if (first.isEnd()) {
            inbox.put(first);
            throw closedException(first);
        }
        return new Turn(first);
    }

    private IOException closedException(Inbound end) {
        Throwable cause = end.failure();
        return cause == null
                ? new IOException("Session closed")
                : new IOException("Session failed: " + cause.getMessage(), cause);
    }

    /** Reads fragments until a turn-complete marker; the first event was already taken. */
    private final class Turn implements ResponseTurn {
        private Inbound pending;
        private boolean done;

        Turn(Inbound first) {
            this.pending = first;
        }

        @Override
        public Optional<ResponseFragment> next() throws IOException, InterruptedException {
            if (done) {
                return Optional.empty();
            }
            Inbound in = pending != null ? pending : inbox.take();
            pending = null;
            if (in.isEnd()) {
                inbox.put(in);
                throw closedException(in);
            }
            InboundEvent event = in.event();
            if (event instanceof InboundEvent.AudioData audio) {
                return Optional.of(ResponseFragment.audio(audio.pcm()));
            }
            if (event instanceof InboundEvent.TextDelta delta) {
                return Optional.of(ResponseFragment.text(delta.text()));
            }
            done = true;
            return Optional.empty();
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        WebSocket ws = webSocket;
        if (ws != null) {
            try {
                ws.sendClose(WebSocket.NORMAL_CLOSURE, "client closing")
                        .get(ProcessTimeouts.SESSION_CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ws.abort();
            } catch (ExecutionException | TimeoutException e) {
                LOG.debug("Graceful close failed ({}); aborting", e.toString());
                ws.abort();
            }
        }
        inbox.offer(Inbound.CLOSED);
        LOG.info("Live session closed");
    }

    // WebSocket.Listener

    @Override
    public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
        textBuffer.append(data);
        if (last) {
            String message = textBuffer.toString();
            textBuffer.setLength(0);
            handle(message);
        }
        ws.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onBinary(WebSocket ws, ByteBuffer data, boolean last) {
        byte[] chunk = new byte[data.remaining()];
        data.get(chunk);
        binaryBuffer.write(chunk, 0, chunk.length);
        if (last) {
            String message = binaryBuffer.toString(StandardCharsets.UTF_8);
            binaryBuffer.reset();
            handle(message);
        }
        ws.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
        LOG.info("Live session closed by server: status={}, reason='{}'", statusCode, reason);
        setupComplete.completeExceptionally(new IOException("Closed before setup: " + statusCode + " " + reason));
        inbox.offer(Inbound.CLOSED);
        return null;
    }

    @Override
    public void onError(WebSocket ws, Throwable error) {
        LOG.error("Live session transport error: {}", error.toString());
        setupComplete.completeExceptionally(error);
        inbox.offer(new Inbound(null, error));
    }

    private void handle(String message) {
        if (!setupComplete.isDone() && GeminiMessageCodec.isSetupComplete(message)) {
            LOG.debug("Live session setup acknowledged");
            setupComplete.complete(null);
            return;
        }
        List<InboundEvent> events;
        try {
            events = GeminiMessageCodec.decode(message);
        } catch (JSONException | IllegalArgumentException e) {
            LOG.warn("Skipping malformed server message ({}): {}", e.getMessage(),
                    LogSanitizer.truncate(message, 120));
            return;
        }
        for (InboundEvent event : events) {
            inbox.offer(new Inbound(event, null));
        }
    }
}
