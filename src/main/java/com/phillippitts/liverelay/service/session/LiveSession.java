package com.phillippitts.liverelay.service.session;

import com.phillippitts.liverelay.domain.AudioChunk;
import com.phillippitts.liverelay.domain.MediaFrame;

import java.io.IOException;

/**
 * Bidirectional realtime conversation with the AI service.
 *
 * <p>Sends may be called from several pipeline tasks; implementations serialize them.
 * {@link #receive()} is called by a single receiver task.
 */
public interface LiveSession extends AutoCloseable {

    void sendAudio(AudioChunk chunk) throws IOException, InterruptedException;

    void sendMedia(MediaFrame frame) throws IOException, InterruptedException;

    /**
     * Sends user text.
     *
     * @param turnComplete whether the model should respond now
     */
    void sendText(String text, boolean turnComplete) throws IOException, InterruptedException;

    /**
     * Waits for the next model turn.
     *
     * @return the turn, whose fragments are read with {@link ResponseTurn#next()}
     * @throws IOException once the session is closed or the connection failed
     */
    ResponseTurn receive() throws IOException, InterruptedException;

    /** Closes the connection. Idempotent. */
    @Override
    void close();
}
