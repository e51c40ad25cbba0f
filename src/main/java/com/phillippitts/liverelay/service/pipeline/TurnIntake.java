package com.phillippitts.liverelay.service.pipeline;

import java.io.IOException;
import java.util.Optional;

/**
 * Source of user text turns for a pipeline run.
 *
 * <p>The pipeline's intake task reads turns until {@link #nextTurn()} returns empty; that ends
 * the whole pipeline.
 */
public interface TurnIntake extends AutoCloseable {

    /**
     * Waits for the next user turn.
     *
     * @return the text to send, or empty when the user is done
     */
    Optional<String> nextTurn() throws IOException, InterruptedException;

    /** Releases the intake; pending and later {@link #nextTurn()} calls return empty. */
    @Override
    void close();
}
