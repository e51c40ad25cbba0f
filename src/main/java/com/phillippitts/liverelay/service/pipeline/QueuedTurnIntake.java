package com.phillippitts.liverelay.service.pipeline;

import com.phillippitts.liverelay.service.channel.BoundedChannel;

import java.util.Objects;
import java.util.Optional;

/**
 * Turn intake fed programmatically, e.g. by controller {@code message} commands.
 */
public class QueuedTurnIntake implements TurnIntake {

    private final BoundedChannel<String> turns = BoundedChannel.unbounded("turns");

    /**
     * Queues a turn for the intake task.
     *
     * @throws com.phillippitts.liverelay.service.channel.ChannelClosedException if closed
     */
    public void submit(String text) {
        Objects.requireNonNull(text, "text");
        try {
            turns.put(text);
        } catch (InterruptedException e) {
            // Unbounded put never waits
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public Optional<String> nextTurn() throws InterruptedException {
        return turns.get();
    }

    @Override
    public void close() {
        turns.close();
    }

    public boolean isClosed() {
        return turns.isClosed();
    }
}
