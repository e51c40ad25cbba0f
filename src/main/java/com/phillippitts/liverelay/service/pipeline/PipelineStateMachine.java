package com.phillippitts.liverelay.service.pipeline;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe lifecycle state for one pipeline.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → STARTING (beginStart)
 * STARTING → RUNNING (markRunning) or STARTING → IDLE (abortStart)
 * RUNNING → STOPPING (beginStop)
 * STOPPING → IDLE (markIdle)
 * </pre>
 *
 * <p>Each transition method returns {@code false} (or throws, for transitions that only the
 * current owner may make) when the machine is not in the expected source state, so exactly one
 * caller wins a start and exactly one caller wins a stop.
 *
 * @since 1.0
 */
public final class PipelineStateMachine {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private PipelineState state = PipelineState.IDLE;

    /**
     * @return {@code true} if the caller now owns the start
     */
    public boolean beginStart() {
        return transition(PipelineState.IDLE, PipelineState.STARTING);
    }

    public void markRunning() {
        require(PipelineState.STARTING, PipelineState.RUNNING);
    }

    public void abortStart() {
        require(PipelineState.STARTING, PipelineState.IDLE);
    }

    /**
     * @return {@code true} if the caller now owns the teardown
     */
    public boolean beginStop() {
        return transition(PipelineState.RUNNING, PipelineState.STOPPING);
    }

    public void markIdle() {
        require(PipelineState.STOPPING, PipelineState.IDLE);
    }

    /**
     * Waits while a start is in progress.
     *
     * @return the state once it is no longer {@link PipelineState#STARTING}
     */
    public PipelineState awaitSettled() throws InterruptedException {
        lock.lock();
        try {
            while (state == PipelineState.STARTING) {
                changed.await();
            }
            return state;
        } finally {
            lock.unlock();
        }
    }

    public PipelineState current() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    private boolean transition(PipelineState from, PipelineState to) {
        lock.lock();
        try {
            if (state != from) {
                return false;
            }
            state = to;
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void require(PipelineState from, PipelineState to) {
        if (!transition(from, to)) {
            throw new IllegalStateException("Cannot move to " + to + " from " + current());
        }
    }
}
