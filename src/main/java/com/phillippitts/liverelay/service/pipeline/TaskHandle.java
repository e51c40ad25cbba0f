package com.phillippitts.liverelay.service.pipeline;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Completion tracking for one pipeline task.
 *
 * <p>The task body and {@link #cancel()} race for {@link #claim()}: a task cancelled before it
 * ever ran is counted down by the canceller, one that started counts itself down when it exits.
 */
final class TaskHandle {

    private final TaskRole role;
    private final CountDownLatch done = new CountDownLatch(1);
    private final AtomicBoolean claimed = new AtomicBoolean(false);
    private volatile Future<?> future;

    TaskHandle(TaskRole role) {
        this.role = role;
    }

    TaskRole role() {
        return role;
    }

    void attach(Future<?> future) {
        this.future = future;
    }

    /** @return {@code true} for the first caller only */
    boolean claim() {
        return claimed.compareAndSet(false, true);
    }

    void markDone() {
        done.countDown();
    }

    void cancel() {
        Future<?> f = future;
        if (f != null) {
            f.cancel(true);
        }
        if (claim()) {
            markDone();
        }
    }

    boolean awaitDone(long timeoutMs) throws InterruptedException {
        return done.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    boolean isDone() {
        return done.getCount() == 0;
    }
}
