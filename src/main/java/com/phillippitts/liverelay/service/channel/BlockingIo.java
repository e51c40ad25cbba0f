package com.phillippitts.liverelay.service.channel;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;

/**
 * Runs blocking device calls on a bounded executor while the calling pipeline task waits
 * interruptibly.
 *
 * <p>Device APIs (Java Sound line reads, camera grabs, console reads) do not respond to thread
 * interruption. Handing the call to the device pool keeps the pipeline task cancellable: an
 * interrupt abandons the wait immediately, and the device call completes on its worker once the
 * device is closed.
 */
public final class BlockingIo {

    /** A device call that may fail with an I/O error. */
    @FunctionalInterface
    public interface IoCall<T> {
        T call() throws Exception;
    }

    private final Executor executor;

    public BlockingIo(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Runs calls inline on the caller's thread. Waits are then not interruptible; intended for tests.
     */
    public static BlockingIo direct() {
        return new BlockingIo(Runnable::run);
    }

    /**
     * Executes the call on the device pool and waits for its result.
     *
     * @return the call's result
     * @throws IOException the call's I/O error, or any other checked failure wrapped
     * @throws InterruptedException if the waiting thread is interrupted; the call is cancelled
     */
    public <T> T call(IoCall<T> call) throws IOException, InterruptedException {
        Objects.requireNonNull(call, "call");
        Callable<T> callable = call::call;
        FutureTask<T> task = new FutureTask<>(callable);
        executor.execute(task);
        try {
            return task.get();
        } catch (InterruptedException e) {
            task.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    /**
     * Executes a call that produces no value.
     */
    public void run(IoCall<?> call) throws IOException, InterruptedException {
        call(call);
    }

    private static IOException unwrap(Throwable cause) {
        if (cause instanceof IOException io) {
            return io;
        }
        if (cause instanceof RuntimeException re) {
            throw re;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IOException(cause.getMessage(), cause);
    }
}
