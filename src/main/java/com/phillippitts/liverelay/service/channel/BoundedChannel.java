package com.phillippitts.liverelay.service.channel;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity FIFO hand-off between pipeline tasks.
 *
 * <p>{@link #put(Object)} blocks while the channel is full and {@link #get()} blocks while it is
 * empty. Both waits are interruptible, which is how pipeline tasks are cancelled. Items are never
 * dropped by the channel itself; only {@link #drain()} discards them.
 *
 * <p>After {@link #close()}, producers fail with {@link ChannelClosedException} and consumers
 * receive the remaining items followed by {@link Optional#empty()}.
 *
 * <p>Thread-safe. One fair lock guards the deque so waiting producers and consumers are served
 * in arrival order.
 *
 * @param <T> item type
 */
public final class BoundedChannel<T> {

    private final String name;
    private final int capacity;
    private final ArrayDeque<T> items = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition notFull = lock.newCondition();
    private final Condition notEmpty = lock.newCondition();
    private boolean closed;

    public BoundedChannel(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.capacity = capacity;
    }

    /**
     * Creates a channel whose {@code put} never blocks (used for playback audio).
     */
    public static <T> BoundedChannel<T> unbounded(String name) {
        return new BoundedChannel<>(name, Integer.MAX_VALUE);
    }

    /**
     * Appends an item, waiting while the channel is full.
     *
     * @throws InterruptedException if interrupted while waiting
     * @throws ChannelClosedException if the channel is or becomes closed
     */
    public void put(T item) throws InterruptedException {
        Objects.requireNonNull(item, "item");
        lock.lockInterruptibly();
        try {
            while (!closed && items.size() >= capacity) {
                notFull.await();
            }
            if (closed) {
                throw new ChannelClosedException(name);
            }
            items.addLast(item);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the oldest item, waiting while the channel is empty.
     *
     * @return the item, or empty once the channel is closed and fully consumed
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<T> get() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.isEmpty() && !closed) {
                notEmpty.await();
            }
            T item = items.pollFirst();
            if (item != null) {
                notFull.signal();
            }
            return Optional.ofNullable(item);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every queued item at once.
     *
     * @return number of items discarded
     */
    public int drain() {
        lock.lock();
        try {
            int count = items.size();
            items.clear();
            notFull.signalAll();
            return count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the channel and wakes every waiter. Idempotent.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "BoundedChannel[" + name + ", size=" + size() + ", capacity="
                + (capacity == Integer.MAX_VALUE ? "unbounded" : String.valueOf(capacity)) + "]";
    }
}
