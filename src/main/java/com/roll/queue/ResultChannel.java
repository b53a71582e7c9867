package com.roll.queue;

import com.roll.exception.ResultQueueClosedException;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO result queue with a fixed capacity, which may be zero.
 * <p>
 * Each deposit takes a ticket in arrival order. A deposit returns as soon as fewer
 * than {@code capacity} earlier results are still waiting to be taken, so with
 * capacity zero it returns only after its own result has been taken (rendezvous).
 *
 * @param <T> Result type
 */
public class ResultChannel<T> implements ResultQueue<T> {

    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final ArrayDeque<T> items = new ArrayDeque<>();

    private long putTickets;
    private long taken;
    private boolean closed;
    private Throwable failure;
    private int blockedPuts;

    public ResultChannel(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity must be zero or positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Queue that holds up to {@code capacity} results without blocking producers.
     */
    public static <T> ResultChannel<T> buffered(int capacity) {
        return new ResultChannel<>(capacity);
    }

    /**
     * Zero-capacity queue: every deposit waits for a matching take.
     */
    public static <T> ResultChannel<T> unbuffered() {
        return new ResultChannel<>(0);
    }

    @Override
    public void put(T result) throws InterruptedException {
        Objects.requireNonNull(result, "Result cannot be null");
        lock.lockInterruptibly();
        try {
            if (closed) {
                throw new ResultQueueClosedException("Result queue is closed", failure);
            }
            long ticket = putTickets++;
            items.addLast(result);
            changed.signalAll();

            if (mustWait(ticket)) {
                blockedPuts++;
                while (mustWait(ticket)) {
                    if (failure != null) {
                        throw new ResultQueueClosedException("Result queue failed", failure);
                    }
                    changed.await();
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private boolean mustWait(long ticket) {
        return ticket >= taken + capacity;
    }

    @Override
    public Optional<T> take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                if (failure != null) {
                    throw new ResultQueueClosedException("Result queue failed", failure);
                }
                T item = items.pollFirst();
                if (item != null) {
                    taken++;
                    changed.signalAll();
                    return Optional.of(item);
                }
                if (closed) {
                    return Optional.empty();
                }
                changed.await();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void fail(Throwable cause) {
        Objects.requireNonNull(cause, "Cause cannot be null");
        lock.lock();
        try {
            if (failure == null) {
                failure = cause;
            }
            closed = true;
            items.clear();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getBlockedPutCount() {
        lock.lock();
        try {
            return blockedPuts;
        } finally {
            lock.unlock();
        }
    }
}
