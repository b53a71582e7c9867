package com.roll.queue;

import java.util.Optional;

/**
 * Closeable transport handing results from concurrent producers to a single consumer.
 * Thread safety is owned by the queue; callers never lock around it.
 *
 * @param <T> Result type
 */
public interface ResultQueue<T> {

    /**
     * Deposit a result. Returns once the result fits the queue's capacity;
     * with zero capacity that means once a consumer has taken it.
     *
     * @throws com.roll.exception.ResultQueueClosedException if the queue is closed,
     *         or fails while this deposit waits
     * @throws InterruptedException if interrupted while waiting
     */
    void put(T result) throws InterruptedException;

    /**
     * Take the next result (blocking).
     *
     * @return the result, or empty once the queue is closed and drained
     * @throws com.roll.exception.ResultQueueClosedException if the queue was failed;
     *         the failure is the cause
     * @throws InterruptedException if interrupted while waiting
     */
    Optional<T> take() throws InterruptedException;

    /**
     * Signal end of stream. Results already deposited remain available to {@link #take()}.
     * Closing twice has no effect.
     */
    void close();

    /**
     * Abort the stream: discard buffered results and release every waiting
     * producer and consumer with a {@link com.roll.exception.ResultQueueClosedException}.
     */
    void fail(Throwable cause);

    /**
     * Whether {@link #close()} or {@link #fail(Throwable)} has been called.
     */
    boolean isClosed();

    /**
     * Number of results a producer may deposit ahead of the consumer without blocking.
     */
    int capacity();

    /**
     * Results deposited but not yet taken.
     */
    int size();

    /**
     * Number of deposits that had to wait for the consumer.
     */
    int getBlockedPutCount();
}
