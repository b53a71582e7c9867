package com.roll.strategy;

/**
 * Available execution strategies, in the order the demo runs them.
 */
public enum StrategyType {
    /**
     * All tasks one after another on the calling thread. Correctness oracle for the others.
     */
    SEQUENTIAL("a sequential loop"),

    /**
     * One thread per task joined on a countdown latch. Results are discarded.
     * Thread count grows with N without bound.
     */
    FAN_OUT("unbounded fan-out and a countdown latch"),

    /**
     * One thread per task depositing into a queue pre-sized to N, drained after all deposits.
     * Producers never wait; memory grows with N.
     */
    BUFFERED("a buffered result queue"),

    /**
     * One thread per task handing results to a concurrently draining consumer
     * through a zero-capacity queue.
     */
    UNBUFFERED("an unbuffered result queue"),

    /**
     * N tasks shaped onto P persistent workers, handing results through a zero-capacity queue.
     */
    BOUNDED_POOL("a bounded worker pool feeding an unbuffered result queue");

    private final String description;

    StrategyType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
