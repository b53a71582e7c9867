package com.roll.core;

/**
 * Running sum of collected results.
 * Not thread-safe: every strategy feeds it from its single consuming thread.
 */
public class Aggregator {

    private long sum;
    private int count;

    public void add(int result) {
        sum += result;
        count++;
    }

    public long sum() {
        return sum;
    }

    /**
     * Number of results added so far.
     */
    public int count() {
        return count;
    }

    /**
     * Fail if the number of collected results differs from the number of tasks run.
     */
    public void verifyCount(int expected) {
        if (count != expected) {
            throw new IllegalStateException(
                    "Collected " + count + " results but " + expected + " tasks were run");
        }
    }
}
