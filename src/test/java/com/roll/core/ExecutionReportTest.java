package com.roll.core;

import com.roll.strategy.StrategyType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExecutionReport and Aggregator.
 */
class ExecutionReportTest {

    @Test
    @DisplayName("Should describe a summed run with concurrency limit")
    void shouldDescribeBoundedRun() {
        ExecutionReport report = ExecutionReport.summed(
                StrategyType.BOUNDED_POOL, Duration.ofMillis(1002), 100, 350, 10);

        assertTrue(report.hasSum());
        assertTrue(report.hasConcurrencyLimit());
        assertEquals("Took 1002.000ms to sum 100 rolls using a bounded worker pool feeding "
                + "an unbuffered result queue and a concurrency limit of 10. Sum is 350", report.describe());
    }

    @Test
    @DisplayName("Should describe a run that discards results")
    void shouldDescribeCompletedRun() {
        ExecutionReport report = ExecutionReport.completed(StrategyType.FAN_OUT, Duration.ofMillis(5), 100);

        assertFalse(report.hasSum());
        assertFalse(report.hasConcurrencyLimit());
        assertTrue(report.describe().startsWith("Took 5.000ms to do 100 rolls"));
        assertFalse(report.describe().contains("Sum"));
    }

    @Test
    @DisplayName("Aggregator should sum and count results")
    void shouldAggregate() {
        Aggregator aggregator = new Aggregator();
        aggregator.add(3);
        aggregator.add(4);

        assertEquals(7, aggregator.sum());
        assertEquals(2, aggregator.count());
        aggregator.verifyCount(2);
        assertThrows(IllegalStateException.class, () -> aggregator.verifyCount(3));
    }
}
