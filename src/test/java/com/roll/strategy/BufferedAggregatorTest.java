package com.roll.strategy;

import com.roll.core.CountingTaskSource;
import com.roll.core.ExecutionReport;
import com.roll.queue.ResultQueue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BufferedAggregator.
 */
class BufferedAggregatorTest {

    @Test
    @DisplayName("Should size the queue to N so no producer ever waits")
    void shouldNeverBlockProducers() throws Exception {
        BufferedAggregator aggregator = new BufferedAggregator("buffered-test-");

        ExecutionReport report = aggregator.run(new CountingTaskSource(1), 200);

        ResultQueue<Integer> queue = aggregator.getLastQueue();
        assertEquals(200, queue.capacity());
        assertEquals(0, queue.getBlockedPutCount());
        assertTrue(queue.isClosed());
        assertEquals(0, queue.size());
        assertEquals(CountingTaskSource.triangular(200), report.sum());
    }

    @Test
    @DisplayName("Should run producers concurrently")
    void shouldProduceConcurrently() throws Exception {
        BufferedAggregator aggregator = new BufferedAggregator("buffered-test-");
        CountingTaskSource source = new CountingTaskSource(100);

        ExecutionReport report = aggregator.run(source, 20);

        assertTrue(report.elapsed().toMillis() < 1000, "Took " + report.elapsed().toMillis() + "ms");
        assertTrue(source.getMaxInFlight() > 1);
    }
}
