package com.acme.vision.pipeline.telemetry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AtomicPipelineMetricsTest {

    @Test
    void shouldAccumulateCountersAndReasonMaps() {
        AtomicPipelineMetrics metrics = new AtomicPipelineMetrics();
        metrics.incBroadcasts(3);
        metrics.incDeliveries(5);
        metrics.incDeliveries(-2);
        metrics.incPoolDenied(1, 507);
        metrics.incPoolDenied(2, 507);
        metrics.incFramesDropped(1, 429);
        metrics.incFramesDropped(0, 503);
        metrics.setWorkerQueueDepth(-4);

        AtomicPipelineMetrics.Snapshot s = metrics.snapshot();
        assertEquals(3L, s.broadcasts());
        assertEquals(5L, s.deliveries());
        assertEquals(3L, s.poolDeniedByReason().get(507));
        assertEquals(1L, s.droppedByReason().get(429));
        assertFalse(s.droppedByReason().containsKey(503));
        assertEquals(0, s.workerQueueDepth());
    }

    @Test
    void shouldTrackFrameLatencyPercentile() {
        AtomicPipelineMetrics metrics = new AtomicPipelineMetrics();
        for (int i = 1; i <= 100; i++) {
            metrics.observeFrameNanos(i * 1_000L);
        }
        metrics.observeFrameNanos(-1);

        AtomicPipelineMetrics.Snapshot s = metrics.snapshot();
        assertEquals(100L, s.frameSamples());
        assertEquals(5_050_000L, s.frameNanosTotal());
        assertTrue(s.frameP99Nanos() >= 99_000L);
    }
}
