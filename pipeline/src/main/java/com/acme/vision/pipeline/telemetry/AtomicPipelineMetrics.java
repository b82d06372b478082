package com.acme.vision.pipeline.telemetry;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.concurrent.atomic.LongAdder;

public final class AtomicPipelineMetrics implements PipelineMetrics {
    private final LongAdder broadcasts = new LongAdder();
    private final LongAdder deliveries = new LongAdder();
    private final LongAdder emptyBroadcasts = new LongAdder();
    private final LongAdder capacityWarnings = new LongAdder();
    private final LongAdder consumerFailures = new LongAdder();
    private final LongAdder refCountViolations = new LongAdder();
    private final LongAdder poolHits = new LongAdder();
    private final LongAdder poolMisses = new LongAdder();
    private final LongAdder taskFailures = new LongAdder();
    private final LongAdder frameNanos = new LongAdder();
    private final LongAdder frameSamples = new LongAdder();
    private final AtomicInteger workerQueueDepth = new AtomicInteger();
    private final ConcurrentHashMap<Integer, LongAdder> poolDeniedByReason = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Integer, LongAdder> droppedByReason = new ConcurrentHashMap<>();

    private static final int LATENCY_RING_SIZE = 1024;
    private static final int LATENCY_RING_MASK = LATENCY_RING_SIZE - 1;
    private final AtomicLongArray latencyRing = new AtomicLongArray(LATENCY_RING_SIZE);
    private final AtomicLong latencyRingPos = new AtomicLong();

    @Override
    public void incBroadcasts(long n) {
        broadcasts.add(Math.max(0L, n));
    }

    @Override
    public void incDeliveries(long n) {
        deliveries.add(Math.max(0L, n));
    }

    @Override
    public void incEmptyBroadcasts(long n) {
        emptyBroadcasts.add(Math.max(0L, n));
    }

    @Override
    public void incCapacityWarnings(long n) {
        capacityWarnings.add(Math.max(0L, n));
    }

    @Override
    public void incConsumerFailures(long n) {
        consumerFailures.add(Math.max(0L, n));
    }

    @Override
    public void incRefCountViolations(long n) {
        refCountViolations.add(Math.max(0L, n));
    }

    @Override
    public void incPoolHits(long n) {
        poolHits.add(Math.max(0L, n));
    }

    @Override
    public void incPoolMisses(long n) {
        poolMisses.add(Math.max(0L, n));
    }

    @Override
    public void incPoolDenied(long n, int reasonCode) {
        if (n <= 0) return;
        poolDeniedByReason.computeIfAbsent(reasonCode, ignored -> new LongAdder()).add(n);
    }

    @Override
    public void incFramesDropped(long n, int reasonCode) {
        if (n <= 0) return;
        droppedByReason.computeIfAbsent(reasonCode, ignored -> new LongAdder()).add(n);
    }

    @Override
    public void incTaskFailures(long n) {
        taskFailures.add(Math.max(0L, n));
    }

    @Override
    public void observeFrameNanos(long nanos) {
        if (nanos < 0) return;
        frameNanos.add(nanos);
        frameSamples.increment();
        latencyRing.set((int) (latencyRingPos.getAndIncrement() & LATENCY_RING_MASK), nanos);
    }

    @Override
    public void setWorkerQueueDepth(int depth) {
        workerQueueDepth.set(Math.max(0, depth));
    }

    public long p99FrameNanos() {
        long pos = latencyRingPos.get();
        int count = (int) Math.min(pos, LATENCY_RING_SIZE);
        if (count == 0) return 0;
        long[] samples = new long[count];
        int start = (int) ((pos - count) & LATENCY_RING_MASK);
        for (int i = 0; i < count; i++) {
            samples[i] = latencyRing.get((start + i) & LATENCY_RING_MASK);
        }
        Arrays.sort(samples);
        int idx = Math.min((int) (count * 0.99), count - 1);
        return samples[idx];
    }

    public Snapshot snapshot() {
        return new Snapshot(
            broadcasts.sum(),
            deliveries.sum(),
            emptyBroadcasts.sum(),
            capacityWarnings.sum(),
            consumerFailures.sum(),
            refCountViolations.sum(),
            poolHits.sum(),
            poolMisses.sum(),
            taskFailures.sum(),
            workerQueueDepth.get(),
            frameNanos.sum(),
            frameSamples.sum(),
            p99FrameNanos(),
            mapToLongs(poolDeniedByReason),
            mapToLongs(droppedByReason)
        );
    }

    private static Map<Integer, Long> mapToLongs(ConcurrentHashMap<Integer, LongAdder> src) {
        Map<Integer, Long> out = new HashMap<>();
        src.forEach((k, v) -> out.put(k, v.sum()));
        return Collections.unmodifiableMap(out);
    }

    public record Snapshot(long broadcasts,
                           long deliveries,
                           long emptyBroadcasts,
                           long capacityWarnings,
                           long consumerFailures,
                           long refCountViolations,
                           long poolHits,
                           long poolMisses,
                           long taskFailures,
                           int workerQueueDepth,
                           long frameNanosTotal,
                           long frameSamples,
                           long frameP99Nanos,
                           Map<Integer, Long> poolDeniedByReason,
                           Map<Integer, Long> droppedByReason) {}
}
