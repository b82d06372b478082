package com.acme.vision.pipeline.telemetry;

import com.acme.vision.pipeline.memory.PoolStats;
import com.acme.vision.pipeline.util.JsonCodec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Logs pipeline counters and pool statistics as one JSON line at a fixed interval.
 */
public final class PeriodicMetricsReporter implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PeriodicMetricsReporter.class.getName());

    private final AtomicPipelineMetrics metrics;
    private final Supplier<PoolStats> poolStatsSupplier;
    private final ScheduledExecutorService executor;
    private final long intervalSeconds;

    public PeriodicMetricsReporter(AtomicPipelineMetrics metrics,
                                   long intervalSeconds,
                                   Supplier<PoolStats> poolStatsSupplier) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.intervalSeconds = Math.max(1L, intervalSeconds);
        this.poolStatsSupplier = poolStatsSupplier == null ? (() -> null) : poolStatsSupplier;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "frame-graph-metrics-reporter");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        executor.scheduleAtFixedRate(this::emit, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    void emit() {
        try {
            LOG.info(render());
        } catch (Throwable t) {
            LOG.warning("Metrics reporter failure: " + t.getClass().getSimpleName());
        }
    }

    String render() {
        Map<String, Object> payload = payload();
        try {
            return JsonCodec.writeString(payload);
        } catch (Exception e) {
            return payload.toString();
        }
    }

    Map<String, Object> payload() {
        AtomicPipelineMetrics.Snapshot s = metrics.snapshot();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("component", "frame-graph");
        payload.put("type", "pipeline_metrics");
        payload.put("broadcasts", s.broadcasts());
        payload.put("deliveries", s.deliveries());
        payload.put("emptyBroadcasts", s.emptyBroadcasts());
        payload.put("capacityWarnings", s.capacityWarnings());
        payload.put("consumerFailures", s.consumerFailures());
        payload.put("refCountViolations", s.refCountViolations());
        payload.put("taskFailures", s.taskFailures());
        payload.put("workerQueueDepth", s.workerQueueDepth());
        payload.put("frameNanosTotal", s.frameNanosTotal());
        payload.put("frameSamples", s.frameSamples());
        payload.put("frameP99Nanos", s.frameP99Nanos());
        payload.put("poolHits", s.poolHits());
        payload.put("poolMisses", s.poolMisses());
        payload.put("poolDeniedByReason", s.poolDeniedByReason());
        payload.put("droppedByReason", s.droppedByReason());
        PoolStats pool = poolStatsSupplier.get();
        if (pool != null) {
            payload.put("pool", pool);
        }
        return payload;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
