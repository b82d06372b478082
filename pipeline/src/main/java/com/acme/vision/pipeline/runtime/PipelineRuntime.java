package com.acme.vision.pipeline.runtime;

import com.acme.vision.pipeline.config.PipelineConfig;
import com.acme.vision.pipeline.context.WorkerContext;
import com.acme.vision.pipeline.memory.CachingFrameBufferPool;
import com.acme.vision.pipeline.memory.FrameBufferPool;
import com.acme.vision.pipeline.telemetry.AtomicPipelineMetrics;
import com.acme.vision.pipeline.telemetry.NoopPipelineMetrics;
import com.acme.vision.pipeline.telemetry.PeriodicMetricsReporter;
import com.acme.vision.pipeline.telemetry.PipelineMetrics;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Owns the shared pieces a graph runs on: metrics, the worker context and the buffer pool.
 * Nodes are built against {@link #context()} and {@link #pool()}.
 */
public final class PipelineRuntime implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PipelineRuntime.class.getName());

    private final PipelineConfig config;
    private final PipelineMetrics metrics;
    private final WorkerContext context;
    private final CachingFrameBufferPool pool;
    private final PeriodicMetricsReporter reporter;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private PipelineRuntime(PipelineConfig config,
                            PipelineMetrics metrics,
                            WorkerContext context,
                            CachingFrameBufferPool pool,
                            PeriodicMetricsReporter reporter) {
        this.config = config;
        this.metrics = metrics;
        this.context = context;
        this.pool = pool;
        this.reporter = reporter;
    }

    public static PipelineRuntime start() {
        return start(PipelineConfig.fromSystemEnv());
    }

    public static PipelineRuntime start(PipelineConfig config) {
        Objects.requireNonNull(config, "config");
        PipelineMetrics metrics = config.metricsEnabled() ? new AtomicPipelineMetrics() : NoopPipelineMetrics.INSTANCE;
        CachingFrameBufferPool pool = new CachingFrameBufferPool(config, metrics);
        WorkerContext context = WorkerContext.create(config, metrics).start();
        PeriodicMetricsReporter reporter = null;
        if (metrics instanceof AtomicPipelineMetrics atomic) {
            reporter = new PeriodicMetricsReporter(atomic, config.metricsLogIntervalSeconds(), pool::stats);
            reporter.start();
        }
        LOG.info(() -> "Pipeline runtime started"
            + " worker=" + config.workerName()
            + " queueCapacity=" + config.workerQueueCapacity()
            + " poolMaxBytes=" + config.poolMaxBytes()
            + " poolDirectMemory=" + config.poolDirectMemory()
            + " strictRefCounting=" + config.strictRefCounting()
            + " metricsEnabled=" + config.metricsEnabled());
        return new PipelineRuntime(config, metrics, context, pool, reporter);
    }

    public PipelineConfig config() {
        return config;
    }

    public PipelineMetrics metrics() {
        return metrics;
    }

    public WorkerContext context() {
        return context;
    }

    public FrameBufferPool pool() {
        return pool;
    }

    /**
     * Drains the worker, stops the reporter and closes the pool, in that order. Idempotent.
     */
    @Override
    public void close() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        try {
            context.stopAndDrain(Duration.ofMillis(config.shutdownTimeoutMillis()));
        } catch (Exception e) {
            LOG.fine("Shutdown: worker context stop failed: " + e.getClass().getSimpleName());
        }
        if (reporter != null) {
            try {
                reporter.close();
            } catch (Exception e) {
                LOG.fine("Shutdown: metricsReporter stop failed: " + e.getClass().getSimpleName());
            }
        }
        try {
            pool.close();
        } catch (Exception e) {
            LOG.fine("Shutdown: pool close failed: " + e.getClass().getSimpleName());
        }
    }
}
