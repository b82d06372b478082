package com.acme.vision.pipeline.util;

/**
 * Default capacity, timeout, and tuning constants for the pipeline runtime.
 * <p>
 * These values are used when the corresponding environment variable is not set.
 */
public final class PipelineDefaults {

    // ---- Worker context ----
    public static final int DEFAULT_WORKER_QUEUE_CAPACITY = 4096;
    public static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 5_000L;
    public static final String DEFAULT_WORKER_NAME = "frame-graph";

    // ---- Buffer pool ----
    public static final long DEFAULT_POOL_MAX_BYTES = 512L * 1024 * 1024;
    public static final int DEFAULT_POOL_MAX_IDLE_PER_DESCRIPTOR = 8;
    public static final int DEFAULT_POOL_IDLE_TTL_REQUESTS = 600;
    public static final int POOL_SWEEP_INTERVAL_REQUESTS = 64;

    // ---- Metrics ----
    public static final int DEFAULT_METRICS_LOG_INTERVAL_SEC = 30;

    // ---- Frame producers ----
    public static final long ENCODER_READY_POLL_NANOS = 1_000_000L;
    public static final long READER_JOIN_TIMEOUT_MS = 2_000L;

    private PipelineDefaults() {
    }
}
