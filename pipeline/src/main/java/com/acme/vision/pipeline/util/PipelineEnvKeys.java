package com.acme.vision.pipeline.util;

/**
 * Canonical environment variable names used by the pipeline runtime.
 */
public final class PipelineEnvKeys {
    public static final String PIPELINE_WORKER_NAME = "PIPELINE_WORKER_NAME";
    public static final String PIPELINE_WORKER_QUEUE_CAPACITY = "PIPELINE_WORKER_QUEUE_CAPACITY";
    public static final String PIPELINE_SHUTDOWN_TIMEOUT_MS = "PIPELINE_SHUTDOWN_TIMEOUT_MS";

    public static final String PIPELINE_POOL_MAX_BYTES = "PIPELINE_POOL_MAX_BYTES";
    public static final String PIPELINE_POOL_MAX_IDLE_PER_DESCRIPTOR = "PIPELINE_POOL_MAX_IDLE_PER_DESCRIPTOR";
    public static final String PIPELINE_POOL_IDLE_TTL_REQUESTS = "PIPELINE_POOL_IDLE_TTL_REQUESTS";
    public static final String PIPELINE_POOL_DIRECT_MEMORY = "PIPELINE_POOL_DIRECT_MEMORY";
    public static final String PIPELINE_STRICT_REFCOUNT = "PIPELINE_STRICT_REFCOUNT";

    public static final String PIPELINE_METRICS_ENABLED = "PIPELINE_METRICS_ENABLED";
    public static final String PIPELINE_METRICS_LOG_INTERVAL_SEC = "PIPELINE_METRICS_LOG_INTERVAL_SEC";

    private PipelineEnvKeys() {
    }
}
