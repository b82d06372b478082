package com.acme.vision.pipeline.config;

import com.acme.vision.pipeline.util.EnvVars;
import com.acme.vision.pipeline.util.PipelineDefaults;
import com.acme.vision.pipeline.util.PipelineEnvKeys;

import java.util.Map;

/**
 * Runtime tuning for the worker context, buffer pool and metrics reporter.
 */
public record PipelineConfig(
    String workerName,
    int workerQueueCapacity,
    long shutdownTimeoutMillis,
    long poolMaxBytes,
    int poolMaxIdlePerDescriptor,
    int poolIdleTtlRequests,
    boolean poolDirectMemory,
    boolean strictRefCounting,
    boolean metricsEnabled,
    int metricsLogIntervalSeconds
) {

    public PipelineConfig {
        if (workerName == null || workerName.isBlank()) {
            workerName = PipelineDefaults.DEFAULT_WORKER_NAME;
        }
        if (workerQueueCapacity <= 0) {
            throw new IllegalArgumentException("workerQueueCapacity must be positive, got " + workerQueueCapacity);
        }
        if (poolMaxBytes <= 0) {
            throw new IllegalArgumentException("poolMaxBytes must be positive, got " + poolMaxBytes);
        }
        if (poolMaxIdlePerDescriptor < 0) {
            throw new IllegalArgumentException("poolMaxIdlePerDescriptor must be >= 0, got " + poolMaxIdlePerDescriptor);
        }
        if (poolIdleTtlRequests <= 0) {
            throw new IllegalArgumentException("poolIdleTtlRequests must be positive, got " + poolIdleTtlRequests);
        }
        shutdownTimeoutMillis = Math.max(1L, shutdownTimeoutMillis);
        metricsLogIntervalSeconds = Math.max(1, metricsLogIntervalSeconds);
    }

    public static PipelineConfig defaults() {
        return fromEnv(Map.of());
    }

    public static PipelineConfig fromSystemEnv() {
        return fromEnv(System.getenv());
    }

    public static PipelineConfig fromEnv(Map<String, String> env) {
        return new PipelineConfig(
            EnvVars.getOrDefault(env, PipelineEnvKeys.PIPELINE_WORKER_NAME, PipelineDefaults.DEFAULT_WORKER_NAME),
            EnvVars.getIntClamped(env, PipelineEnvKeys.PIPELINE_WORKER_QUEUE_CAPACITY,
                PipelineDefaults.DEFAULT_WORKER_QUEUE_CAPACITY, 16, 1 << 20),
            EnvVars.getLongClamped(env, PipelineEnvKeys.PIPELINE_SHUTDOWN_TIMEOUT_MS,
                PipelineDefaults.DEFAULT_SHUTDOWN_TIMEOUT_MS, 1L, 600_000L),
            EnvVars.getLongClamped(env, PipelineEnvKeys.PIPELINE_POOL_MAX_BYTES,
                PipelineDefaults.DEFAULT_POOL_MAX_BYTES, 1024L, Long.MAX_VALUE),
            EnvVars.getIntClamped(env, PipelineEnvKeys.PIPELINE_POOL_MAX_IDLE_PER_DESCRIPTOR,
                PipelineDefaults.DEFAULT_POOL_MAX_IDLE_PER_DESCRIPTOR, 0, 1024),
            EnvVars.getIntClamped(env, PipelineEnvKeys.PIPELINE_POOL_IDLE_TTL_REQUESTS,
                PipelineDefaults.DEFAULT_POOL_IDLE_TTL_REQUESTS, 1, 1_000_000),
            EnvVars.getBoolean(env, PipelineEnvKeys.PIPELINE_POOL_DIRECT_MEMORY, false),
            EnvVars.getBoolean(env, PipelineEnvKeys.PIPELINE_STRICT_REFCOUNT, true),
            EnvVars.getBoolean(env, PipelineEnvKeys.PIPELINE_METRICS_ENABLED, true),
            EnvVars.getIntClamped(env, PipelineEnvKeys.PIPELINE_METRICS_LOG_INTERVAL_SEC,
                PipelineDefaults.DEFAULT_METRICS_LOG_INTERVAL_SEC, 1, 3600)
        );
    }

    public PipelineConfig withWorkerName(String name) {
        return new PipelineConfig(name, workerQueueCapacity, shutdownTimeoutMillis, poolMaxBytes,
            poolMaxIdlePerDescriptor, poolIdleTtlRequests, poolDirectMemory, strictRefCounting,
            metricsEnabled, metricsLogIntervalSeconds);
    }
}
