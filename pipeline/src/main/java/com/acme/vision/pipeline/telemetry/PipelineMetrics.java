package com.acme.vision.pipeline.telemetry;

public interface PipelineMetrics {
    void incBroadcasts(long n);
    void incDeliveries(long n);
    void incEmptyBroadcasts(long n);
    void incCapacityWarnings(long n);
    void incConsumerFailures(long n);
    void incRefCountViolations(long n);
    void incPoolHits(long n);
    void incPoolMisses(long n);
    void incPoolDenied(long n, int reasonCode);
    void incFramesDropped(long n, int reasonCode);
    void incTaskFailures(long n);
    void observeFrameNanos(long nanos);
    void setWorkerQueueDepth(int depth);
}
