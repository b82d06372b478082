package com.acme.vision.pipeline.telemetry;

public final class NoopPipelineMetrics implements PipelineMetrics {
    public static final NoopPipelineMetrics INSTANCE = new NoopPipelineMetrics();

    private NoopPipelineMetrics() {
    }

    @Override
    public void incBroadcasts(long n) {
    }

    @Override
    public void incDeliveries(long n) {
    }

    @Override
    public void incEmptyBroadcasts(long n) {
    }

    @Override
    public void incCapacityWarnings(long n) {
    }

    @Override
    public void incConsumerFailures(long n) {
    }

    @Override
    public void incRefCountViolations(long n) {
    }

    @Override
    public void incPoolHits(long n) {
    }

    @Override
    public void incPoolMisses(long n) {
    }

    @Override
    public void incPoolDenied(long n, int reasonCode) {
    }

    @Override
    public void incFramesDropped(long n, int reasonCode) {
    }

    @Override
    public void incTaskFailures(long n) {
    }

    @Override
    public void observeFrameNanos(long nanos) {
    }

    @Override
    public void setWorkerQueueDepth(int depth) {
    }
}
