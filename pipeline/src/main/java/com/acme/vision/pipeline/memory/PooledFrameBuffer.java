package com.acme.vision.pipeline.memory;

import com.acme.vision.pipeline.telemetry.PipelineMetrics;
import io.netty.buffer.ByteBuf;

import java.util.Optional;

/**
 * Buffer owned by a {@link CachingFrameBufferPool}; returns to its idle list on the last release.
 */
final class PooledFrameBuffer extends AbstractFrameBuffer {
    private final CachingFrameBufferPool pool;

    PooledFrameBuffer(FrameDescriptor descriptor,
                      ByteBuf data,
                      CachingFrameBufferPool pool,
                      boolean strictRefCounting,
                      PipelineMetrics metrics) {
        super(descriptor, data, strictRefCounting, metrics);
        this.pool = pool;
    }

    @Override
    public Optional<FrameBufferPool> owner() {
        return Optional.of(pool);
    }

    @Override
    void onLastRelease() {
        pool.recycle(this);
    }
}
