package com.acme.vision.pipeline.memory;

import com.acme.vision.pipeline.telemetry.NoopPipelineMetrics;
import com.acme.vision.pipeline.telemetry.PipelineMetrics;
import io.netty.buffer.ByteBuf;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Reference counting shared by pooled and externally backed buffers.
 *
 * <p>In strict mode an unbalanced acquire/release throws; otherwise it is logged
 * at SEVERE, counted, and the count is left at zero.</p>
 */
abstract class AbstractFrameBuffer implements FrameBuffer {
    private static final Logger LOG = Logger.getLogger(AbstractFrameBuffer.class.getName());
    private static final AtomicLong BUFFER_IDS = new AtomicLong(1);

    private final long bufferId;
    private final FrameDescriptor descriptor;
    private final ByteBuf data;
    private final boolean strictRefCounting;
    private final PipelineMetrics metrics;
    private final AtomicInteger refCount = new AtomicInteger(1);
    private volatile FrameTiming timing = FrameTiming.STILL_IMAGE;

    AbstractFrameBuffer(FrameDescriptor descriptor,
                        ByteBuf data,
                        boolean strictRefCounting,
                        PipelineMetrics metrics) {
        this.bufferId = BUFFER_IDS.getAndIncrement();
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.data = Objects.requireNonNull(data, "data");
        this.strictRefCounting = strictRefCounting;
        this.metrics = metrics == null ? NoopPipelineMetrics.INSTANCE : metrics;
    }

    /** Runs exactly once per drop to zero. */
    abstract void onLastRelease();

    @Override
    public long bufferId() {
        return bufferId;
    }

    @Override
    public FrameDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public ByteBuf data() {
        return data;
    }

    @Override
    public FrameTiming timing() {
        return timing;
    }

    @Override
    public void setTiming(FrameTiming timing) {
        this.timing = timing == null ? FrameTiming.STILL_IMAGE : timing;
    }

    @Override
    public int refCount() {
        return refCount.get();
    }

    @Override
    public FrameBuffer acquire() {
        while (true) {
            int current = refCount.get();
            if (current <= 0) {
                refCountViolation("Acquire after release for bufferId=" + bufferId);
                return this;
            }
            if (refCount.compareAndSet(current, current + 1)) {
                return this;
            }
        }
    }

    @Override
    public boolean release() {
        while (true) {
            int current = refCount.get();
            if (current <= 0) {
                refCountViolation("Double release for bufferId=" + bufferId);
                return false;
            }
            int next = current - 1;
            if (refCount.compareAndSet(current, next)) {
                if (next == 0) {
                    onLastRelease();
                    return true;
                }
                return false;
            }
        }
    }

    /**
     * Re-arms a recycled buffer for a new holder. Only valid at count zero.
     */
    void revive() {
        if (!refCount.compareAndSet(0, 1)) {
            throw new IllegalStateException("Revive of a claimed buffer bufferId=" + bufferId
                + " refCount=" + refCount.get());
        }
    }

    private void refCountViolation(String message) {
        metrics.incRefCountViolations(1L);
        if (strictRefCounting) {
            throw new IllegalStateException(message);
        }
        LOG.severe(message);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[id=" + bufferId + ", " + descriptor.width() + "x" + descriptor.height()
            + " " + descriptor.format() + ", refCount=" + refCount.get() + "]";
    }
}
