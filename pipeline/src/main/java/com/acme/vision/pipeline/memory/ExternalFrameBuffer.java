package com.acme.vision.pipeline.memory;

import com.acme.vision.pipeline.telemetry.PipelineMetrics;
import io.netty.buffer.ByteBuf;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Buffer wrapping memory supplied by a producer (camera frame, decoder output).
 * Never returns to a pool; the last release runs the owner's teardown hook once.
 */
public final class ExternalFrameBuffer extends AbstractFrameBuffer {
    private static final Logger LOG = Logger.getLogger(ExternalFrameBuffer.class.getName());

    private final Runnable teardown;
    private final AtomicBoolean tornDown = new AtomicBoolean(false);

    public ExternalFrameBuffer(FrameDescriptor descriptor, ByteBuf data, Runnable teardown) {
        this(descriptor, data, teardown, true, null);
    }

    public ExternalFrameBuffer(FrameDescriptor descriptor,
                               ByteBuf data,
                               Runnable teardown,
                               boolean strictRefCounting,
                               PipelineMetrics metrics) {
        super(descriptor, data, strictRefCounting, metrics);
        this.teardown = teardown == null ? () -> { } : teardown;
    }

    /**
     * Wraps the readable pixels of a Netty buffer, starting at its reader index. The view
     * holds one reference to {@code byteBuf}, released when this frame buffer's count
     * reaches zero.
     */
    public static ExternalFrameBuffer wrapping(FrameDescriptor descriptor, ByteBuf byteBuf) {
        Objects.requireNonNull(byteBuf, "byteBuf");
        if (byteBuf.readableBytes() < descriptor.byteSize()) {
            throw new IllegalArgumentException("ByteBuf holds " + byteBuf.readableBytes()
                + " readable bytes, descriptor needs " + descriptor.byteSize());
        }
        ByteBuf retained = byteBuf.retainedSlice(byteBuf.readerIndex(), (int) descriptor.byteSize());
        return new ExternalFrameBuffer(descriptor, retained, retained::release);
    }

    @Override
    public Optional<FrameBufferPool> owner() {
        return Optional.empty();
    }

    public boolean isTornDown() {
        return tornDown.get();
    }

    @Override
    void onLastRelease() {
        if (!tornDown.compareAndSet(false, true)) {
            return;
        }
        try {
            teardown.run();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "External teardown failed for bufferId=" + bufferId(), e);
        }
    }
}
