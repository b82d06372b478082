package com.acme.vision.pipeline.memory;

import io.netty.buffer.ByteBuf;

import java.util.Optional;

/**
 * FrameBuffer: pooled, reference-counted image memory flowing through the graph.
 * Ownership: every {@link #acquire()} MUST be paired with exactly one {@link #release()}.
 */
public interface FrameBuffer extends AutoCloseable {
    long bufferId();
    FrameDescriptor descriptor();

    /** Backing pixel memory; readable only while {@link #isLive()}. */
    ByteBuf data();

    FrameTiming timing();
    void setTiming(FrameTiming timing);

    /** Pool this buffer returns to, empty for buffers wrapping external memory. */
    Optional<FrameBufferPool> owner();

    int refCount();

    default boolean isLive() {
        return refCount() > 0;
    }

    FrameBuffer acquire();

    /**
     * @return {@code true} when this call dropped the count to zero
     */
    boolean release();

    @Override
    default void close() { release(); }
}
