package com.acme.vision.pipeline.memory;

/**
 * Contract for descriptor-keyed frame buffer reuse.
 *
 * <p>Each granted buffer starts with a reference count of one held by the caller.
 * When the last holder releases it, the buffer returns to the pool's idle list
 * for its descriptor instead of being destroyed. Closing the pool destroys idle
 * buffers; buffers released after close are destroyed rather than cached.
 */
public interface FrameBufferPool extends AutoCloseable {
    /**
     * Returns an idle buffer whose descriptor equals {@code descriptor}, or a fresh one.
     *
     * @return a {@link LeaseResult} whose buffer must be released by the caller
     */
    LeaseResult acquireBuffer(FrameDescriptor descriptor);

    /**
     * Same as {@link #acquireBuffer} but throws when the pool denies the request.
     *
     * @throws AllocationDeniedException with the pool's reason code
     */
    default FrameBuffer acquireBufferOrThrow(FrameDescriptor descriptor) {
        LeaseResult result = acquireBuffer(descriptor);
        if (result instanceof LeaseResult.Granted granted) {
            return granted.buffer();
        }
        throw new AllocationDeniedException(((LeaseResult.Denied) result).reasonCode());
    }

    /** Number of idle buffers cached for {@code descriptor}. */
    int idleCount(FrameDescriptor descriptor);

    /** Destroys idle buffers that went unused past the idle time-to-live. */
    void trimIdle();

    /** Destroys every idle buffer. */
    void purgeIdle();

    /** Returns a snapshot of current pool statistics. */
    PoolStats stats();

    @Override
    default void close() {
    }
}
