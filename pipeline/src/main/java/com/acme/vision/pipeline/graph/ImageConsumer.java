package com.acme.vision.pipeline.graph;

import com.acme.vision.pipeline.context.WorkerContext;
import com.acme.vision.pipeline.memory.FrameBuffer;

import java.util.concurrent.CompletableFuture;

/**
 * A node that receives frame buffers on numbered input slots.
 */
public interface ImageConsumer {
    /** Fixed upper bound on input slots; slots are {@code 0 .. maximumInputs - 1}. */
    int maximumInputs();

    SourceSlots sources();

    WorkerContext context();

    /**
     * Delivery callback, invoked on the worker context. The broadcaster already acquired
     * {@code buffer} on this consumer's behalf; the consumer must call
     * {@link FrameBuffer#release()} exactly once when done with it, possibly later and
     * from another thread.
     */
    void newFrameAvailable(FrameBuffer buffer, int fromSlot);

    /**
     * A consumer reporting {@code false} is dropped from target lists on their next traversal.
     */
    default boolean isLive() {
        return true;
    }

    default CompletableFuture<Void> removeAllSources() {
        return Pipelines.disconnectAllSources(this);
    }
}
