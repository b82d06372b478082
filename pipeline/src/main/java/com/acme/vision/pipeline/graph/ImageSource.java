package com.acme.vision.pipeline.graph;

import com.acme.vision.pipeline.context.WorkerContext;
import com.acme.vision.pipeline.memory.FrameBuffer;

import java.util.concurrent.CompletableFuture;

/**
 * A node that produces frame buffers and fans them out to attached consumers.
 *
 * <p>Implementations supply the target list, the worker context they run on and
 * the replay hook; wiring and broadcast come from the default methods, which all
 * route through {@link Pipelines}.</p>
 */
public interface ImageSource {
    TargetList targets();

    WorkerContext context();

    /**
     * Called on the worker right after a new edge is bound so a source holding a
     * last frame can deliver it to {@code target} alone. Live sources do nothing.
     */
    void transmitPreviousImage(ImageConsumer target, int slot);

    default CompletableFuture<ConnectResult> addTarget(ImageConsumer target) {
        return Pipelines.connect(this, target);
    }

    default CompletableFuture<ConnectResult> addTarget(ImageConsumer target, int slot) {
        return Pipelines.connect(this, target, slot);
    }

    default CompletableFuture<Void> removeTarget(ImageConsumer target) {
        return Pipelines.disconnect(this, target);
    }

    default CompletableFuture<Void> removeAllTargets() {
        return Pipelines.disconnectAll(this);
    }

    /**
     * Broadcasts {@code buffer} to every live target. Must run on the worker context.
     * The caller's own hold on {@code buffer} is untouched.
     *
     * @return number of targets the buffer was delivered to
     */
    default int updateTargetsWithFrame(FrameBuffer buffer) {
        return Pipelines.broadcast(this, buffer);
    }

    default <T extends ImageConsumer> T then(T next) {
        return Pipelines.chain(this, next);
    }
}
