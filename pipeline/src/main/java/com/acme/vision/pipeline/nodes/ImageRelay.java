package com.acme.vision.pipeline.nodes;

import com.acme.vision.pipeline.context.WorkerContext;
import com.acme.vision.pipeline.graph.AbstractImageOperation;
import com.acme.vision.pipeline.graph.ImageConsumer;
import com.acme.vision.pipeline.graph.Pipelines;
import com.acme.vision.pipeline.graph.TargetList;
import com.acme.vision.pipeline.memory.FrameBuffer;

import java.util.List;
import java.util.function.Consumer;

/**
 * Pass-through node with one input. Observes each frame through an optional callback and
 * forwards it unchanged to its targets, unless relaying is switched off.
 */
public class ImageRelay extends AbstractImageOperation {
    private volatile Consumer<FrameBuffer> newImageCallback;
    private volatile boolean preventRelay;

    public ImageRelay(WorkerContext context) {
        super(context, 1);
    }

    /**
     * Called on the worker for every incoming frame, before it is forwarded. The buffer
     * is only valid during the call; acquire it to keep it longer.
     */
    public void setNewImageCallback(Consumer<FrameBuffer> callback) {
        this.newImageCallback = callback;
    }

    public void setPreventRelay(boolean preventRelay) {
        this.preventRelay = preventRelay;
    }

    public boolean preventRelay() {
        return preventRelay;
    }

    @Override
    public void newFrameAvailable(FrameBuffer buffer, int fromSlot) {
        Consumer<FrameBuffer> callback = newImageCallback;
        if (callback != null) {
            callback.accept(buffer);
        }
        if (preventRelay) {
            buffer.release();
            return;
        }
        relayFrameOnward(buffer);
    }

    /**
     * Hands the relay's single hold on {@code buffer} over to its targets: one acquire per
     * target, then one release of its own, then delivery.
     */
    protected void relayFrameOnward(FrameBuffer buffer) {
        List<TargetList.Target> targets = targets().snapshot();
        for (int i = 0; i < targets.size(); i++) {
            buffer.acquire();
        }
        buffer.release();
        context().metrics().incBroadcasts(1L);
        if (targets.isEmpty()) {
            context().metrics().incEmptyBroadcasts(1L);
            return;
        }
        Pipelines.deliver(targets, buffer, context().metrics());
    }

    /** Asks the upstream source to replay into this relay, which forwards to all targets. */
    @Override
    public void transmitPreviousImage(ImageConsumer target, int slot) {
        sources().get(0).ifPresent(upstream -> upstream.transmitPreviousImage(this, 0));
    }
}
