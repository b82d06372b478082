package com.acme.vision.pipeline.nodes;

import com.acme.vision.pipeline.context.WorkerContext;
import com.acme.vision.pipeline.graph.AbstractImageConsumer;
import com.acme.vision.pipeline.memory.FrameBuffer;
import com.acme.vision.pipeline.memory.FrameDescriptor;
import com.acme.vision.pipeline.memory.FrameTiming;

import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sink that copies each frame into host memory and hands it to a callback.
 */
public final class ReadbackOutput extends AbstractImageConsumer {
    private static final Logger LOG = Logger.getLogger(ReadbackOutput.class.getName());

    /** Host copy of one frame; {@code pixels} belongs to the receiver. */
    public record Readback(byte[] pixels, FrameDescriptor descriptor, FrameTiming timing) {}

    private volatile Consumer<Readback> dataAvailableCallback;

    public ReadbackOutput(WorkerContext context) {
        super(context, 1);
    }

    public void setDataAvailableCallback(Consumer<Readback> callback) {
        this.dataAvailableCallback = callback;
    }

    @Override
    public void newFrameAvailable(FrameBuffer buffer, int fromSlot) {
        FrameDescriptor descriptor = buffer.descriptor();
        FrameTiming timing = buffer.timing();
        byte[] pixels = new byte[(int) descriptor.byteSize()];
        buffer.data().getBytes(0, pixels);
        buffer.release();
        Consumer<Readback> callback = dataAvailableCallback;
        if (callback == null) {
            return;
        }
        try {
            callback.accept(new Readback(pixels, descriptor, timing));
        } catch (RuntimeException e) {
            // already released, so the failure must not reach the broadcaster
            LOG.log(Level.WARNING, "Readback callback failed for " + descriptor, e);
            context().metrics().incConsumerFailures(1L);
        }
    }
}
