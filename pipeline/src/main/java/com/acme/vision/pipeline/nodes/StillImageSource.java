package com.acme.vision.pipeline.nodes;

import com.acme.vision.pipeline.context.WorkerContext;
import com.acme.vision.pipeline.graph.AbstractImageSource;
import com.acme.vision.pipeline.graph.ImageConsumer;
import com.acme.vision.pipeline.graph.Pipelines;
import com.acme.vision.pipeline.graph.TargetList;
import com.acme.vision.pipeline.memory.FrameBuffer;
import com.acme.vision.pipeline.memory.FrameBufferPool;
import com.acme.vision.pipeline.memory.FrameTiming;
import com.acme.vision.pipeline.memory.LeaseResult;
import com.acme.vision.pipeline.util.PipelineStatusCodes;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Source for one static image. After the first {@link #processImage()} it keeps a hold on
 * its output and replays it to every target attached later.
 */
public final class StillImageSource extends AbstractImageSource implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(StillImageSource.class.getName());

    private final FrameBufferPool pool;

    // worker-confined
    private FrameBuffer image;
    private boolean hasProcessedImage;

    public StillImageSource(WorkerContext context, FrameBufferPool pool) {
        super(context);
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    /**
     * Uploads {@code frame} as the current image, replacing and releasing any previous one.
     * Nothing is broadcast until {@link #processImage()}.
     */
    public CompletableFuture<FrameOutcome> upload(RawFrame frame) {
        Objects.requireNonNull(frame, "frame");
        return context().supplyAsync(() -> {
            LeaseResult lease = FrameUploads.upload(pool, frame, context().metrics());
            if (lease instanceof LeaseResult.Denied denied) {
                return new FrameOutcome.Denied(denied.reasonCode());
            }
            FrameBuffer buffer = ((LeaseResult.Granted) lease).buffer();
            buffer.setTiming(FrameTiming.STILL_IMAGE);
            replaceImage(buffer);
            return new FrameOutcome.Broadcast(buffer.bufferId(), 0);
        });
    }

    /**
     * Adopts an already filled buffer as the current image. Takes over the caller's hold.
     * Setting the image this source already holds is a no-op and takes no further hold.
     */
    public CompletableFuture<Void> setImage(FrameBuffer buffer) {
        Objects.requireNonNull(buffer, "buffer");
        return context().supplyAsync(() -> {
            replaceImage(buffer);
            return null;
        });
    }

    /**
     * Broadcasts the current image to all targets. Completes with {@code Denied(409)} when
     * no image was uploaded yet.
     */
    public CompletableFuture<FrameOutcome> processImage() {
        return context().supplyAsync(() -> {
            if (image == null) {
                return new FrameOutcome.Denied(PipelineStatusCodes.CONFLICT);
            }
            hasProcessedImage = true;
            int delivered = updateTargetsWithFrame(image);
            return new FrameOutcome.Broadcast(image.bufferId(), delivered);
        });
    }

    @Override
    public void transmitPreviousImage(ImageConsumer target, int slot) {
        if (!hasProcessedImage || image == null) {
            return;
        }
        image.acquire();
        Pipelines.deliver(List.of(new TargetList.Target(target, slot)), image, context().metrics());
    }

    private void replaceImage(FrameBuffer buffer) {
        if (buffer == image) {
            return;
        }
        FrameBuffer previous = image;
        image = buffer;
        hasProcessedImage = false;
        if (previous != null) {
            previous.release();
        }
    }

    /** Drops the held image so it can return to the pool. */
    @Override
    public void close() {
        if (context().isRunning()) {
            context().runSync(this::dropImage);
        } else {
            dropImage();
        }
    }

    private void dropImage() {
        if (image != null) {
            LOG.fine(() -> "Releasing still image " + image.bufferId());
            image.release();
            image = null;
            hasProcessedImage = false;
        }
    }
}
