package com.acme.vision.pipeline.nodes;

import com.acme.vision.pipeline.context.SubmitResult;
import com.acme.vision.pipeline.context.WorkerContext;
import com.acme.vision.pipeline.graph.AbstractImageSource;
import com.acme.vision.pipeline.graph.ImageConsumer;
import com.acme.vision.pipeline.memory.FrameBuffer;
import com.acme.vision.pipeline.memory.FrameBufferPool;
import com.acme.vision.pipeline.memory.LeaseResult;
import com.acme.vision.pipeline.telemetry.PipelineMetrics;
import com.acme.vision.pipeline.util.PipelineStatusCodes;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Push-based source for live producers such as a camera callback thread.
 *
 * <p>Each submitted frame is uploaded into a pooled buffer, broadcast, and the producer's
 * own hold released, all in one worker task. A frame arriving while the worker queue is
 * full is dropped rather than blocking the producer. Live input never replays.</p>
 */
public class FrameInput extends AbstractImageSource {
    private static final Logger LOG = Logger.getLogger(FrameInput.class.getName());

    private final FrameBufferPool pool;
    private final boolean runBenchmark;

    // written by the worker only
    private volatile long framesProcessed;
    private volatile long totalFrameNanos;

    public FrameInput(WorkerContext context, FrameBufferPool pool) {
        this(context, pool, false);
    }

    /**
     * @param runBenchmark log current and average per-frame processing time
     */
    public FrameInput(WorkerContext context, FrameBufferPool pool, boolean runBenchmark) {
        super(context);
        this.pool = Objects.requireNonNull(pool, "pool");
        this.runBenchmark = runBenchmark;
    }

    /**
     * Enqueues upload and broadcast of {@code frame} without waiting. Completes with
     * {@code Dropped(429)} if the worker queue is full and {@code Dropped(503)} if the
     * context is closed.
     */
    public CompletableFuture<FrameOutcome> submitFrame(RawFrame frame) {
        Objects.requireNonNull(frame, "frame");
        CompletableFuture<FrameOutcome> result = new CompletableFuture<>();
        SubmitResult submit = context().trySubmit(() -> {
            try {
                result.complete(processFrame(frame));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
                throw e;
            }
        });
        if (submit instanceof SubmitResult.Busy busy) {
            LOG.fine(() -> "Dropping frame, worker queue full depth=" + busy.depth());
            return dropped(PipelineStatusCodes.TOO_MANY_REQUESTS);
        }
        if (submit instanceof SubmitResult.Closed) {
            return dropped(PipelineStatusCodes.SERVICE_UNAVAILABLE);
        }
        return result;
    }

    private CompletableFuture<FrameOutcome> dropped(int reasonCode) {
        context().metrics().incFramesDropped(1L, reasonCode);
        return CompletableFuture.completedFuture(new FrameOutcome.Dropped(reasonCode));
    }

    /**
     * Uploads and broadcasts one frame. Runs on the worker.
     */
    FrameOutcome processFrame(RawFrame frame) {
        long startNanos = System.nanoTime();
        PipelineMetrics metrics = context().metrics();
        LeaseResult lease = FrameUploads.upload(pool, frame, metrics);
        if (lease instanceof LeaseResult.Denied denied) {
            return new FrameOutcome.Denied(denied.reasonCode());
        }
        FrameBuffer buffer = ((LeaseResult.Granted) lease).buffer();
        long bufferId = buffer.bufferId();
        int delivered;
        try {
            delivered = updateTargetsWithFrame(buffer);
        } finally {
            buffer.release();
        }
        long elapsed = System.nanoTime() - startNanos;
        metrics.observeFrameNanos(elapsed);
        framesProcessed++;
        totalFrameNanos += elapsed;
        if (runBenchmark && LOG.isLoggable(Level.INFO)) {
            LOG.info(String.format("Frame %d: current %.3f ms, average %.3f ms",
                framesProcessed, elapsed / 1_000_000d, averageFrameTimeNanos() / 1_000_000d));
        }
        return new FrameOutcome.Broadcast(bufferId, delivered);
    }

    /** Mean upload plus broadcast time so far. */
    public double averageFrameTimeNanos() {
        return framesProcessed == 0 ? 0d : (double) totalFrameNanos / framesProcessed;
    }

    public long framesProcessed() {
        return framesProcessed;
    }

    protected boolean runBenchmark() {
        return runBenchmark;
    }

    @Override
    public void transmitPreviousImage(ImageConsumer target, int slot) {
        // live frames are not replayed
    }
}
