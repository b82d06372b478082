package com.acme.vision.pipeline.nodes;

import com.acme.vision.pipeline.context.WorkerContext;
import com.acme.vision.pipeline.graph.AbstractImageConsumer;
import com.acme.vision.pipeline.memory.FrameBuffer;
import com.acme.vision.pipeline.memory.Timestamp;
import com.acme.vision.pipeline.util.PipelineDefaults;
import com.acme.vision.pipeline.util.PipelineStatusCodes;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.LockSupport;
import java.util.logging.Logger;

/**
 * Sink that writes video frames to a {@link FrameEncoder}.
 *
 * <p>Encoding runs on a dedicated worker context so a slow encoder does not stall the graph.
 * Each delivered buffer is held across the hand-off and released exactly once after the
 * encoding task. Still images are ignored, a frame repeating the previous timestamp is
 * dropped, and with {@code liveVideo} a frame arriving while the encoder is busy is dropped
 * instead of waited for.</p>
 */
public final class FrameRecorder extends AbstractImageConsumer implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(FrameRecorder.class.getName());

    private final FrameEncoder encoder;
    private final WorkerContext encodingContext;
    private final boolean liveVideo;
    private final AtomicLong framesWritten = new AtomicLong();
    private final AtomicLong framesDropped = new AtomicLong();

    // encoding-context confined
    private boolean recording;
    private boolean sessionStarted;
    private Timestamp previousFrameTime;

    public FrameRecorder(WorkerContext context, FrameEncoder encoder, boolean liveVideo) {
        super(context, 1);
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.liveVideo = liveVideo;
        this.encodingContext = new WorkerContext(context.name() + "-recorder", 256, context.metrics()).start();
    }

    public CompletableFuture<Void> startRecording() {
        return encodingContext.supplyAsync(() -> {
            if (recording) {
                return null;
            }
            encoder.start();
            recording = true;
            sessionStarted = false;
            previousFrameTime = null;
            LOG.fine(() -> "Recording started on " + encodingContext.name());
            return null;
        });
    }

    /**
     * Stops accepting frames and finishes the output after every frame handed over before
     * this call was encoded.
     */
    public CompletableFuture<Void> finishRecording() {
        return encodingContext.supplyAsync(() -> {
            if (!recording) {
                return null;
            }
            recording = false;
            encoder.finish();
            LOG.fine(() -> "Recording finished written=" + framesWritten.get() + " dropped=" + framesDropped.get());
            return null;
        });
    }

    @Override
    public void newFrameAvailable(FrameBuffer buffer, int fromSlot) {
        Optional<Timestamp> time = buffer.timing().timestamp();
        if (time.isEmpty()) {
            buffer.release();
            return;
        }
        try {
            encodingContext.runAsync(() -> {
                try {
                    encode(buffer, time.get());
                } finally {
                    buffer.release();
                }
            });
        } catch (RejectedExecutionException e) {
            buffer.release();
            drop(PipelineStatusCodes.SERVICE_UNAVAILABLE);
        }
    }

    private void encode(FrameBuffer buffer, Timestamp frameTime) {
        if (!recording) {
            drop(PipelineStatusCodes.SERVICE_UNAVAILABLE);
            return;
        }
        if (previousFrameTime != null && previousFrameTime.compareTo(frameTime) == 0) {
            drop(PipelineStatusCodes.CONFLICT);
            return;
        }
        if (!sessionStarted) {
            encoder.startSession(frameTime);
            sessionStarted = true;
        }
        if (!encoder.isReady()) {
            if (liveVideo) {
                drop(PipelineStatusCodes.TOO_MANY_REQUESTS);
                return;
            }
            while (!encoder.isReady() && encodingContext.isRunning()) {
                LockSupport.parkNanos(PipelineDefaults.ENCODER_READY_POLL_NANOS);
            }
        }
        if (!encoder.append(buffer, frameTime)) {
            LOG.warning("Encoder rejected frame at " + frameTime);
            drop(PipelineStatusCodes.INTERNAL_ERROR);
            return;
        }
        previousFrameTime = frameTime;
        framesWritten.incrementAndGet();
    }

    private void drop(int reasonCode) {
        framesDropped.incrementAndGet();
        encodingContext.metrics().incFramesDropped(1L, reasonCode);
    }

    public long framesWritten() {
        return framesWritten.get();
    }

    public long framesDropped() {
        return framesDropped.get();
    }

    /** Detaches from the graph and drains the encoding context. Does not finish the output. */
    @Override
    public void close() {
        dispose();
        encodingContext.close();
    }
}
