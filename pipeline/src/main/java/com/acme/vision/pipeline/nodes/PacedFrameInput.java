package com.acme.vision.pipeline.nodes;

import com.acme.vision.pipeline.context.WorkerContext;
import com.acme.vision.pipeline.memory.FrameBufferPool;
import com.acme.vision.pipeline.memory.Timestamp;
import com.acme.vision.pipeline.util.PipelineDefaults;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.LockSupport;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Source that pulls frames from a {@link FrameReader} on its own reader thread, e.g. a movie file.
 *
 * <p>Each frame is processed synchronously on the worker. With {@code playAtActualSpeed} the
 * reader thread then waits out the rest of the frame's duration, taken from consecutive
 * presentation timestamps; the worker never sleeps. With {@code loop} the reader is rewound at
 * end of stream.</p>
 */
public final class PacedFrameInput extends FrameInput implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PacedFrameInput.class.getName());

    private final FrameReader reader;
    private final boolean playAtActualSpeed;
    private final boolean loop;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final CompletableFuture<Long> completion = new CompletableFuture<>();
    private volatile Thread readerThread;

    public PacedFrameInput(WorkerContext context,
                           FrameBufferPool pool,
                           FrameReader reader,
                           boolean playAtActualSpeed,
                           boolean loop) {
        this(context, pool, reader, playAtActualSpeed, loop, false);
    }

    public PacedFrameInput(WorkerContext context,
                           FrameBufferPool pool,
                           FrameReader reader,
                           boolean playAtActualSpeed,
                           boolean loop,
                           boolean runBenchmark) {
        super(context, pool, runBenchmark);
        this.reader = Objects.requireNonNull(reader, "reader");
        this.playAtActualSpeed = playAtActualSpeed;
        this.loop = loop;
    }

    /** Starts the reader thread. Subsequent calls do nothing. */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        Thread t = new Thread(this::readLoop, context().name() + "-reader");
        t.setDaemon(true);
        readerThread = t;
        t.start();
    }

    /**
     * Completes with the number of frames read when the stream ends or the input is cancelled,
     * exceptionally when the reader fails.
     */
    public CompletableFuture<Long> completion() {
        return completion;
    }

    /** Stops reading and waits for the reader thread to exit. */
    public void cancel() {
        running.set(false);
        Thread t = readerThread;
        if (t == null || t == Thread.currentThread()) {
            return;
        }
        LockSupport.unpark(t);
        try {
            t.join(PipelineDefaults.READER_JOIN_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            LOG.warning("Reader thread " + t.getName() + " did not stop within "
                + PipelineDefaults.READER_JOIN_TIMEOUT_MS + " ms");
        }
    }

    @Override
    public void close() {
        cancel();
        try {
            reader.close();
        } catch (IOException e) {
            LOG.log(Level.FINE, "Frame reader close failed", e);
        }
    }

    private void readLoop() {
        long framesRead = 0L;
        Timestamp previousTime = null;
        try {
            while (running.get()) {
                Optional<RawFrame> next = reader.next();
                if (next.isEmpty()) {
                    if (!loop) {
                        break;
                    }
                    reader.reset();
                    previousTime = null;
                    continue;
                }
                RawFrame frame = next.get();
                long startNanos = System.nanoTime();
                context().callSync(() -> processFrame(frame));
                framesRead++;
                Optional<Timestamp> time = frame.timing().timestamp();
                if (playAtActualSpeed && time.isPresent() && previousTime != null) {
                    long frameNanos = previousTime.nanosUntil(time.get());
                    waitUntil(startNanos + frameNanos);
                }
                previousTime = time.orElse(null);
            }
            if (runBenchmark()) {
                LOG.info(String.format("Average frame time: %.3f ms", averageFrameTimeNanos() / 1_000_000d));
            }
            completion.complete(framesRead);
        } catch (RejectedExecutionException e) {
            LOG.fine(() -> "Worker context closed, stopping reader " + Thread.currentThread().getName());
            completion.complete(framesRead);
        } catch (IOException | RuntimeException e) {
            LOG.log(Level.WARNING, "Frame reader failed after " + framesRead + " frames", e);
            completion.completeExceptionally(e);
        } finally {
            running.set(false);
        }
    }

    private void waitUntil(long deadlineNanos) {
        long remaining = deadlineNanos - System.nanoTime();
        while (remaining > 0 && running.get()) {
            LockSupport.parkNanos(remaining);
            remaining = deadlineNanos - System.nanoTime();
        }
    }
}
