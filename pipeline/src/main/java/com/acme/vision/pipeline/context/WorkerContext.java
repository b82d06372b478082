package com.acme.vision.pipeline.context;

import com.acme.vision.pipeline.config.PipelineConfig;
import com.acme.vision.pipeline.queue.MpscRing;
import com.acme.vision.pipeline.queue.OfferResult;
import com.acme.vision.pipeline.telemetry.NoopPipelineMetrics;
import com.acme.vision.pipeline.telemetry.PipelineMetrics;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.LockSupport;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single serialized execution domain for graph mutation, frame broadcast and
 * whatever work a node does while producing a frame.
 *
 * <p>One daemon thread drains a bounded MPSC ring in submission order, so two
 * operations never run at the same time and graph state needs no per-edge locks.
 * The context is constructed explicitly and handed to every node; call
 * {@link #start()} before graph activity and {@link #close()} at the end of its
 * working life.</p>
 *
 * <h3>Submission modes</h3>
 * <ul>
 *   <li>{@link #runAsync(Runnable)}: enqueue and return. Waits for room when the
 *       ring is full.</li>
 *   <li>{@link #supplyAsync(Callable)}: like {@code runAsync}, with a future for the result.</li>
 *   <li>{@link #trySubmit(Runnable)}: enqueue if there is room, never waits.</li>
 *   <li>{@link #runSync(Runnable)} / {@link #callSync(Callable)}: block until the
 *       operation has run. When called from the worker thread itself the operation
 *       runs inline.</li>
 * </ul>
 */
public final class WorkerContext implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(WorkerContext.class.getName());
    private static final long MIN_IDLE_PARK_NANOS = 1_000L;
    private static final long MAX_IDLE_PARK_NANOS = 1_000_000L;
    private static final long FULL_RETRY_PARK_NANOS = 50_000L;

    private final String name;
    private final MpscRing<WorkerTask> queue;
    private final PipelineMetrics metrics;
    private final Duration shutdownTimeout;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread workerThread;
    private volatile boolean executing;

    public WorkerContext(String name, int queueCapacity, PipelineMetrics metrics) {
        this(name, queueCapacity, metrics, Duration.ofSeconds(5));
    }

    /**
     * @param queueCapacity ring size; rounded up to a power of two, at least 2
     */
    public WorkerContext(String name, int queueCapacity, PipelineMetrics metrics, Duration shutdownTimeout) {
        this.name = Objects.requireNonNull(name, "name");
        this.queue = new MpscRing<>(queueCapacity);
        this.metrics = metrics == null ? NoopPipelineMetrics.INSTANCE : metrics;
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    }

    public static WorkerContext create(PipelineConfig config, PipelineMetrics metrics) {
        return new WorkerContext(config.workerName(), config.workerQueueCapacity(), metrics,
            Duration.ofMillis(config.shutdownTimeoutMillis()));
    }

    public WorkerContext start() {
        if (!started.compareAndSet(false, true)) {
            return this;
        }
        running.set(true);
        Thread t = new Thread(this::workerLoop, name + "-worker");
        t.setDaemon(true);
        workerThread = t;
        t.start();
        LOG.fine(() -> "Worker context started: " + name);
        return this;
    }

    public String name() {
        return name;
    }

    public PipelineMetrics metrics() {
        return metrics;
    }

    /** True when the calling thread is this context's worker. */
    public boolean isWorkerThread() {
        return Thread.currentThread() == workerThread;
    }

    public boolean isRunning() {
        return running.get();
    }

    /** No operation executing and none pending. Diagnostics only; may change immediately. */
    public boolean isIdle() {
        return !executing && queue.isDrained();
    }

    public int queueDepth() {
        return queue.sizeApprox();
    }

    /**
     * Enqueues without waiting.
     */
    public SubmitResult trySubmit(Runnable task) {
        Objects.requireNonNull(task, "task");
        OfferResult offer = queue.offer(new WorkerTask(task, System.nanoTime()));
        if (offer instanceof OfferResult.Ok ok) {
            metrics.setWorkerQueueDepth(queue.sizeApprox());
            unparkWorker();
            return new SubmitResult.Accepted(ok.seq());
        }
        if (offer instanceof OfferResult.Full full) {
            return new SubmitResult.Busy(full.depth(), full.capacity());
        }
        return new SubmitResult.Closed();
    }

    /**
     * Enqueues and returns. When the ring is full an outside caller waits for room;
     * the worker thread cannot wait on itself and runs the task inline instead.
     *
     * @throws RejectedExecutionException if the context is closed
     */
    public void runAsync(Runnable task) {
        enqueue(new WorkerTask(Objects.requireNonNull(task, "task"), System.nanoTime()));
    }

    /**
     * Enqueues {@code task} and returns a future completed with its result. A failure
     * completes the future exceptionally and is logged and counted like any failed task.
     *
     * @throws RejectedExecutionException if the context is closed
     */
    public <T> CompletableFuture<T> supplyAsync(Callable<T> task) {
        Objects.requireNonNull(task, "task");
        CompletableFuture<T> result = new CompletableFuture<>();
        runAsync(() -> {
            try {
                result.complete(task.call());
            } catch (Exception e) {
                result.completeExceptionally(e);
                LOG.log(Level.WARNING, "Async worker operation failed on " + name, e);
                metrics.incTaskFailures(1L);
            }
        });
        return result;
    }

    /**
     * Runs {@code task} on the worker and waits for it. Inline when already on the worker.
     */
    public void runSync(Runnable task) {
        Objects.requireNonNull(task, "task");
        callSync(() -> {
            task.run();
            return null;
        });
    }

    /**
     * Runs {@code task} on the worker and returns its result. Inline when already on the worker.
     * Unchecked failures propagate as thrown; checked ones and interrupts are wrapped in
     * {@link WorkerExecutionException}.
     */
    public <T> T callSync(Callable<T> task) {
        Objects.requireNonNull(task, "task");
        if (isWorkerThread()) {
            try {
                return task.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new WorkerExecutionException("Synchronous worker operation failed", e);
            }
        }
        if (!started.get()) {
            throw new IllegalStateException("Worker context '" + name + "' is not started");
        }
        FutureTask<T> future = new FutureTask<>(task);
        enqueue(new WorkerTask(future, System.nanoTime()));
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerExecutionException("Interrupted waiting for worker '" + name + "'", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new WorkerExecutionException("Synchronous worker operation failed", cause);
        }
    }

    private void enqueue(WorkerTask task) {
        while (true) {
            OfferResult offer = queue.offer(task);
            if (offer instanceof OfferResult.Ok) {
                metrics.setWorkerQueueDepth(queue.sizeApprox());
                unparkWorker();
                return;
            }
            if (offer instanceof OfferResult.Closed) {
                throw new RejectedExecutionException("Worker context '" + name + "' is closed");
            }
            if (isWorkerThread()) {
                LOG.warning("Worker queue saturated (capacity=" + queue.capacity()
                    + "), running re-entrant submission inline on " + name);
                task.task().run();
                return;
            }
            unparkWorker();
            LockSupport.parkNanos(FULL_RETRY_PARK_NANOS);
        }
    }

    private void workerLoop() {
        long idleNanos = MIN_IDLE_PARK_NANOS;
        while (running.get() || queue.sizeApprox() > 0) {
            WorkerTask task = queue.poll();
            if (task == null) {
                LockSupport.parkNanos(idleNanos);
                idleNanos = Math.min(idleNanos << 1, MAX_IDLE_PARK_NANOS);
                continue;
            }
            idleNanos = MIN_IDLE_PARK_NANOS;
            executing = true;
            try {
                task.task().run();
            } catch (Throwable t) {
                LOG.log(Level.WARNING, "Worker task failed on " + name + " sinceEnqueueMicros="
                    + (System.nanoTime() - task.enqueueNanos()) / 1_000L, t);
                metrics.incTaskFailures(1L);
            } finally {
                executing = false;
                metrics.setWorkerQueueDepth(queue.sizeApprox());
            }
        }
    }

    private void unparkWorker() {
        Thread worker = workerThread;
        if (worker != null) {
            LockSupport.unpark(worker);
        }
    }

    /**
     * Stops accepting work, lets already queued operations finish and joins the worker
     * for at most {@code timeout}.
     */
    public void stopAndDrain(Duration timeout) {
        if (!running.getAndSet(false) && started.get()) {
            return;
        }
        queue.close();
        Thread worker = workerThread;
        if (worker == null || worker == Thread.currentThread()) {
            return;
        }
        LockSupport.unpark(worker);
        try {
            worker.join(Math.max(1L, timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (!queue.isDrained() || !queue.validateInvariants()) {
            LOG.warning("Worker context '" + name + "' stopped with non-empty or inconsistent queue"
                + " depth=" + queue.sizeApprox()
                + " invariants=" + queue.validateInvariants());
        }
    }

    @Override
    public void close() {
        stopAndDrain(shutdownTimeout);
    }
}
