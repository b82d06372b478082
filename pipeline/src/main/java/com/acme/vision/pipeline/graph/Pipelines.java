package com.acme.vision.pipeline.graph;

import com.acme.vision.pipeline.context.WorkerContext;
import com.acme.vision.pipeline.memory.FrameBuffer;
import com.acme.vision.pipeline.telemetry.PipelineMetrics;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Graph mutation and broadcast.
 *
 * <p>connect, disconnect, disconnectAll and disconnectAllSources are the only operations
 * that change topology. Each one is enqueued on the source's (or, for
 * disconnectAllSources, the consumer's) worker context and both halves of every edge
 * change inside that single task, so a broadcast never observes a half-built edge. Both
 * ends of an edge must share one worker context.</p>
 */
public final class Pipelines {
    private static final Logger LOG = Logger.getLogger(Pipelines.class.getName());

    private Pipelines() {
    }

    /**
     * @throws IllegalArgumentException if {@code source} and {@code target} run on different
     *                                  worker contexts
     */
    public static CompletableFuture<ConnectResult> connect(ImageSource source, ImageConsumer target) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        checkSameContext(source, target);
        return submit(source.context(), () -> bindLowestFree(source, target));
    }

    /**
     * Connects at an explicit slot, replacing whatever source occupied it.
     *
     * @throws IllegalArgumentException if {@code slot} is not below {@code target.maximumInputs()}
     *                                  or the two nodes run on different worker contexts;
     *                                  nothing is enqueued in that case
     */
    public static CompletableFuture<ConnectResult> connect(ImageSource source, ImageConsumer target, int slot) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        checkSameContext(source, target);
        SourceSlots.checkSlot(slot, target.maximumInputs());
        return submit(source.context(), () -> bindAt(source, target, slot));
    }

    public static CompletableFuture<Void> disconnect(ImageSource source, ImageConsumer target) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        return submit(source.context(), () -> {
            for (TargetList.Target t : source.targets().snapshot()) {
                if (t.consumer() == target) {
                    target.sources().removeIf(t.slot(), source);
                }
            }
            source.targets().remove(target);
            return null;
        });
    }

    public static CompletableFuture<Void> disconnectAll(ImageSource source) {
        Objects.requireNonNull(source, "source");
        return submit(source.context(), () -> {
            for (TargetList.Target t : source.targets().snapshot()) {
                t.consumer().sources().removeIf(t.slot(), source);
            }
            source.targets().clear();
            return null;
        });
    }

    public static CompletableFuture<Void> disconnectAllSources(ImageConsumer consumer) {
        Objects.requireNonNull(consumer, "consumer");
        return submit(consumer.context(), () -> {
            for (Map.Entry<Integer, ImageSource> e : consumer.sources().snapshot().entrySet()) {
                e.getValue().targets().remove(consumer, e.getKey());
            }
            consumer.sources().clear();
            return null;
        });
    }

    /**
     * Wires {@code operation} behind {@code source} and returns it, so chains read left to right:
     * {@code chain(chain(input, blur), output)}.
     */
    public static <T extends ImageConsumer> T chain(ImageSource source, T operation) {
        connect(source, operation);
        return operation;
    }

    /**
     * Fans {@code buffer} out to the source's live targets. One hold is taken per target
     * before any delivery, so an early consumer releasing quickly cannot recycle the
     * buffer under a later one. With no targets the buffer is acquired and released once,
     * which recycles it if nobody else holds it.
     *
     * @return number of targets delivered to
     */
    public static int broadcast(ImageSource source, FrameBuffer buffer) {
        Objects.requireNonNull(buffer, "buffer");
        WorkerContext context = source.context();
        if (!context.isWorkerThread()) {
            LOG.warning("Frame broadcast from " + Thread.currentThread().getName()
                + " is not on worker context '" + context.name() + "'");
        }
        PipelineMetrics metrics = context.metrics();
        metrics.incBroadcasts(1L);
        List<TargetList.Target> targets = source.targets().snapshot();
        if (targets.isEmpty()) {
            buffer.acquire();
            buffer.release();
            metrics.incEmptyBroadcasts(1L);
            return 0;
        }
        for (int i = 0; i < targets.size(); i++) {
            buffer.acquire();
        }
        return deliver(targets, buffer, metrics);
    }

    /**
     * Delivers to each target in order. Each target must already hold one reference.
     * A target that throws has its reference released here and delivery moves on.
     */
    public static int deliver(List<TargetList.Target> targets, FrameBuffer buffer, PipelineMetrics metrics) {
        int delivered = 0;
        for (TargetList.Target target : targets) {
            try {
                target.consumer().newFrameAvailable(buffer, target.slot());
                delivered++;
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Consumer " + target.consumer() + " failed on slot " + target.slot()
                    + " for buffer " + buffer.bufferId(), e);
                metrics.incConsumerFailures(1L);
                buffer.release();
            }
        }
        metrics.incDeliveries(delivered);
        return delivered;
    }

    /**
     * Captures the topology downstream of {@code root}. Runs on the root's worker context.
     */
    public static GraphSnapshot describe(ImageSource root) {
        return root.context().callSync(() -> GraphSnapshot.capture(root));
    }

    private static ConnectResult bindLowestFree(ImageSource source, ImageConsumer target) {
        OptionalInt slot = target.sources().append(source, target.maximumInputs());
        if (slot.isEmpty()) {
            LOG.warning("Tried to add target beyond its input capacity: " + target
                + " maximumInputs=" + target.maximumInputs());
            source.context().metrics().incCapacityWarnings(1L);
            return new ConnectResult.CapacityExceeded(target.maximumInputs());
        }
        return finishBinding(source, target, slot.getAsInt());
    }

    private static ConnectResult bindAt(ImageSource source, ImageConsumer target, int slot) {
        target.sources().put(slot, source, target.maximumInputs());
        return finishBinding(source, target, slot);
    }

    private static ConnectResult finishBinding(ImageSource source, ImageConsumer target, int slot) {
        source.targets().append(target, slot);
        source.transmitPreviousImage(target, slot);
        return new ConnectResult.Connected(slot);
    }

    // both halves of an edge are mutated by one worker only
    private static void checkSameContext(ImageSource source, ImageConsumer target) {
        if (source.context() != target.context()) {
            throw new IllegalArgumentException("Cannot connect " + source + " on '" + source.context().name()
                + "' to " + target + " on '" + target.context().name() + "'");
        }
    }

    private static <T> CompletableFuture<T> submit(WorkerContext context, Supplier<T> operation) {
        return context.supplyAsync(operation::get);
    }
}
