package com.acme.vision.pipeline.graph;

import com.acme.vision.pipeline.context.WorkerContext;

import java.util.Objects;

/**
 * Holds the worker context, input bound and source slots every consumer needs.
 */
public abstract class AbstractImageConsumer implements ImageConsumer {
    private final WorkerContext context;
    private final int maximumInputs;
    private final SourceSlots sources = new SourceSlots();
    private final NodeLiveness liveness = new NodeLiveness();

    protected AbstractImageConsumer(WorkerContext context, int maximumInputs) {
        if (maximumInputs < 0) {
            throw new IllegalArgumentException("maximumInputs must be >= 0, got " + maximumInputs);
        }
        this.context = Objects.requireNonNull(context, "context");
        this.maximumInputs = maximumInputs;
    }

    @Override
    public final int maximumInputs() {
        return maximumInputs;
    }

    @Override
    public final SourceSlots sources() {
        return sources;
    }

    @Override
    public final WorkerContext context() {
        return context;
    }

    @Override
    public boolean isLive() {
        return liveness.isLive();
    }

    /** Detaches this consumer from the graph; upstream sources drop it on their next traversal. */
    public void dispose() {
        liveness.dispose(context, sources);
    }
}
