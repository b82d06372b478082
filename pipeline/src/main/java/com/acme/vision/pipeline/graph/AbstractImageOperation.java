package com.acme.vision.pipeline.graph;

import com.acme.vision.pipeline.context.WorkerContext;

import java.util.Objects;

/**
 * Base for nodes that both consume and produce frames.
 */
public abstract class AbstractImageOperation implements ImageProcessingOperation {
    private final WorkerContext context;
    private final int maximumInputs;
    private final TargetList targets = new TargetList();
    private final SourceSlots sources = new SourceSlots();
    private final NodeLiveness liveness = new NodeLiveness();

    protected AbstractImageOperation(WorkerContext context, int maximumInputs) {
        if (maximumInputs < 0) {
            throw new IllegalArgumentException("maximumInputs must be >= 0, got " + maximumInputs);
        }
        this.context = Objects.requireNonNull(context, "context");
        this.maximumInputs = maximumInputs;
    }

    @Override
    public final TargetList targets() {
        return targets;
    }

    @Override
    public final SourceSlots sources() {
        return sources;
    }

    @Override
    public final int maximumInputs() {
        return maximumInputs;
    }

    @Override
    public final WorkerContext context() {
        return context;
    }

    @Override
    public boolean isLive() {
        return liveness.isLive();
    }

    public void dispose() {
        liveness.dispose(context, sources);
    }
}
