package com.acme.vision.pipeline.graph;

import com.acme.vision.pipeline.context.WorkerContext;

import java.util.Objects;

/**
 * Holds the worker context and target list every source needs.
 */
public abstract class AbstractImageSource implements ImageSource {
    private final WorkerContext context;
    private final TargetList targets = new TargetList();

    protected AbstractImageSource(WorkerContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    @Override
    public final TargetList targets() {
        return targets;
    }

    @Override
    public final WorkerContext context() {
        return context;
    }
}
