package com.acme.vision.pipeline.graph;

import com.acme.vision.pipeline.context.WorkerContext;

import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Logger;

/**
 * Liveness flag shared by the consumer base classes. Disposing a consumer marks it dead,
 * so sources prune it lazily, and clears its own source slots on the worker.
 */
final class NodeLiveness {
    private static final Logger LOG = Logger.getLogger(NodeLiveness.class.getName());

    private volatile boolean live = true;

    boolean isLive() {
        return live;
    }

    void dispose(WorkerContext context, SourceSlots sources) {
        if (!live) {
            return;
        }
        live = false;
        try {
            context.runAsync(sources::clear);
        } catch (RejectedExecutionException e) {
            // worker is gone, nothing else can touch the slots
            LOG.fine(() -> "Disposing consumer after " + context.name() + " closed");
            sources.clear();
        }
    }
}
