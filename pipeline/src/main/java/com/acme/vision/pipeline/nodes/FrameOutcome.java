package com.acme.vision.pipeline.nodes;

/**
 * What happened to one frame handed to a producer node.
 */
public sealed interface FrameOutcome permits FrameOutcome.Broadcast, FrameOutcome.Denied, FrameOutcome.Dropped {
    /** Uploaded and fanned out to {@code targetCount} consumers. */
    record Broadcast(long bufferId, int targetCount) implements FrameOutcome {}

    /** The pool refused a buffer; nothing was broadcast. */
    record Denied(int reasonCode) implements FrameOutcome {}

    /** Discarded before upload, e.g. because the worker was saturated. */
    record Dropped(int reasonCode) implements FrameOutcome {}
}
