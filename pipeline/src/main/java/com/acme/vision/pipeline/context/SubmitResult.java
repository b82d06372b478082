package com.acme.vision.pipeline.context;

public sealed interface SubmitResult permits SubmitResult.Accepted, SubmitResult.Busy, SubmitResult.Closed {
    record Accepted(long seq) implements SubmitResult {}
    record Busy(int depth, int capacity) implements SubmitResult {}
    record Closed() implements SubmitResult {}
}
