package com.acme.vision.pipeline.memory;

public sealed interface LeaseResult permits LeaseResult.Granted, LeaseResult.Denied {
    record Granted(FrameBuffer buffer) implements LeaseResult {}
    record Denied(int reasonCode) implements LeaseResult {}
}
