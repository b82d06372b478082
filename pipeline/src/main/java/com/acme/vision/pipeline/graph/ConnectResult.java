package com.acme.vision.pipeline.graph;

/**
 * Outcome of attaching a consumer to a source.
 */
public sealed interface ConnectResult permits ConnectResult.Connected, ConnectResult.CapacityExceeded {
    record Connected(int slot) implements ConnectResult {}

    /** Every input slot of the consumer was taken; the graph was left unchanged. */
    record CapacityExceeded(int maximumInputs) implements ConnectResult {}
}
