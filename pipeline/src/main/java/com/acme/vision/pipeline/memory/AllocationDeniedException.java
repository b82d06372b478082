package com.acme.vision.pipeline.memory;

/**
 * Thrown when the buffer pool cannot produce a buffer (closed, invalid size, or byte budget exhausted).
 * Carries the pool's reason code so producers can report why a frame was not broadcast.
 */
public final class AllocationDeniedException extends RuntimeException {
    private final int reasonCode;

    public AllocationDeniedException(int reasonCode) {
        super("Frame buffer allocation denied, reasonCode=" + reasonCode);
        this.reasonCode = reasonCode;
    }

    public int reasonCode() {
        return reasonCode;
    }
}
