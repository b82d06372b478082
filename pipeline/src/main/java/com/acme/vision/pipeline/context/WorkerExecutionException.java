package com.acme.vision.pipeline.context;

/**
 * Wraps a checked failure (or an interrupt) raised while waiting on a synchronous worker submission.
 */
public final class WorkerExecutionException extends RuntimeException {
    public WorkerExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
