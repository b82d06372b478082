package com.acme.vision.pipeline.util;

/**
 * Canonical reason codes reported by the pool, the worker queue and frame producers.
 * <p>
 * HTTP-like values so they read the same in logs and metrics labels.
 */
public final class PipelineStatusCodes {

    // ---- Caller errors ----
    public static final int BAD_REQUEST = 400;
    public static final int CONFLICT = 409;
    public static final int TOO_MANY_REQUESTS = 429;

    // ---- Resource errors ----
    public static final int INTERNAL_ERROR = 500;
    public static final int SERVICE_UNAVAILABLE = 503;
    public static final int INSUFFICIENT_STORAGE = 507;

    private PipelineStatusCodes() {
    }
}
