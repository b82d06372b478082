package com.acme.vision.pipeline.memory;

/**
 * Orientation a frame was captured in. Consumers presenting in a different
 * orientation use {@link #rotationNeeded(ImageOrientation)} to decide whether
 * width and height swap.
 */
public enum ImageOrientation {
    PORTRAIT,
    PORTRAIT_UPSIDE_DOWN,
    LANDSCAPE_LEFT,
    LANDSCAPE_RIGHT;

    public boolean isLandscape() {
        return this == LANDSCAPE_LEFT || this == LANDSCAPE_RIGHT;
    }

    /** True when presenting this orientation as {@code target} requires a quarter turn. */
    public boolean rotationNeeded(ImageOrientation target) {
        return isLandscape() != target.isLandscape();
    }
}
