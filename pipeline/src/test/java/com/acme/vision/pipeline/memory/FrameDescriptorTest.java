package com.acme.vision.pipeline.memory;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FrameDescriptorTest {

    @Test
    void shouldComputeByteSizeFromFormat() {
        assertEquals(640L * 480 * 4, FrameDescriptor.rgba(640, 480).byteSize());
        assertEquals(640L * 480,
            new FrameDescriptor(640, 480, PixelFormat.LUMINANCE8, ImageOrientation.PORTRAIT).byteSize());
    }

    @Test
    void shouldRejectNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> FrameDescriptor.rgba(0, 10));
        assertThrows(IllegalArgumentException.class, () -> FrameDescriptor.rgba(10, -1));
    }

    @Test
    void shouldSwapDimensionsWhenRotationNeeded() {
        FrameDescriptor portrait = FrameDescriptor.rgba(480, 640);

        FrameDescriptor landscape = portrait.sizedFor(ImageOrientation.LANDSCAPE_RIGHT);
        assertEquals(640, landscape.width());
        assertEquals(480, landscape.height());

        FrameDescriptor flipped = portrait.sizedFor(ImageOrientation.PORTRAIT_UPSIDE_DOWN);
        assertEquals(480, flipped.width());
        assertTrue(ImageOrientation.PORTRAIT.rotationNeeded(ImageOrientation.LANDSCAPE_LEFT));
        assertFalse(ImageOrientation.LANDSCAPE_LEFT.rotationNeeded(ImageOrientation.LANDSCAPE_RIGHT));
    }
}
