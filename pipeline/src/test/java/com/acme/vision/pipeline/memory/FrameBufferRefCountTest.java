package com.acme.vision.pipeline.memory;

import com.acme.vision.pipeline.telemetry.AtomicPipelineMetrics;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.buffer.UnpooledByteBufAllocator;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FrameBufferRefCountTest {
    private static final FrameDescriptor DESCRIPTOR = FrameDescriptor.rgba(4, 4);

    @Test
    void shouldReportZeroOnlyOnLastRelease() {
        try (CachingFrameBufferPool pool = new CachingFrameBufferPool(
            new UnpooledByteBufAllocator(false), 1 << 20, 4, 600, true, null)) {
            FrameBuffer buffer = pool.acquireBufferOrThrow(DESCRIPTOR);
            buffer.acquire();
            buffer.acquire();

            assertEquals(3, buffer.refCount());
            assertFalse(buffer.release());
            assertFalse(buffer.release());
            assertTrue(buffer.release());
            assertFalse(buffer.isLive());
        }
    }

    @Test
    void shouldThrowOnUnderflowInStrictMode() {
        AtomicPipelineMetrics metrics = new AtomicPipelineMetrics();
        try (CachingFrameBufferPool pool = new CachingFrameBufferPool(
            new UnpooledByteBufAllocator(false), 1 << 20, 4, 600, true, metrics)) {
            FrameBuffer buffer = pool.acquireBufferOrThrow(DESCRIPTOR);
            buffer.release();

            assertThrows(IllegalStateException.class, buffer::release);
            assertThrows(IllegalStateException.class, buffer::acquire);
            assertEquals(0, buffer.refCount());
            assertEquals(2L, metrics.snapshot().refCountViolations());
            assertEquals(1, pool.idleCount(DESCRIPTOR));
        }
    }

    @Test
    void shouldLogAndStayAtZeroOnUnderflowInLenientMode() {
        AtomicPipelineMetrics metrics = new AtomicPipelineMetrics();
        try (CachingFrameBufferPool pool = new CachingFrameBufferPool(
            new UnpooledByteBufAllocator(false), 1 << 20, 4, 600, false, metrics)) {
            FrameBuffer buffer = pool.acquireBufferOrThrow(DESCRIPTOR);
            buffer.release();

            assertFalse(buffer.release());
            buffer.acquire();

            assertEquals(0, buffer.refCount());
            assertEquals(2L, metrics.snapshot().refCountViolations());
            // not recycled twice
            assertEquals(1, pool.idleCount(DESCRIPTOR));
            assertEquals(1L, pool.stats().recycled());
        }
    }

    @Test
    void shouldRunExternalTeardownOnce() {
        AtomicInteger teardowns = new AtomicInteger();
        ExternalFrameBuffer buffer = new ExternalFrameBuffer(DESCRIPTOR,
            Unpooled.buffer((int) DESCRIPTOR.byteSize()), teardowns::incrementAndGet, false, null);
        buffer.acquire();

        buffer.release();
        assertEquals(0, teardowns.get());
        buffer.release();
        buffer.release();

        assertEquals(1, teardowns.get());
        assertTrue(buffer.isTornDown());
        assertTrue(buffer.owner().isEmpty());
    }

    @Test
    void shouldReleaseWrappedByteBufWhenDone() {
        ByteBuf backing = Unpooled.buffer((int) DESCRIPTOR.byteSize());
        backing.writerIndex((int) DESCRIPTOR.byteSize());
        ExternalFrameBuffer buffer = ExternalFrameBuffer.wrapping(DESCRIPTOR, backing);
        assertEquals(2, backing.refCnt());

        buffer.release();

        assertEquals(1, backing.refCnt());
        backing.release();
    }

    @Test
    void shouldWrapFromReaderIndex() {
        FrameDescriptor gray = new FrameDescriptor(2, 1, PixelFormat.LUMINANCE8, ImageOrientation.PORTRAIT);
        ByteBuf backing = Unpooled.wrappedBuffer(new byte[]{9, 9, 1, 2});
        backing.readerIndex(2);

        ExternalFrameBuffer buffer = ExternalFrameBuffer.wrapping(gray, backing);
        byte[] pixels = new byte[2];
        buffer.data().getBytes(0, pixels);

        assertArrayEquals(new byte[]{1, 2}, pixels);
        assertEquals(2, buffer.data().readableBytes());
        assertEquals(2, backing.readerIndex());
        buffer.release();
        assertEquals(1, backing.refCnt());
        backing.release();
    }

    @Test
    void shouldRejectWrappingTooSmallByteBuf() {
        ByteBuf backing = Unpooled.buffer(4);
        assertThrows(IllegalArgumentException.class, () -> ExternalFrameBuffer.wrapping(DESCRIPTOR, backing));
        assertEquals(1, backing.refCnt());
        backing.release();
    }

    @Test
    void shouldCloseByReleasing() {
        try (CachingFrameBufferPool pool = new CachingFrameBufferPool(
            new UnpooledByteBufAllocator(false), 1 << 20, 4, 600, true, null)) {
            try (FrameBuffer buffer = pool.acquireBufferOrThrow(DESCRIPTOR)) {
                assertEquals(1, buffer.refCount());
            }
            assertEquals(1, pool.idleCount(DESCRIPTOR));
        }
    }
}
