package com.acme.vision.pipeline.memory;

import io.netty.buffer.UnpooledByteBufAllocator;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FrameBufferConcurrencyTest {

    @Test
    void shouldKeepRefCountStableUnderConcurrentAcquireRelease() throws Exception {
        FrameDescriptor descriptor = FrameDescriptor.rgba(8, 8);
        try (CachingFrameBufferPool framePool = new CachingFrameBufferPool(
            new UnpooledByteBufAllocator(false), 1 << 20, 4, 600, true, null)) {
            FrameBuffer buffer = framePool.acquireBufferOrThrow(descriptor);

            int threads = 8;
            int iterations = 25_000;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            try {
                Future<?>[] futures = new Future<?>[threads];
                for (int i = 0; i < threads; i++) {
                    futures[i] = pool.submit(() -> {
                        start.await();
                        for (int j = 0; j < iterations; j++) {
                            buffer.acquire();
                            if (buffer.release()) {
                                throw new IllegalStateException("Refcount reached zero during paired acquire/release");
                            }
                        }
                        return null;
                    });
                }

                start.countDown();
                for (Future<?> future : futures) {
                    future.get(20, TimeUnit.SECONDS);
                }

                assertEquals(1, buffer.refCount());
                assertEquals(0, framePool.idleCount(descriptor));
                buffer.acquire();
                assertFalse(buffer.release());
                assertTrue(buffer.release());
                assertEquals(1, framePool.idleCount(descriptor));
            } finally {
                pool.shutdownNow();
                pool.awaitTermination(2, TimeUnit.SECONDS);
            }
        }
    }
}
