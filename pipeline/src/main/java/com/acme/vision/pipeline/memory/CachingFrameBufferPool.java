package com.acme.vision.pipeline.memory;

import com.acme.vision.pipeline.config.PipelineConfig;
import com.acme.vision.pipeline.telemetry.NoopPipelineMetrics;
import com.acme.vision.pipeline.telemetry.PipelineMetrics;
import com.acme.vision.pipeline.util.PipelineDefaults;
import com.acme.vision.pipeline.util.PipelineStatusCodes;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.UnpooledByteBufAllocator;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Descriptor-keyed buffer cache backed by Netty {@link ByteBuf} memory.
 *
 * <h3>Reuse</h3>
 * Idle buffers are kept per {@link FrameDescriptor} and handed out most-recently-used
 * first. A miss allocates a fresh buffer from the {@link ByteBufAllocator}.
 *
 * <h3>Idle growth</h3>
 * <ul>
 *   <li>A buffer returning to an idle list that already holds
 *       {@code maxIdlePerDescriptor} entries is destroyed.</li>
 *   <li>Every request advances a request clock. Idle entries not reused within
 *       {@code idleTtlRequests} requests are destroyed by a periodic sweep or by
 *       {@link #trimIdle()}.</li>
 *   <li>When a fresh allocation would exceed {@code maxBytes}, the oldest idle
 *       buffers of any descriptor are destroyed first; if that is not enough the
 *       request is denied with {@link PipelineStatusCodes#INSUFFICIENT_STORAGE}.</li>
 * </ul>
 *
 * <p>All access is expected from the worker context. State is additionally guarded
 * by this instance's monitor so a release from another thread cannot corrupt it.</p>
 */
public final class CachingFrameBufferPool implements FrameBufferPool {
    private static final Logger LOG = Logger.getLogger(CachingFrameBufferPool.class.getName());

    private final ByteBufAllocator allocator;
    private final long maxBytes;
    private final int maxIdlePerDescriptor;
    private final int idleTtlRequests;
    private final boolean strictRefCounting;
    private final PipelineMetrics metrics;

    private final Map<FrameDescriptor, ArrayDeque<IdleEntry>> idle = new HashMap<>();
    private volatile boolean closed;

    private long requestClock;
    private long allocations;
    private long reuses;
    private long recycled;
    private long destroyed;
    private long failedAllocations;
    private int idleBuffers;
    private int liveBuffers;
    private long retainedBytes;

    public CachingFrameBufferPool(PipelineConfig config, PipelineMetrics metrics) {
        this(config.poolDirectMemory()
                ? UnpooledByteBufAllocator.DEFAULT
                : new UnpooledByteBufAllocator(false),
            config.poolMaxBytes(),
            config.poolMaxIdlePerDescriptor(),
            config.poolIdleTtlRequests(),
            config.strictRefCounting(),
            metrics);
    }

    public CachingFrameBufferPool(ByteBufAllocator allocator,
                                  long maxBytes,
                                  int maxIdlePerDescriptor,
                                  int idleTtlRequests,
                                  boolean strictRefCounting,
                                  PipelineMetrics metrics) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive, got " + maxBytes);
        }
        if (maxIdlePerDescriptor < 0) {
            throw new IllegalArgumentException("maxIdlePerDescriptor must be >= 0, got " + maxIdlePerDescriptor);
        }
        if (idleTtlRequests <= 0) {
            throw new IllegalArgumentException("idleTtlRequests must be positive, got " + idleTtlRequests);
        }
        this.allocator = Objects.requireNonNull(allocator, "allocator");
        this.maxBytes = maxBytes;
        this.maxIdlePerDescriptor = maxIdlePerDescriptor;
        this.idleTtlRequests = idleTtlRequests;
        this.strictRefCounting = strictRefCounting;
        this.metrics = metrics == null ? NoopPipelineMetrics.INSTANCE : metrics;
    }

    @Override
    public synchronized LeaseResult acquireBuffer(FrameDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        if (closed) {
            return deny(PipelineStatusCodes.SERVICE_UNAVAILABLE);
        }
        long size = descriptor.byteSize();
        if (size > Integer.MAX_VALUE) {
            return deny(PipelineStatusCodes.BAD_REQUEST);
        }

        requestClock++;
        if (requestClock % PipelineDefaults.POOL_SWEEP_INTERVAL_REQUESTS == 0) {
            sweepExpired();
        }

        ArrayDeque<IdleEntry> entries = idle.get(descriptor);
        if (entries != null && !entries.isEmpty()) {
            PooledFrameBuffer reused = entries.pollLast().buffer();
            if (entries.isEmpty()) {
                idle.remove(descriptor);
            }
            idleBuffers--;
            reused.revive();
            liveBuffers++;
            reuses++;
            metrics.incPoolHits(1L);
            return new LeaseResult.Granted(reused);
        }

        if (retainedBytes + size > maxBytes) {
            evictOldestIdleUntilFits(size);
            if (retainedBytes + size > maxBytes) {
                LOG.warning("Frame buffer budget exhausted: requested=" + size
                    + " retained=" + retainedBytes + " max=" + maxBytes);
                return deny(PipelineStatusCodes.INSUFFICIENT_STORAGE);
            }
        }

        ByteBuf data;
        try {
            data = allocator.buffer((int) size, (int) size);
            data.writerIndex((int) size);
        } catch (OutOfMemoryError | RuntimeException e) {
            LOG.log(Level.WARNING, "Backing allocation failed for " + descriptor, e);
            return deny(PipelineStatusCodes.INSUFFICIENT_STORAGE);
        }

        PooledFrameBuffer buffer = new PooledFrameBuffer(descriptor, data, this, strictRefCounting, metrics);
        allocations++;
        liveBuffers++;
        retainedBytes += size;
        metrics.incPoolMisses(1L);
        return new LeaseResult.Granted(buffer);
    }

    /**
     * Called by a pooled buffer whose count just dropped to zero.
     */
    synchronized void recycle(PooledFrameBuffer buffer) {
        liveBuffers--;
        buffer.setTiming(FrameTiming.STILL_IMAGE);
        if (closed) {
            destroy(buffer);
            return;
        }
        ArrayDeque<IdleEntry> entries = idle.computeIfAbsent(buffer.descriptor(), ignored -> new ArrayDeque<>());
        if (entries.size() >= maxIdlePerDescriptor) {
            if (entries.isEmpty()) {
                idle.remove(buffer.descriptor());
            }
            destroy(buffer);
            return;
        }
        entries.addLast(new IdleEntry(buffer, requestClock));
        idleBuffers++;
        recycled++;
    }

    @Override
    public synchronized int idleCount(FrameDescriptor descriptor) {
        ArrayDeque<IdleEntry> entries = idle.get(descriptor);
        return entries == null ? 0 : entries.size();
    }

    @Override
    public synchronized void trimIdle() {
        sweepExpired();
    }

    @Override
    public synchronized void purgeIdle() {
        for (ArrayDeque<IdleEntry> entries : idle.values()) {
            for (IdleEntry entry : entries) {
                destroy(entry.buffer());
            }
        }
        idle.clear();
        idleBuffers = 0;
    }

    @Override
    public synchronized PoolStats stats() {
        return new PoolStats(
            allocations,
            reuses,
            recycled,
            destroyed,
            failedAllocations,
            idleBuffers,
            liveBuffers,
            retainedBytes
        );
    }

    private void sweepExpired() {
        Iterator<ArrayDeque<IdleEntry>> it = idle.values().iterator();
        while (it.hasNext()) {
            ArrayDeque<IdleEntry> entries = it.next();
            // entries are appended in release order, so the oldest sit at the head
            while (!entries.isEmpty() && requestClock - entries.peekFirst().lastUsedClock() > idleTtlRequests) {
                destroy(entries.pollFirst().buffer());
                idleBuffers--;
            }
            if (entries.isEmpty()) {
                it.remove();
            }
        }
    }

    private void evictOldestIdleUntilFits(long size) {
        while (retainedBytes + size > maxBytes && idleBuffers > 0) {
            FrameDescriptor oldestKey = null;
            long oldestClock = Long.MAX_VALUE;
            for (Map.Entry<FrameDescriptor, ArrayDeque<IdleEntry>> e : idle.entrySet()) {
                IdleEntry head = e.getValue().peekFirst();
                if (head != null && head.lastUsedClock() < oldestClock) {
                    oldestClock = head.lastUsedClock();
                    oldestKey = e.getKey();
                }
            }
            if (oldestKey == null) {
                return;
            }
            ArrayDeque<IdleEntry> entries = idle.get(oldestKey);
            destroy(entries.pollFirst().buffer());
            idleBuffers--;
            if (entries.isEmpty()) {
                idle.remove(oldestKey);
            }
        }
    }

    private void destroy(PooledFrameBuffer buffer) {
        retainedBytes -= buffer.descriptor().byteSize();
        destroyed++;
        buffer.data().release();
    }

    private LeaseResult.Denied deny(int reasonCode) {
        failedAllocations++;
        metrics.incPoolDenied(1L, reasonCode);
        return new LeaseResult.Denied(reasonCode);
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            purgeIdle();
            if (liveBuffers > 0) {
                LOG.warning("Closing CachingFrameBufferPool with " + liveBuffers
                    + " buffers still claimed; they are destroyed on their last release");
            }
        }
    }

    private record IdleEntry(PooledFrameBuffer buffer, long lastUsedClock) {}
}
