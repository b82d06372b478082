package com.acme.vision.pipeline.queue;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lock-free bounded multi-producer single-consumer ring buffer using
 * Lamport-style sequence stamps for coordination.
 *
 * <p>Producers CAS on a shared {@code producerIndex}; the single consumer
 * advances a {@code volatile long} consumer index. Acquire/release fences on
 * the sequence array give FIFO visibility without full barriers. Elements are
 * handed to the consumer in the order their producer CAS succeeded.</p>
 *
 * <p>Capacity is rounded up to the next power of two for index masking. At least two
 * slots, so a filled stamp ({@code pos + 1}) never equals the free stamp of the next position.</p>
 *
 * <p><b>Contract:</b> {@link #poll()} must only be called by a single consumer
 * thread. Concurrent polls corrupt the ring.</p>
 */
public final class MpscRing<E> {

    static final int MIN_CAPACITY = 2;
    static final int MAX_POW2 = 1 << 30;

    private static final VarHandle SEQ_HANDLE =
            MethodHandles.arrayElementVarHandle(long[].class);

    private final int capacity;
    private final int mask;
    private final Object[] buffer;
    private final long[] sequences;
    private final AtomicLong producerIndex = new AtomicLong(0);

    // ---- cache-line padding between producerIndex and consumerIndex ----
    @SuppressWarnings("unused")
    private long p1, p2, p3, p4, p5, p6, p7, p8;

    // volatile: producers read it in sizeApprox(); the write in poll() must stay
    // after the setRelease on sequences[]
    private volatile long consumerIndex;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    public MpscRing(int requestedCapacity) {
        this.capacity = roundUpPow2(Math.max(MIN_CAPACITY, requestedCapacity));
        this.mask = capacity - 1;
        this.buffer = new Object[capacity];
        this.sequences = new long[capacity];
        for (int i = 0; i < capacity; i++) {
            this.sequences[i] = i;
        }
    }

    public int capacity() {
        return capacity;
    }

    public int sizeApprox() {
        long depth = producerIndex.get() - consumerIndex;
        return (int) Math.min(Math.max(0, depth), Integer.MAX_VALUE);
    }

    public OfferResult offer(E e) {
        Objects.requireNonNull(e, "e");
        if (closed.get()) {
            return new OfferResult.Closed();
        }
        for (;;) {
            long pos = producerIndex.get();
            int slot = (int) (pos & mask);
            long seq = (long) SEQ_HANDLE.getAcquire(sequences, slot);

            if (seq == pos) {
                if (producerIndex.compareAndSet(pos, pos + 1)) {
                    buffer[slot] = e;
                    SEQ_HANDLE.setRelease(sequences, slot, pos + 1);
                    return new OfferResult.Ok(pos + 1);
                }
            } else if (seq < pos) {
                // Recheck after a brief spin: a producer may have claimed the slot
                // but not yet committed its stamp.
                Thread.onSpinWait();
                long seqRecheck = (long) SEQ_HANDLE.getAcquire(sequences, slot);
                if (seqRecheck < pos) {
                    return new OfferResult.Full(sizeApprox(), capacity);
                }
            }
            // seq > pos: another producer took this slot, retry with new pos
        }
    }

    @SuppressWarnings("unchecked")
    public E poll() {
        long pos = consumerIndex;
        int slot = (int) (pos & mask);
        long seq = (long) SEQ_HANDLE.getAcquire(sequences, slot);

        if (seq != pos + 1) {
            return null;
        }

        E value = (E) buffer[slot];
        buffer[slot] = null;
        SEQ_HANDLE.setRelease(sequences, slot, pos + capacity);
        consumerIndex = pos + 1;
        return value;
    }

    public void close() {
        closed.set(true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public boolean isDrained() {
        return sizeApprox() == 0;
    }

    /**
     * Depth is non-negative and within capacity. Shutdown diagnostics only.
     */
    public boolean validateInvariants() {
        long depth = producerIndex.get() - consumerIndex;
        return depth >= 0 && depth <= capacity;
    }

    static int roundUpPow2(int value) {
        if (value <= 1) {
            return 1;
        }
        if (value > MAX_POW2) {
            throw new IllegalArgumentException(
                "Capacity " + value + " exceeds maximum " + MAX_POW2);
        }
        return Integer.highestOneBit(value - 1) << 1;
    }
}
