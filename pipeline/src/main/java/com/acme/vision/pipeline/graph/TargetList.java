package com.acme.vision.pipeline.graph;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * A source's ordered list of (consumer, input slot) pairs.
 *
 * <p>Consumers are held weakly: the list never keeps a consumer alive. Entries whose
 * consumer was collected or reports {@link ImageConsumer#isLive()} {@code false} are
 * pruned lazily the next time the list is traversed. Order is attach order.</p>
 *
 * <p>Only touched from the worker context; not thread-safe.</p>
 */
public final class TargetList implements Iterable<TargetList.Target> {

    public record Target(ImageConsumer consumer, int slot) {}

    private final List<Entry> entries = new ArrayList<>();

    void append(ImageConsumer consumer, int slot) {
        Objects.requireNonNull(consumer, "consumer");
        for (Entry entry : entries) {
            if (entry.slot == slot && entry.ref.get() == consumer) {
                return;
            }
        }
        entries.add(new Entry(consumer, slot));
    }

    void remove(ImageConsumer consumer) {
        entries.removeIf(e -> {
            ImageConsumer c = e.ref.get();
            return c == null || c == consumer;
        });
    }

    void remove(ImageConsumer consumer, int slot) {
        entries.removeIf(e -> {
            ImageConsumer c = e.ref.get();
            return c == null || (c == consumer && e.slot == slot);
        });
    }

    void clear() {
        entries.clear();
    }

    /**
     * Copies the live targets in attach order, pruning dead entries.
     */
    public List<Target> snapshot() {
        List<Target> live = new ArrayList<>(entries.size());
        Iterator<Entry> it = entries.iterator();
        while (it.hasNext()) {
            Entry entry = it.next();
            ImageConsumer consumer = entry.ref.get();
            if (consumer == null || !consumer.isLive()) {
                it.remove();
                continue;
            }
            live.add(new Target(consumer, entry.slot));
        }
        return live;
    }

    public boolean contains(ImageConsumer consumer, int slot) {
        for (Target target : snapshot()) {
            if (target.consumer() == consumer && target.slot() == slot) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return snapshot().size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public Iterator<Target> iterator() {
        return snapshot().iterator();
    }

    private static final class Entry {
        final WeakReference<ImageConsumer> ref;
        final int slot;

        Entry(ImageConsumer consumer, int slot) {
            this.ref = new WeakReference<>(consumer);
            this.slot = slot;
        }
    }
}
