package com.acme.vision.pipeline.graph;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * A consumer's map from input slot to the source currently feeding it.
 * Slots are bounded by the consumer's {@code maximumInputs}.
 *
 * <p>Only touched from the worker context; not thread-safe.</p>
 */
public final class SourceSlots {
    private final TreeMap<Integer, ImageSource> sources = new TreeMap<>();

    /**
     * Binds {@code source} to the lowest free slot below {@code maximumInputs}.
     *
     * @return the slot, or empty when every slot is taken
     */
    OptionalInt append(ImageSource source, int maximumInputs) {
        Objects.requireNonNull(source, "source");
        for (int slot = 0; slot < maximumInputs; slot++) {
            if (!sources.containsKey(slot)) {
                sources.put(slot, source);
                return OptionalInt.of(slot);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Binds {@code source} at {@code slot}, replacing any occupant.
     *
     * @throws IllegalArgumentException when {@code slot} is outside {@code [0, maximumInputs)}
     */
    void put(int slot, ImageSource source, int maximumInputs) {
        Objects.requireNonNull(source, "source");
        checkSlot(slot, maximumInputs);
        sources.put(slot, source);
    }

    ImageSource remove(int slot) {
        return sources.remove(slot);
    }

    /** Clears {@code slot} only while {@code expected} still occupies it. */
    boolean removeIf(int slot, ImageSource expected) {
        if (sources.get(slot) == expected) {
            sources.remove(slot);
            return true;
        }
        return false;
    }

    void clear() {
        sources.clear();
    }

    public Optional<ImageSource> get(int slot) {
        return Optional.ofNullable(sources.get(slot));
    }

    public Map<Integer, ImageSource> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(sources));
    }

    public int size() {
        return sources.size();
    }

    public boolean isEmpty() {
        return sources.isEmpty();
    }

    static void checkSlot(int slot, int maximumInputs) {
        if (slot < 0 || slot >= maximumInputs) {
            throw new IllegalArgumentException("Slot " + slot + " is outside the consumer's "
                + maximumInputs + " inputs");
        }
    }
}
