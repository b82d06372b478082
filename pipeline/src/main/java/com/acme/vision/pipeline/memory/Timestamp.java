package com.acme.vision.pipeline.memory;

/**
 * Rational media time: {@code value / timescale} seconds within an {@code epoch}.
 */
public record Timestamp(long value, int timescale, int flags, long epoch) implements Comparable<Timestamp> {

    public static final int FLAG_VALID = 1;

    public static final int NANOS_TIMESCALE = 1_000_000_000;

    public Timestamp {
        if (timescale <= 0) {
            throw new IllegalArgumentException("timescale must be positive, got " + timescale);
        }
    }

    public static Timestamp of(long value, int timescale) {
        return new Timestamp(value, timescale, FLAG_VALID, 0L);
    }

    public static Timestamp ofNanos(long nanos) {
        return of(nanos, NANOS_TIMESCALE);
    }

    public boolean isValid() {
        return (flags & FLAG_VALID) != 0;
    }

    public long toNanos() {
        if (timescale == NANOS_TIMESCALE) {
            return value;
        }
        return Math.round(value * (1_000_000_000d / timescale));
    }

    /** Nanoseconds from this timestamp to {@code later}; negative when {@code later} is earlier. */
    public long nanosUntil(Timestamp later) {
        return later.toNanos() - toNanos();
    }

    @Override
    public int compareTo(Timestamp other) {
        int byEpoch = Long.compare(epoch, other.epoch);
        if (byEpoch != 0) {
            return byEpoch;
        }
        // cross-multiply in 128 bits so different timescales compare exactly
        long lhsHi = Math.multiplyHigh(value, other.timescale);
        long lhsLo = value * other.timescale;
        long rhsHi = Math.multiplyHigh(other.value, timescale);
        long rhsLo = other.value * timescale;
        int byHigh = Long.compare(lhsHi, rhsHi);
        return byHigh != 0 ? byHigh : Long.compareUnsigned(lhsLo, rhsLo);
    }
}
