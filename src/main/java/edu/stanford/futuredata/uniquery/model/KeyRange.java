package edu.stanford.futuredata.uniquery.model;

import java.util.Objects;

/**
 * A range of the partition-key space.  Bounds are opaque tokens compared lexicographically.
 */
public class KeyRange {
    public final String min;
    public final String max;
    public final boolean isMinInclusive;
    public final boolean isMaxInclusive;

    public KeyRange(String min, String max, boolean isMinInclusive, boolean isMaxInclusive) {
        if (min == null || max == null) {
            throw new IllegalArgumentException("KeyRange bounds must be non-null");
        }
        if (min.compareTo(max) > 0) {
            throw new IllegalArgumentException(String.format("KeyRange min %s is greater than max %s", min, max));
        }
        this.min = min;
        this.max = max;
        this.isMinInclusive = isMinInclusive;
        this.isMaxInclusive = isMaxInclusive;
    }

    // [min, max)
    public KeyRange(String min, String max) {
        this(min, max, true, false);
    }

    // Exact-key lookup.
    public static KeyRange point(String key) {
        return new KeyRange(key, key, true, true);
    }

    public boolean isPoint() {
        return min.equals(max) && isMinInclusive && isMaxInclusive;
    }

    public boolean isEmpty() {
        return min.equals(max) && !(isMinInclusive && isMaxInclusive);
    }

    public boolean contains(String key) {
        int lo = key.compareTo(min);
        int hi = key.compareTo(max);
        return (isMinInclusive ? lo >= 0 : lo > 0) && (isMaxInclusive ? hi <= 0 : hi < 0);
    }

    public boolean overlaps(KeyRange other) {
        if (this.isEmpty() || other.isEmpty()) {
            return false;
        }
        return !endsBefore(this, other) && !endsBefore(other, this);
    }

    // Does a end strictly before b begins?
    private static boolean endsBefore(KeyRange a, KeyRange b) {
        int c = a.max.compareTo(b.min);
        if (c != 0) {
            return c < 0;
        }
        return !(a.isMaxInclusive && b.isMinInclusive);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KeyRange)) return false;
        KeyRange that = (KeyRange) o;
        return isMinInclusive == that.isMinInclusive && isMaxInclusive == that.isMaxInclusive
                && min.equals(that.min) && max.equals(that.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, max, isMinInclusive, isMaxInclusive);
    }

    @Override
    public String toString() {
        return (isMinInclusive ? "[" : "(") + min + "," + max + (isMaxInclusive ? "]" : ")");
    }
}
