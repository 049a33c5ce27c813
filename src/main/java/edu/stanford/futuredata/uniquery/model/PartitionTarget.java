package edu.stanford.futuredata.uniquery.model;

import java.util.Objects;

/**
 * A physical partition currently responsible for a sub-range of a collection's key space.
 * Only routing-map providers create these.
 */
public class PartitionTarget {
    public final String id;
    public final KeyRange range;

    public PartitionTarget(String id, KeyRange range) {
        this.id = Objects.requireNonNull(id);
        this.range = Objects.requireNonNull(range);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PartitionTarget)) return false;
        PartitionTarget that = (PartitionTarget) o;
        return id.equals(that.id) && range.equals(that.range);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, range);
    }

    @Override
    public String toString() {
        return String.format("PartitionTarget{id=%s, range=%s}", id, range);
    }
}
