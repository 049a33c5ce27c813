package edu.stanford.futuredata.uniquery.model;

/**
 * Stable resource id of a collection.  Routing lookups are keyed by it, never by the collection's name.
 */
public class CollectionIdentity {
    public final String resourceId;

    private CollectionIdentity(String resourceId) {
        this.resourceId = resourceId;
    }

    public static CollectionIdentity of(String resourceId) {
        if (resourceId == null || resourceId.isEmpty()) {
            throw new IllegalArgumentException("collectionIdentity must be non-empty");
        }
        return new CollectionIdentity(resourceId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CollectionIdentity)) return false;
        return resourceId.equals(((CollectionIdentity) o).resourceId);
    }

    @Override
    public int hashCode() {
        return resourceId.hashCode();
    }

    @Override
    public String toString() {
        return resourceId;
    }
}
