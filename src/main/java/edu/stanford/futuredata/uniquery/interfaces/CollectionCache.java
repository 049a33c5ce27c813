package edu.stanford.futuredata.uniquery.interfaces;

import edu.stanford.futuredata.uniquery.model.CollectionIdentity;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

public interface CollectionCache {
    /*
     Maps name-based collection paths to collection identities.
     */

    // Which identity does this path currently name?  Empty if the collection does not exist.
    CompletableFuture<Optional<CollectionIdentity>> resolveByName(String collectionPath);
    // Forget what is cached for this path.  Must be idempotent and cheap; callers never wait on it.
    void refresh(String collectionPath);
}
