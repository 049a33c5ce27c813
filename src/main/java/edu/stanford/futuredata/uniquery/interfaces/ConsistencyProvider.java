package edu.stanford.futuredata.uniquery.interfaces;

import edu.stanford.futuredata.uniquery.model.ConsistencyLevel;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

public interface ConsistencyProvider {
    // Account-wide default.
    CompletableFuture<ConsistencyLevel> getDefaultConsistencyLevel();
    // Client-level override, if any.
    CompletableFuture<Optional<ConsistencyLevel>> getDesiredConsistencyLevel();
    // Fails if the account does not allow overriding its default with this level.
    CompletableFuture<Void> ensureValidOverwrite(ConsistencyLevel desiredConsistencyLevel);
}
