package edu.stanford.futuredata.uniquery.broker;

import edu.stanford.futuredata.uniquery.exceptions.StaleCacheException;
import edu.stanford.futuredata.uniquery.interfaces.CollectionCache;
import edu.stanford.futuredata.uniquery.interfaces.RoutingMapProvider;
import edu.stanford.futuredata.uniquery.model.CollectionIdentity;
import edu.stanford.futuredata.uniquery.model.KeyRange;
import edu.stanford.futuredata.uniquery.model.PartitionTarget;
import edu.stanford.futuredata.uniquery.utilities.Cancellations;
import edu.stanford.futuredata.uniquery.utilities.ResourcePaths;
import io.grpc.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Maps key ranges of a collection to the partitions that currently own them.
 *
 * <p>An unknown routing map after a name-based lookup usually means the collection was deleted and recreated under
 * the same name.  Resolving again with the identity we were given would find nothing again, so the collection cache
 * is refreshed once and the call fails with {@link StaleCacheException}; the caller's next attempt resolves the new
 * identity.
 */
public class PartitionResolver {
    private static final Logger logger = LoggerFactory.getLogger(PartitionResolver.class);

    private final RoutingMapProvider routingMapProvider;
    private final CollectionCache collectionCache;

    enum ResolutionState {
        LOOKUP,
        MAYBE_REFRESH,
        FAIL
    }

    public PartitionResolver(RoutingMapProvider routingMapProvider, CollectionCache collectionCache) {
        this.routingMapProvider = routingMapProvider;
        this.collectionCache = collectionCache;
    }

    public CompletableFuture<List<PartitionTarget>> resolve(String collectionPath,
                                                            CollectionIdentity collectionIdentity,
                                                            Collection<KeyRange> ranges,
                                                            Context cancellation) {
        if (collectionIdentity == null) {
            throw new IllegalArgumentException("collectionIdentity must be non-empty");
        }
        if (ranges == null || ranges.isEmpty() || ranges.stream().anyMatch(r -> r == null)) {
            throw new IllegalArgumentException("ranges must be non-empty and contain no null entries");
        }
        if (cancellation.isCancelled()) {
            return Cancellations.cancelled();
        }
        List<KeyRange> providedRanges = new ArrayList<>(ranges);
        CompletableFuture<Optional<List<PartitionTarget>>> lookup;
        try {
            lookup = routingMapProvider.tryGetOverlappingRanges(collectionIdentity, providedRanges);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return Cancellations.bind(cancellation, lookup,
                targets -> afterLookup(collectionPath, collectionIdentity, providedRanges, targets),
                ignored -> {});
    }

    public CompletableFuture<List<PartitionTarget>> resolve(String collectionPath,
                                                            CollectionIdentity collectionIdentity,
                                                            Collection<KeyRange> ranges) {
        return resolve(collectionPath, collectionIdentity, ranges, Context.ROOT);
    }

    public CompletableFuture<List<PartitionTarget>> resolveSingleKey(String collectionPath,
                                                                     CollectionIdentity collectionIdentity,
                                                                     String key,
                                                                     Context cancellation) {
        return resolve(collectionPath, collectionIdentity, List.of(KeyRange.point(key)), cancellation);
    }

    public CompletableFuture<List<PartitionTarget>> resolveSingleKey(String collectionPath,
                                                                     CollectionIdentity collectionIdentity,
                                                                     String key) {
        return resolveSingleKey(collectionPath, collectionIdentity, key, Context.ROOT);
    }

    // MAYBE_REFRESH only ever moves to FAIL, so a call refreshes the cache at most once.
    private List<PartitionTarget> afterLookup(String collectionPath, CollectionIdentity collectionIdentity,
                                              List<KeyRange> providedRanges,
                                              Optional<List<PartitionTarget>> targets) {
        ResolutionState state = ResolutionState.LOOKUP;
        while (true) {
            switch (state) {
                case LOOKUP:
                    if (targets.isPresent() && !targets.get().isEmpty()) {
                        logger.debug("Resolved {} ranges of {} to {} partitions",
                                providedRanges.size(), collectionIdentity, targets.get().size());
                        return targets.get();
                    }
                    state = ResolutionState.MAYBE_REFRESH;
                    break;
                case MAYBE_REFRESH:
                    if (ResourcePaths.isNameBased(collectionPath)) {
                        logger.warn("Routing map of {} unknown, refreshing collection cache for {}",
                                collectionIdentity, collectionPath);
                        collectionCache.refresh(collectionPath);
                    }
                    state = ResolutionState.FAIL;
                    break;
                case FAIL:
                    String rangesString = providedRanges.stream().map(KeyRange::toString)
                            .collect(Collectors.joining(","));
                    logger.warn("Stale cache resolving {} ranges {}", collectionIdentity, rangesString);
                    throw new StaleCacheException(String.format(
                            "%s: resolve(collectionIdentity: %s, ranges: %s) failed due to stale cache",
                            Instant.now(), collectionIdentity, rangesString));
            }
        }
    }
}
