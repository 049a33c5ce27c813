package edu.stanford.futuredata.uniquery.interfaces;

import edu.stanford.futuredata.uniquery.model.CollectionIdentity;
import edu.stanford.futuredata.uniquery.model.KeyRange;
import edu.stanford.futuredata.uniquery.model.PartitionTarget;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

public interface RoutingMapProvider {
    /*
     Lives on the client.  Caches the routing map of every collection it has seen.
     */

    // Which partitions overlap any of these ranges?  Empty if the collection's routing map is unknown.
    CompletableFuture<Optional<List<PartitionTarget>>> tryGetOverlappingRanges(CollectionIdentity collectionIdentity,
                                                                                List<KeyRange> ranges);
}
