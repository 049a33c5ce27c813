package edu.stanford.futuredata.uniquery.broker;

import edu.stanford.futuredata.uniquery.exceptions.StaleCacheException;
import edu.stanford.futuredata.uniquery.mockinterfaces.MockCollectionCache;
import edu.stanford.futuredata.uniquery.mockinterfaces.MockRoutingMapProvider;
import edu.stanford.futuredata.uniquery.model.CollectionIdentity;
import edu.stanford.futuredata.uniquery.model.KeyRange;
import edu.stanford.futuredata.uniquery.model.PartitionTarget;
import io.grpc.Context;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

public class PartitionResolverTests {

    private static final String NAME_PATH = "dbs/orders/colls/2024";
    private static final String ID_PATH = "dbs/QhdRAA==/colls/QhdRAPjZ8gA=";
    private static final CollectionIdentity COLLECTION = CollectionIdentity.of("QhdRAPjZ8gA=");

    private MockRoutingMapProvider routingMapProvider;
    private MockCollectionCache collectionCache;
    private PartitionResolver resolver;

    @BeforeEach
    public void setUp() {
        routingMapProvider = new MockRoutingMapProvider();
        collectionCache = new MockCollectionCache();
        resolver = new PartitionResolver(routingMapProvider, collectionCache);
    }

    @Test
    public void testEmptyRangesRejected() {
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(NAME_PATH, COLLECTION, List.of()));
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(NAME_PATH, COLLECTION, null));
        assertEquals(0, routingMapProvider.lookups.get());
    }

    @Test
    public void testNullRangeEntryRejected() {
        List<KeyRange> ranges = Arrays.asList(new KeyRange("A", "M"), null);
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(NAME_PATH, COLLECTION, ranges));
        assertEquals(0, routingMapProvider.lookups.get());
    }

    @Test
    public void testMissingIdentityRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> resolver.resolve(NAME_PATH, null, List.of(KeyRange.point("A"))));
        assertThrows(IllegalArgumentException.class, () -> CollectionIdentity.of(""));
        assertEquals(0, routingMapProvider.lookups.get());
    }

    @Test
    public void testUnknownNameBasedRefreshesOnce() {
        CompletableFuture<List<PartitionTarget>> f =
                resolver.resolve(NAME_PATH, COLLECTION, List.of(new KeyRange("A", "A", true, true)));
        ExecutionException e = assertThrows(ExecutionException.class, f::get);
        StaleCacheException stale = assertInstanceOf(StaleCacheException.class, e.getCause());
        assertEquals(404, stale.getStatusCode());
        assertTrue(stale.getMessage().contains(COLLECTION.resourceId));
        assertTrue(stale.getMessage().contains("[A,A]"));
        assertEquals(List.of(NAME_PATH), collectionCache.refreshedPaths);
        assertEquals(1, routingMapProvider.lookups.get());
    }

    @Test
    public void testUnknownIdentityBasedDoesNotRefresh() {
        CompletableFuture<List<PartitionTarget>> f = resolver.resolveSingleKey(ID_PATH, COLLECTION, "A");
        ExecutionException e = assertThrows(ExecutionException.class, f::get);
        assertInstanceOf(StaleCacheException.class, e.getCause());
        assertTrue(collectionCache.refreshedPaths.isEmpty());
    }

    @Test
    public void testEmptyProviderAnswerIsStale() {
        routingMapProvider.pendingLookup = CompletableFuture.completedFuture(Optional.of(List.of()));
        CompletableFuture<List<PartitionTarget>> f = resolver.resolveSingleKey(NAME_PATH, COLLECTION, "A");
        ExecutionException e = assertThrows(ExecutionException.class, f::get);
        assertInstanceOf(StaleCacheException.class, e.getCause());
        assertEquals(1, collectionCache.refreshedPaths.size());
    }

    @Test
    public void testRepeatedStaleCallsRefreshOncePerCall() {
        for (int i = 0; i < 3; i++) {
            CompletableFuture<List<PartitionTarget>> f = resolver.resolveSingleKey(NAME_PATH, COLLECTION, "K");
            assertThrows(ExecutionException.class, f::get);
        }
        assertEquals(3, collectionCache.refreshedPaths.size());
        assertEquals(3, routingMapProvider.lookups.get());
    }

    @Test
    public void testTwoTargetsInProviderOrder() throws Exception {
        PartitionTarget upper = new PartitionTarget("1", new KeyRange("N", "ZZ"));
        PartitionTarget lower = new PartitionTarget("0", new KeyRange("", "N"));
        routingMapProvider.addPartition(COLLECTION, upper).addPartition(COLLECTION, lower);

        List<PartitionTarget> targets = resolver.resolve(NAME_PATH, COLLECTION,
                List.of(new KeyRange("A", "M", true, true), new KeyRange("N", "Z", true, true))).get();
        assertEquals(List.of(upper, lower), targets);
        assertTrue(collectionCache.refreshedPaths.isEmpty());
    }

    @Test
    public void testOnlyOverlappingTargetsReturned() throws Exception {
        PartitionTarget lower = new PartitionTarget("0", new KeyRange("", "N"));
        PartitionTarget upper = new PartitionTarget("1", new KeyRange("N", "ZZ"));
        routingMapProvider.addPartition(COLLECTION, lower).addPartition(COLLECTION, upper);

        assertEquals(List.of(lower), resolver.resolveSingleKey(NAME_PATH, COLLECTION, "B").get());
        // Upper bound of the lower partition is exclusive.
        assertEquals(List.of(upper), resolver.resolveSingleKey(NAME_PATH, COLLECTION, "N").get());
    }

    @Test
    public void testSingleKeyIsPointRange() throws Exception {
        PartitionTarget only = new PartitionTarget("0", new KeyRange("", "ZZ"));
        routingMapProvider.addPartition(COLLECTION, only);

        List<PartitionTarget> single = resolver.resolveSingleKey(NAME_PATH, COLLECTION, "K").get();
        assertEquals(List.of(KeyRange.point("K")), routingMapProvider.lastRanges);
        List<PartitionTarget> point = resolver.resolve(NAME_PATH, COLLECTION,
                List.of(new KeyRange("K", "K", true, true))).get();
        assertEquals(point, single);
        assertEquals(List.of(new KeyRange("K", "K", true, true)), routingMapProvider.lastRanges);
    }

    @Test
    public void testCancelledBeforeLookup() {
        Context.CancellableContext context = Context.ROOT.withCancellation();
        context.cancel(null);
        CompletableFuture<List<PartitionTarget>> f =
                resolver.resolveSingleKey(NAME_PATH, COLLECTION, "A", context);
        assertTrue(f.isCancelled());
        assertThrows(CancellationException.class, f::get);
        assertEquals(0, routingMapProvider.lookups.get());
    }

    @Test
    public void testCancelledDuringLookup() {
        CompletableFuture<Optional<List<PartitionTarget>>> pending = new CompletableFuture<>();
        routingMapProvider.pendingLookup = pending;
        Context.CancellableContext context = Context.ROOT.withCancellation();
        CompletableFuture<List<PartitionTarget>> f =
                resolver.resolveSingleKey(NAME_PATH, COLLECTION, "A", context);
        assertFalse(f.isDone());

        context.cancel(null);
        assertTrue(f.isCancelled());
        assertTrue(pending.isCancelled());
        assertTrue(collectionCache.refreshedPaths.isEmpty());
    }
}
