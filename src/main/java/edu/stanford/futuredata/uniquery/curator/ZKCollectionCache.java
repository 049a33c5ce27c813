package edu.stanford.futuredata.uniquery.curator;

import edu.stanford.futuredata.uniquery.interfaces.CollectionCache;
import edu.stanford.futuredata.uniquery.model.CollectionIdentity;
import edu.stanford.futuredata.uniquery.utilities.Utilities;
import org.javatuples.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collection cache backed by ZooKeeper.  Identities are memoized per name-based path until refreshed.
 */
public class ZKCollectionCache implements CollectionCache, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ZKCollectionCache.class);

    public static int lookupThreads = 4;

    private final CollectionCacheCurator zkCurator;
    // Map from collection paths to identities.
    private final Map<String, CollectionIdentity> identities = new ConcurrentHashMap<>();
    // Bumped by every refresh; a lookup only caches what it read if no refresh ran meanwhile.
    private final Map<String, AtomicLong> generations = new ConcurrentHashMap<>();
    private final ExecutorService lookupThreadPool = Executors.newFixedThreadPool(lookupThreads);

    public ZKCollectionCache(String zkHost, int zkPort) {
        this(new CollectionCacheCurator(zkHost, zkPort));
    }

    ZKCollectionCache(CollectionCacheCurator zkCurator) {
        this.zkCurator = zkCurator;
    }

    public ZKCollectionCache(String connectString) {
        this(Utilities.parseConnectString(connectString));
    }

    private ZKCollectionCache(Pair<String, Integer> hostPort) {
        this(hostPort.getValue0(), hostPort.getValue1());
    }

    @Override
    public void close() {
        lookupThreadPool.shutdown();
        zkCurator.close();
    }

    public CollectionCacheCurator getCurator() {
        return zkCurator;
    }

    @Override
    public CompletableFuture<Optional<CollectionIdentity>> resolveByName(String collectionPath) {
        Pair<String, String> names = parseCollectionPath(collectionPath);
        String key = names.getValue0() + "/" + names.getValue1();
        CollectionIdentity cached = identities.get(key);
        if (cached != null) {
            return CompletableFuture.completedFuture(Optional.of(cached));
        }
        AtomicLong generation = generations.computeIfAbsent(key, k -> new AtomicLong());
        long readGeneration = generation.get();
        return CompletableFuture.supplyAsync(() -> {
            Optional<CollectionIdentity> identity = zkCurator
                    .getCollectionResourceId(names.getValue0(), names.getValue1())
                    .map(CollectionIdentity::of);
            identity.ifPresent(i -> {
                identities.put(key, i);
                if (generation.get() != readGeneration) {
                    // Refreshed while reading, so what we read may be stale.
                    identities.remove(key, i);
                }
            });
            logger.debug("Resolved {} to {}", collectionPath, identity);
            return identity;
        }, lookupThreadPool);
    }

    @Override
    public void refresh(String collectionPath) {
        Pair<String, String> names;
        try {
            names = parseCollectionPath(collectionPath);
        } catch (IllegalArgumentException e) {
            // Nothing can be cached under a path we cannot parse.
            logger.debug("Ignoring refresh of {}", collectionPath);
            return;
        }
        String key = names.getValue0() + "/" + names.getValue1();
        generations.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
        CollectionIdentity dropped = identities.remove(key);
        if (dropped != null) {
            logger.info("Dropped cached identity {} of {}", dropped, collectionPath);
        }
    }

    // dbs/<database>/colls/<collection>, optionally with leading, trailing or further segments.
    static Pair<String, String> parseCollectionPath(String collectionPath) {
        if (collectionPath == null) {
            throw new IllegalArgumentException("collectionPath must be non-null");
        }
        String[] segments = collectionPath.replaceAll("^/+|/+$", "").split("/");
        if (segments.length < 4 || !segments[0].equals("dbs") || !segments[2].equals("colls")
                || segments[1].isEmpty() || segments[3].isEmpty()) {
            throw new IllegalArgumentException("Not a collection path: " + collectionPath);
        }
        return new Pair<>(segments[1], segments[3]);
    }
}
