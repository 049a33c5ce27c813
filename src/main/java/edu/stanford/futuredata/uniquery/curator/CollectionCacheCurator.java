package edu.stanford.futuredata.uniquery.curator;

import edu.stanford.futuredata.uniquery.exceptions.QueryClientException;
import org.apache.curator.RetryPolicy;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.retry.ExponentialBackoffRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * ZooKeeper access for the collection cache.  Collection identities live at
 * {@code <collectionsRoot>/<database>/<collection>}.
 */
public class CollectionCacheCurator {
    private static final Logger logger = LoggerFactory.getLogger(CollectionCacheCurator.class);

    public static String collectionsRoot = "/collections";

    private final CuratorFramework cf;

    public CollectionCacheCurator(String zkHost, int zkPort) {
        this(String.format("%s:%d", zkHost, zkPort));
    }

    CollectionCacheCurator(String connectString) {
        RetryPolicy retryPolicy = new ExponentialBackoffRetry(1000, 3);
        this.cf = CuratorFrameworkFactory.newClient(connectString, retryPolicy);
        cf.start();
    }

    void close() {
        cf.close();
    }

    Optional<String> getCollectionResourceId(String databaseName, String collectionName) {
        String path = collectionPath(databaseName, collectionName);
        try {
            if (cf.checkExists().forPath(path) == null) {
                return Optional.empty();
            }
            byte[] b = cf.getData().forPath(path);
            return Optional.of(new String(b, StandardCharsets.UTF_8));
        } catch (Exception e) {
            logger.error("ZK Failure reading {}: {}", path, e.getMessage());
            throw new QueryClientException(0, "ZooKeeper read failed for " + path, e);
        }
    }

    public void setCollectionResourceId(String databaseName, String collectionName, String resourceId) {
        String path = collectionPath(databaseName, collectionName);
        byte[] data = resourceId.getBytes(StandardCharsets.UTF_8);
        try {
            if (cf.checkExists().forPath(path) != null) {
                cf.setData().forPath(path, data);
            } else {
                cf.create().creatingParentsIfNeeded().forPath(path, data);
            }
        } catch (Exception e) {
            logger.error("ZK Failure writing {}: {}", path, e.getMessage());
            throw new QueryClientException(0, "ZooKeeper write failed for " + path, e);
        }
    }

    public void removeCollection(String databaseName, String collectionName) {
        String path = collectionPath(databaseName, collectionName);
        try {
            if (cf.checkExists().forPath(path) != null) {
                cf.delete().forPath(path);
            }
        } catch (Exception e) {
            logger.error("ZK Failure deleting {}: {}", path, e.getMessage());
            throw new QueryClientException(0, "ZooKeeper delete failed for " + path, e);
        }
    }

    private static String collectionPath(String databaseName, String collectionName) {
        return String.format("%s/%s/%s", collectionsRoot, databaseName, collectionName);
    }
}
