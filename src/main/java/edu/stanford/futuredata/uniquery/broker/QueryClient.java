package edu.stanford.futuredata.uniquery.broker;

import edu.stanford.futuredata.uniquery.interfaces.CollectionCache;
import edu.stanford.futuredata.uniquery.interfaces.ConsistencyProvider;
import edu.stanford.futuredata.uniquery.interfaces.ElementDecoder;
import edu.stanford.futuredata.uniquery.interfaces.HeaderConverter;
import edu.stanford.futuredata.uniquery.interfaces.QuerySerializer;
import edu.stanford.futuredata.uniquery.interfaces.RequestRetryPolicy;
import edu.stanford.futuredata.uniquery.interfaces.RetryPolicyProvider;
import edu.stanford.futuredata.uniquery.interfaces.RoutingMapProvider;
import edu.stanford.futuredata.uniquery.interfaces.Transport;
import edu.stanford.futuredata.uniquery.model.CollectionIdentity;
import edu.stanford.futuredata.uniquery.model.ConsistencyLevel;
import edu.stanford.futuredata.uniquery.model.KeyRange;
import edu.stanford.futuredata.uniquery.model.OperationKind;
import edu.stanford.futuredata.uniquery.model.PartitionTarget;
import edu.stanford.futuredata.uniquery.model.QueryRequest;
import edu.stanford.futuredata.uniquery.model.QueryRequestOptions;
import edu.stanford.futuredata.uniquery.model.QueryResult;
import edu.stanford.futuredata.uniquery.model.QuerySpec;
import edu.stanford.futuredata.uniquery.model.ResourceKind;
import edu.stanford.futuredata.uniquery.utilities.DefaultHeaderConverter;
import edu.stanford.futuredata.uniquery.utilities.JsonElementDecoder;
import edu.stanford.futuredata.uniquery.utilities.JsonQuerySerializer;
import io.grpc.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Query front end of a client.  Resolves the partitions a query must visit and runs the query against them, one
 * page at a time.  Holds no query state of its own; all caching lives in the collaborators.
 */
public class QueryClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(QueryClient.class);

    public static final String BYPASS_QUERY_PARSING_PROPERTY = "uniquery.bypassQueryParsing";

    private final RoutingMapProvider routingMapProvider;
    private final CollectionCache collectionCache;
    private final ConsistencyProvider consistencyProvider;
    private final RetryPolicyProvider retryPolicyProvider;

    private final PartitionResolver partitionResolver;
    private final QueryExecutor queryExecutor;

    /*
     * CONSTRUCTOR/TEARDOWN
     */

    public QueryClient(RoutingMapProvider routingMapProvider, CollectionCache collectionCache, Transport transport,
                       ConsistencyProvider consistencyProvider, RetryPolicyProvider retryPolicyProvider,
                       QuerySerializer querySerializer, ElementDecoder elementDecoder,
                       HeaderConverter headerConverter) {
        if (routingMapProvider == null || collectionCache == null || transport == null) {
            throw new IllegalArgumentException("routingMapProvider, collectionCache and transport are required");
        }
        this.routingMapProvider = routingMapProvider;
        this.collectionCache = collectionCache;
        this.consistencyProvider = consistencyProvider;
        this.retryPolicyProvider = retryPolicyProvider;
        this.partitionResolver = new PartitionResolver(routingMapProvider, collectionCache);
        this.queryExecutor = new QueryExecutor(transport, querySerializer,
                new ResponseMaterializer(elementDecoder, headerConverter));
    }

    public QueryClient(RoutingMapProvider routingMapProvider, CollectionCache collectionCache, Transport transport,
                       ConsistencyProvider consistencyProvider, RetryPolicyProvider retryPolicyProvider) {
        this(routingMapProvider, collectionCache, transport, consistencyProvider, retryPolicyProvider,
                new JsonQuerySerializer(), new JsonElementDecoder(), new DefaultHeaderConverter());
    }

    @Override
    public void close() {
        if (collectionCache instanceof AutoCloseable) {
            try {
                ((AutoCloseable) collectionCache).close();
            } catch (Exception e) {
                logger.warn("Failed to close collection cache: {}", e.getMessage());
            }
        }
    }

    /*
     * ROUTING
     */

    public CompletableFuture<List<PartitionTarget>> resolve(String collectionPath,
                                                            CollectionIdentity collectionIdentity,
                                                            Collection<KeyRange> ranges, Context cancellation) {
        return partitionResolver.resolve(collectionPath, collectionIdentity, ranges, cancellation);
    }

    public CompletableFuture<List<PartitionTarget>> resolve(String collectionPath,
                                                            CollectionIdentity collectionIdentity,
                                                            Collection<KeyRange> ranges) {
        return partitionResolver.resolve(collectionPath, collectionIdentity, ranges);
    }

    public CompletableFuture<List<PartitionTarget>> resolveSingleKey(String collectionPath,
                                                                     CollectionIdentity collectionIdentity,
                                                                     String key, Context cancellation) {
        return partitionResolver.resolveSingleKey(collectionPath, collectionIdentity, key, cancellation);
    }

    public CompletableFuture<List<PartitionTarget>> resolveSingleKey(String collectionPath,
                                                                     CollectionIdentity collectionIdentity,
                                                                     String key) {
        return partitionResolver.resolveSingleKey(collectionPath, collectionIdentity, key);
    }

    /*
     * EXECUTION
     */

    public CompletableFuture<QueryResult> execute(String resourceAddress, ResourceKind resourceKind,
                                                  OperationKind operationKind,
                                                  CollectionIdentity collectionIdentity,
                                                  QueryRequestOptions requestOptions, QuerySpec querySpec,
                                                  Consumer<QueryRequest> requestEnricher, Context cancellation) {
        return queryExecutor.execute(resourceAddress, resourceKind, operationKind, collectionIdentity,
                requestOptions, querySpec, requestEnricher, cancellation);
    }

    public CompletableFuture<QueryResult> execute(String resourceAddress, PartitionTarget target,
                                                  ResourceKind resourceKind, OperationKind operationKind,
                                                  CollectionIdentity collectionIdentity,
                                                  QueryRequestOptions requestOptions, QuerySpec querySpec,
                                                  Consumer<QueryRequest> requestEnricher, Context cancellation) {
        return queryExecutor.execute(resourceAddress, target, resourceKind, operationKind, collectionIdentity,
                requestOptions, querySpec, requestEnricher, cancellation);
    }

    /*
     * PASS-THROUGHS
     */

    public RoutingMapProvider getRoutingMapProvider() {
        return routingMapProvider;
    }

    public CollectionCache getCollectionCache() {
        return collectionCache;
    }

    public RequestRetryPolicy getRetryPolicy() {
        return retryPolicyProvider.getRequestPolicy();
    }

    public CompletableFuture<ConsistencyLevel> getDefaultConsistencyLevel() {
        return consistencyProvider.getDefaultConsistencyLevel();
    }

    public CompletableFuture<Optional<ConsistencyLevel>> getDesiredConsistencyLevel() {
        return consistencyProvider.getDesiredConsistencyLevel();
    }

    public CompletableFuture<Void> ensureValidOverwrite(ConsistencyLevel desiredConsistencyLevel) {
        return consistencyProvider.ensureValidOverwrite(desiredConsistencyLevel);
    }

    public boolean byPassQueryParsing() {
        return Boolean.getBoolean(BYPASS_QUERY_PARSING_PROPERTY);
    }
}
