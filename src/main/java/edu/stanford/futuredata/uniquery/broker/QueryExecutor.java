package edu.stanford.futuredata.uniquery.broker;

import com.google.protobuf.ByteString;
import edu.stanford.futuredata.uniquery.interfaces.QuerySerializer;
import edu.stanford.futuredata.uniquery.interfaces.Transport;
import edu.stanford.futuredata.uniquery.interfaces.TransportResponse;
import edu.stanford.futuredata.uniquery.model.CollectionIdentity;
import edu.stanford.futuredata.uniquery.model.OperationKind;
import edu.stanford.futuredata.uniquery.model.PartitionTarget;
import edu.stanford.futuredata.uniquery.model.QueryRequest;
import edu.stanford.futuredata.uniquery.model.QueryRequestOptions;
import edu.stanford.futuredata.uniquery.model.QueryResult;
import edu.stanford.futuredata.uniquery.model.QuerySpec;
import edu.stanford.futuredata.uniquery.model.ResourceKind;
import edu.stanford.futuredata.uniquery.utilities.Cancellations;
import io.grpc.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Sends one query request and materializes its response.  Server-reported failures come back as
 * {@link QueryResult.Failure}; undecodable bodies fail the returned future.
 */
public class QueryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    public static final String PARTITION_KEY_RANGE_ID = "x-ms-documentdb-partitionkeyrangeid";
    public static final String MAX_ITEM_COUNT = "x-ms-max-item-count";
    public static final String SESSION_TOKEN = "x-ms-session-token";
    public static final String CONSISTENCY_LEVEL = "x-ms-consistency-level";

    private final Transport transport;
    private final QuerySerializer querySerializer;
    private final ResponseMaterializer responseMaterializer;

    public QueryExecutor(Transport transport, QuerySerializer querySerializer,
                         ResponseMaterializer responseMaterializer) {
        this.transport = transport;
        this.querySerializer = querySerializer;
        this.responseMaterializer = responseMaterializer;
    }

    public CompletableFuture<QueryResult> execute(String resourceAddress,
                                                  ResourceKind resourceKind,
                                                  OperationKind operationKind,
                                                  CollectionIdentity collectionIdentity,
                                                  QueryRequestOptions requestOptions,
                                                  QuerySpec querySpec,
                                                  Consumer<QueryRequest> requestEnricher,
                                                  Context cancellation) {
        Objects.requireNonNull(resourceAddress, "resourceAddress");
        Objects.requireNonNull(requestOptions, "requestOptions");
        Objects.requireNonNull(querySpec, "querySpec");
        if (cancellation.isCancelled()) {
            return Cancellations.cancelled();
        }
        ByteString payload;
        try {
            payload = querySerializer.encode(querySpec);
        } catch (RuntimeException e) {
            logger.warn("Could not encode query for {}: {}", resourceAddress, e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
        QueryRequest request = new QueryRequest(resourceAddress, resourceKind, operationKind,
                requestOptions.getPartitionKey().orElse(null), payload);
        requestOptions.getMaxItemCount().ifPresent(n -> request.setHeader(MAX_ITEM_COUNT, Integer.toString(n)));
        requestOptions.getSessionToken().ifPresent(t -> request.setHeader(SESSION_TOKEN, t));
        requestOptions.getConsistencyLevel().ifPresent(c -> request.setHeader(CONSISTENCY_LEVEL, c.name()));

        Consumer<QueryRequest> enricher = requestEnricher == null ? r -> {} : requestEnricher;
        CompletableFuture<TransportResponse> sent;
        try {
            sent = transport.send(request, enricher, cancellation);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        logger.debug("Sent {} {} to {} ({} bytes)", operationKind, resourceKind, resourceAddress, payload.size());
        return Cancellations.bind(cancellation, sent,
                response -> responseMaterializer.materialize(response, resourceKind, collectionIdentity,
                        requestOptions.getSerializationOptions()),
                TransportResponse::close);
    }

    // Pins the request to one partition.
    public CompletableFuture<QueryResult> execute(String resourceAddress,
                                                  PartitionTarget target,
                                                  ResourceKind resourceKind,
                                                  OperationKind operationKind,
                                                  CollectionIdentity collectionIdentity,
                                                  QueryRequestOptions requestOptions,
                                                  QuerySpec querySpec,
                                                  Consumer<QueryRequest> requestEnricher,
                                                  Context cancellation) {
        Consumer<QueryRequest> targeting = r -> r.setHeader(PARTITION_KEY_RANGE_ID, target.id);
        return execute(resourceAddress, resourceKind, operationKind, collectionIdentity, requestOptions, querySpec,
                requestEnricher == null ? targeting : targeting.andThen(requestEnricher), cancellation);
    }
}
