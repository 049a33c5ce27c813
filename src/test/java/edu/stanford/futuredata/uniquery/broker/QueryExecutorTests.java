package edu.stanford.futuredata.uniquery.broker;

import com.fasterxml.jackson.databind.JsonNode;
import edu.stanford.futuredata.uniquery.exceptions.DecodeException;
import edu.stanford.futuredata.uniquery.interfaces.TransportResponse;
import edu.stanford.futuredata.uniquery.mockinterfaces.CountingElementDecoder;
import edu.stanford.futuredata.uniquery.mockinterfaces.MockTransport;
import edu.stanford.futuredata.uniquery.mockinterfaces.MockTransportResponse;
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
import edu.stanford.futuredata.uniquery.utilities.JsonQuerySerializer;
import edu.stanford.futuredata.uniquery.utilities.Utilities;
import io.grpc.Context;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

public class QueryExecutorTests {

    private static final String ADDRESS = "dbs/orders/colls/2024/docs";
    private static final CollectionIdentity COLLECTION = CollectionIdentity.of("QhdRAPjZ8gA=");
    private static final QuerySpec QUERY = new QuerySpec("SELECT * FROM c WHERE c.id = @id").withParameter("@id", 1);

    private MockTransport transport;
    private CountingElementDecoder decoder;
    private QueryExecutor executor;

    @BeforeEach
    public void setUp() {
        transport = new MockTransport();
        decoder = new CountingElementDecoder();
        executor = new QueryExecutor(transport, new JsonQuerySerializer(),
                new ResponseMaterializer(decoder, new DefaultHeaderConverter()));
    }

    private CompletableFuture<QueryResult> execute(QueryRequestOptions options, Context context) {
        return executor.execute(ADDRESS, ResourceKind.DOCUMENT, OperationKind.QUERY, COLLECTION, options, QUERY,
                r -> r.setHeader("x-test-enriched", "yes"), context);
    }

    @Test
    public void testSuccess() throws Exception {
        MockTransportResponse response = MockTransportResponse.buffered(200, "[{\"id\":1},{\"id\":2}]");
        transport.respondWith(response);

        QueryResult result = execute(new QueryRequestOptions(), Context.ROOT).get();
        assertTrue(result.isSuccess());
        assertEquals(2, result.asSuccess().itemCount);
        assertTrue(response.isClosed());
    }

    @Test
    public void testRequestShape() throws Exception {
        transport.respondWith(MockTransportResponse.buffered(200, "[]"));
        QueryRequestOptions options = new QueryRequestOptions().setPartitionKey("pk-1").setMaxItemCount(10)
                .setSessionToken("0:1#5").setConsistencyLevel(ConsistencyLevel.SESSION);
        execute(options, Context.ROOT).get();

        assertEquals(1, transport.sentRequests.size());
        QueryRequest request = transport.sentRequests.get(0);
        assertEquals(ADDRESS, request.resourceAddress);
        assertEquals(ResourceKind.DOCUMENT, request.resourceKind);
        assertEquals(OperationKind.QUERY, request.operationKind);
        assertEquals("pk-1", request.getPartitionKey().orElseThrow());
        assertEquals("yes", request.getHeaders().get("x-test-enriched"));
        assertEquals("10", request.getHeaders().get(QueryExecutor.MAX_ITEM_COUNT));
        assertEquals("0:1#5", request.getHeaders().get(QueryExecutor.SESSION_TOKEN));
        assertEquals("SESSION", request.getHeaders().get(QueryExecutor.CONSISTENCY_LEVEL));

        JsonNode payload = Utilities.byteStringToTree(request.payload);
        assertEquals(QUERY.queryText, payload.get("query").asText());
        assertEquals("@id", payload.get("parameters").get(0).get("name").asText());
        assertEquals(1, payload.get("parameters").get(0).get("value").asInt());
    }

    @Test
    public void testTargetedExecution() throws Exception {
        transport.respondWith(MockTransportResponse.buffered(200, "[]"));
        PartitionTarget target = new PartitionTarget("7", new KeyRange("A", "M"));
        executor.execute(ADDRESS, target, ResourceKind.DOCUMENT, OperationKind.QUERY, COLLECTION,
                new QueryRequestOptions(), QUERY, null, Context.ROOT).get();
        assertEquals("7", transport.sentRequests.get(0).getHeaders().get(QueryExecutor.PARTITION_KEY_RANGE_ID));
    }

    @Test
    public void testNotFoundIsFailureResult() throws Exception {
        MockTransportResponse response = MockTransportResponse.buffered(404, "{\"code\":\"NotFound\"}");
        transport.respondWith(response);

        QueryResult result = execute(new QueryRequestOptions(), Context.ROOT).get();
        assertFalse(result.isSuccess());
        assertEquals(404, result.asFailure().statusCode);
        assertEquals(0, decoder.decodes.get());
        assertTrue(response.isClosed());
    }

    @Test
    public void testDecodeFailureFailsFuture() {
        MockTransportResponse response = MockTransportResponse.buffered(200, "{not json");
        transport.respondWith(response);

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> execute(new QueryRequestOptions(), Context.ROOT).get());
        assertInstanceOf(DecodeException.class, e.getCause());
        assertTrue(response.isClosed());
    }

    @Test
    public void testTransportErrorPropagates() {
        transport.pendingResponse = CompletableFuture.failedFuture(new IllegalStateException("channel closed"));
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> execute(new QueryRequestOptions(), Context.ROOT).get());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    public void testUnencodableParameterFailsFuture() {
        QuerySpec query = new QuerySpec("SELECT * FROM c WHERE c.owner = @owner").withParameter("@owner", new Object());
        CompletableFuture<QueryResult> f = executor.execute(ADDRESS, ResourceKind.DOCUMENT, OperationKind.QUERY,
                COLLECTION, new QueryRequestOptions(), query, null, Context.ROOT);
        ExecutionException e = assertThrows(ExecutionException.class, f::get);
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertTrue(transport.sentRequests.isEmpty());
    }

    @Test
    public void testCancelledBeforeSend() {
        Context.CancellableContext context = Context.ROOT.withCancellation();
        context.cancel(null);
        CompletableFuture<QueryResult> f = execute(new QueryRequestOptions(), context);
        assertTrue(f.isCancelled());
        assertThrows(CancellationException.class, f::get);
        assertTrue(transport.sentRequests.isEmpty());
    }

    @Test
    public void testCancelledDuringRoundTrip() {
        CompletableFuture<TransportResponse> pending = new CompletableFuture<>();
        transport.pendingResponse = pending;
        Context.CancellableContext context = Context.ROOT.withCancellation();
        CompletableFuture<QueryResult> f = execute(new QueryRequestOptions(), context);
        assertFalse(f.isDone());

        context.cancel(null);
        assertTrue(f.isCancelled());
        assertTrue(pending.isCancelled());
        assertEquals(0, decoder.decodes.get());
    }

    @Test
    public void testLateResponseClosedAfterCancel() {
        // A transport that ignores cancellation of its future.
        CompletableFuture<TransportResponse> stubborn = new CompletableFuture<>() {
            @Override
            public boolean cancel(boolean mayInterruptIfRunning) {
                return false;
            }
        };
        transport.pendingResponse = stubborn;
        Context.CancellableContext context = Context.ROOT.withCancellation();
        CompletableFuture<QueryResult> f = execute(new QueryRequestOptions(), context);
        context.cancel(null);
        assertTrue(f.isCancelled());

        MockTransportResponse late = MockTransportResponse.buffered(200, "[1]");
        stubborn.complete(late);
        assertTrue(late.isClosed());
        assertEquals(0, decoder.decodes.get());
    }
}
