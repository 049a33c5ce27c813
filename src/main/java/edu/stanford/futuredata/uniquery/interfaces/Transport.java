package edu.stanford.futuredata.uniquery.interfaces;

import edu.stanford.futuredata.uniquery.model.QueryRequest;
import io.grpc.Context;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

public interface Transport {
    /*
     Owns the network round trip.
     */

    // Apply the enricher to the request, send it, and complete with the raw response.  Cancelling the returned
    // future, or the context, aborts the round trip.
    CompletableFuture<TransportResponse> send(QueryRequest request, Consumer<QueryRequest> requestEnricher,
                                              Context cancellation);
}
