package edu.stanford.futuredata.uniquery.model;

import com.google.protobuf.ByteString;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * An outgoing query request.  Headers stay mutable so request enrichers can attach their own before it is sent.
 */
public class QueryRequest {
    public final String resourceAddress;
    public final ResourceKind resourceKind;
    public final OperationKind operationKind;
    public final ByteString payload;
    private final String partitionKey;
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    public QueryRequest(String resourceAddress, ResourceKind resourceKind, OperationKind operationKind,
                        String partitionKey, ByteString payload) {
        this.resourceAddress = resourceAddress;
        this.resourceKind = resourceKind;
        this.operationKind = operationKind;
        this.partitionKey = partitionKey;
        this.payload = payload;
    }

    public Optional<String> getPartitionKey() {
        return Optional.ofNullable(partitionKey);
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public QueryRequest setHeader(String name, String value) {
        headers.put(name, value);
        return this;
    }
}
