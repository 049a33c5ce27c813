package edu.stanford.futuredata.uniquery.model;

import java.util.Optional;

/**
 * Per-request options for a query.  Every field is optional.
 */
public class QueryRequestOptions {
    private String partitionKey;
    private SerializationOptions serializationOptions;
    private Integer maxItemCount;
    private String sessionToken;
    private ConsistencyLevel consistencyLevel;

    public Optional<String> getPartitionKey() {
        return Optional.ofNullable(partitionKey);
    }

    public QueryRequestOptions setPartitionKey(String partitionKey) {
        this.partitionKey = partitionKey;
        return this;
    }

    public SerializationOptions getSerializationOptions() {
        return serializationOptions == null ? SerializationOptions.DEFAULT : serializationOptions;
    }

    public QueryRequestOptions setSerializationOptions(SerializationOptions serializationOptions) {
        this.serializationOptions = serializationOptions;
        return this;
    }

    public Optional<Integer> getMaxItemCount() {
        return Optional.ofNullable(maxItemCount);
    }

    public QueryRequestOptions setMaxItemCount(Integer maxItemCount) {
        this.maxItemCount = maxItemCount;
        return this;
    }

    public Optional<String> getSessionToken() {
        return Optional.ofNullable(sessionToken);
    }

    public QueryRequestOptions setSessionToken(String sessionToken) {
        this.sessionToken = sessionToken;
        return this;
    }

    public Optional<ConsistencyLevel> getConsistencyLevel() {
        return Optional.ofNullable(consistencyLevel);
    }

    public QueryRequestOptions setConsistencyLevel(ConsistencyLevel consistencyLevel) {
        this.consistencyLevel = consistencyLevel;
        return this;
    }
}
