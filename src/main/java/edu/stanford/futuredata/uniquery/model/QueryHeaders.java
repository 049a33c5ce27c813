package edu.stanford.futuredata.uniquery.model;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Query-specific view of response headers.
 */
public class QueryHeaders {
    public final ResourceKind resourceKind;
    public final CollectionIdentity collectionIdentity;
    public final double requestCharge;
    public final int subStatus;
    public final long retryAfterMillis;
    private final String continuationToken;
    private final String activityId;
    private final String sessionToken;
    private final Integer itemCount;
    private final Map<String, String> rawHeaders;

    public QueryHeaders(ResourceKind resourceKind, CollectionIdentity collectionIdentity, String continuationToken,
                        double requestCharge, String activityId, String sessionToken, Integer itemCount,
                        int subStatus, long retryAfterMillis, Map<String, String> rawHeaders) {
        this.resourceKind = resourceKind;
        this.collectionIdentity = collectionIdentity;
        this.continuationToken = continuationToken;
        this.requestCharge = requestCharge;
        this.activityId = activityId;
        this.sessionToken = sessionToken;
        this.itemCount = itemCount;
        this.subStatus = subStatus;
        this.retryAfterMillis = retryAfterMillis;
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (rawHeaders != null) {
            // Status lines show up under a null key.
            rawHeaders.forEach((name, value) -> {
                if (name != null) {
                    copy.put(name, value);
                }
            });
        }
        this.rawHeaders = Collections.unmodifiableMap(copy);
    }

    // Absent when this is the last page.
    public Optional<String> getContinuationToken() {
        return Optional.ofNullable(continuationToken);
    }

    public Optional<String> getActivityId() {
        return Optional.ofNullable(activityId);
    }

    public Optional<String> getSessionToken() {
        return Optional.ofNullable(sessionToken);
    }

    public Optional<Integer> getItemCount() {
        return Optional.ofNullable(itemCount);
    }

    public Map<String, String> getRawHeaders() {
        return rawHeaders;
    }
}
