package edu.stanford.futuredata.uniquery.model;

import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one query round trip: either a {@link Success} page of items or a server-reported {@link Failure}.
 * No other subclasses exist.
 */
public abstract class QueryResult {
    public final QueryHeaders headers;

    private QueryResult(QueryHeaders headers) {
        this.headers = headers;
    }

    public abstract boolean isSuccess();

    public abstract int getStatusCode();

    public Success asSuccess() {
        throw new IllegalStateException("Not a successful query result: status " + getStatusCode());
    }

    public Failure asFailure() {
        throw new IllegalStateException("Not a failed query result");
    }

    public static Success success(ArrayNode items, long responseSizeBytes, QueryHeaders headers) {
        return new Success(200, items, responseSizeBytes, headers);
    }

    public static Success success(int statusCode, ArrayNode items, long responseSizeBytes, QueryHeaders headers) {
        return new Success(statusCode, items, responseSizeBytes, headers);
    }

    public static Failure failure(int statusCode, String errorMessage, QueryError error, QueryHeaders headers) {
        return new Failure(statusCode, errorMessage, error, headers);
    }

    public static final class Success extends QueryResult {
        public final int statusCode;
        public final ArrayNode items;
        public final int itemCount;
        // Length of the raw body, before decoding.
        public final long responseSizeBytes;

        private Success(int statusCode, ArrayNode items, long responseSizeBytes, QueryHeaders headers) {
            super(headers);
            this.statusCode = statusCode;
            this.items = Objects.requireNonNull(items);
            this.itemCount = items.size();
            this.responseSizeBytes = responseSizeBytes;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public int getStatusCode() {
            return statusCode;
        }

        @Override
        public Success asSuccess() {
            return this;
        }

        @Override
        public String toString() {
            return String.format("QueryResult.Success{itemCount=%d, responseSizeBytes=%d}", itemCount, responseSizeBytes);
        }
    }

    public static final class Failure extends QueryResult {
        public final int statusCode;
        private final String errorMessage;
        private final QueryError error;

        private Failure(int statusCode, String errorMessage, QueryError error, QueryHeaders headers) {
            super(headers);
            this.statusCode = statusCode;
            this.errorMessage = errorMessage;
            this.error = error;
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public int getStatusCode() {
            return statusCode;
        }

        @Override
        public Failure asFailure() {
            return this;
        }

        public Optional<String> getErrorMessage() {
            return Optional.ofNullable(errorMessage);
        }

        public Optional<QueryError> getError() {
            return Optional.ofNullable(error);
        }

        @Override
        public String toString() {
            return String.format("QueryResult.Failure{statusCode=%d, errorMessage=%s}", statusCode, errorMessage);
        }
    }
}
