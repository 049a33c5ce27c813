package edu.stanford.futuredata.uniquery.model;

/**
 * Structured error reported by the server alongside a failure status.
 */
public class QueryError {
    public final String code;
    public final String message;

    public QueryError(String code, String message) {
        this.code = code;
        this.message = message;
    }

    @Override
    public String toString() {
        return String.format("QueryError{code=%s, message=%s}", code, message);
    }
}
