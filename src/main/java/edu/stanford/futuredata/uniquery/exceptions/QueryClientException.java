package edu.stanford.futuredata.uniquery.exceptions;

/**
 * Base class of errors raised by the query client.  Carries an HTTP-like status code; 0 means client-side.
 */
public class QueryClientException extends RuntimeException {
    private final int statusCode;

    public QueryClientException(String message) {
        this(0, message);
    }

    public QueryClientException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public QueryClientException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
