package edu.stanford.futuredata.uniquery.exceptions;

/**
 * Routing could not be resolved, even after the collection cache was refreshed.  Reported as "not found";
 * the caller should retry its whole query.
 */
public class StaleCacheException extends QueryClientException {
    public static final int NOT_FOUND = 404;

    public StaleCacheException(String message) {
        super(NOT_FOUND, message);
    }
}
