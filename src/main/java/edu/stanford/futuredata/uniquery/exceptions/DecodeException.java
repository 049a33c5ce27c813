package edu.stanford.futuredata.uniquery.exceptions;

/**
 * A successful response carried a body that could not be decoded.
 */
public class DecodeException extends QueryClientException {
    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(0, message, cause);
    }
}
