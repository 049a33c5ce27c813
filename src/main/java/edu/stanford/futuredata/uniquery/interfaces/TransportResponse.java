package edu.stanford.futuredata.uniquery.interfaces;

import com.google.protobuf.ByteString;
import edu.stanford.futuredata.uniquery.model.QueryError;

import java.io.InputStream;
import java.util.Map;
import java.util.Optional;

/**
 * A raw response as handed back by the {@link Transport}.  Holds the body stream or connection until closed.
 */
public interface TransportResponse extends AutoCloseable {

    int getStatusCode();

    Map<String, String> getHeaders();

    // Set when the transport already holds the whole body in memory.
    Optional<ByteString> getBufferedContent();

    Optional<InputStream> getContent();

    Optional<String> getErrorMessage();

    Optional<QueryError> getError();

    default boolean isSuccessStatusCode() {
        int statusCode = getStatusCode();
        return statusCode >= 200 && statusCode < 300;
    }

    @Override
    void close();
}
