package edu.stanford.futuredata.uniquery.broker;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.google.protobuf.ByteString;
import edu.stanford.futuredata.uniquery.exceptions.DecodeException;
import edu.stanford.futuredata.uniquery.interfaces.ElementDecoder;
import edu.stanford.futuredata.uniquery.interfaces.HeaderConverter;
import edu.stanford.futuredata.uniquery.interfaces.TransportResponse;
import edu.stanford.futuredata.uniquery.model.CollectionIdentity;
import edu.stanford.futuredata.uniquery.model.QueryHeaders;
import edu.stanford.futuredata.uniquery.model.QueryResult;
import edu.stanford.futuredata.uniquery.model.ResourceKind;
import edu.stanford.futuredata.uniquery.model.SerializationOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Turns a raw transport response into a {@link QueryResult}.  The response is closed before returning, whatever
 * the outcome.
 */
public class ResponseMaterializer {
    private static final Logger logger = LoggerFactory.getLogger(ResponseMaterializer.class);

    private final ElementDecoder elementDecoder;
    private final HeaderConverter headerConverter;

    public ResponseMaterializer(ElementDecoder elementDecoder, HeaderConverter headerConverter) {
        this.elementDecoder = elementDecoder;
        this.headerConverter = headerConverter;
    }

    public QueryResult materialize(TransportResponse response, ResourceKind resourceKind,
                                   CollectionIdentity collectionIdentity, SerializationOptions serializationOptions) {
        try (response) {
            QueryHeaders headers = headerConverter.convert(response.getHeaders(), resourceKind, collectionIdentity);
            if (!response.isSuccessStatusCode()) {
                return QueryResult.failure(response.getStatusCode(), response.getErrorMessage().orElse(null),
                        response.getError().orElse(null), headers);
            }
            ByteString buffer = readBody(response);
            long responseSizeBytes = buffer.size();
            ArrayNode items;
            try {
                items = elementDecoder.decode(buffer, resourceKind, serializationOptions);
            } catch (DecodeException e) {
                logger.error("Failed to decode {} byte {} response for {}: {}",
                        responseSizeBytes, resourceKind, collectionIdentity, e.getMessage());
                throw e;
            }
            return QueryResult.success(response.getStatusCode(), items, responseSizeBytes, headers);
        }
    }

    // Reuses a body the transport already buffered; otherwise copies the stream.
    static ByteString readBody(TransportResponse response) {
        Optional<ByteString> buffered = response.getBufferedContent();
        if (buffered.isPresent()) {
            return buffered.get();
        }
        Optional<InputStream> content = response.getContent();
        if (content.isEmpty()) {
            return ByteString.EMPTY;
        }
        try {
            return ByteString.readFrom(content.get());
        } catch (IOException e) {
            throw new DecodeException("Failed to read response body", e);
        }
    }
}
