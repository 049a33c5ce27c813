package edu.stanford.futuredata.uniquery.utilities;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.protobuf.ByteString;
import edu.stanford.futuredata.uniquery.exceptions.DecodeException;
import edu.stanford.futuredata.uniquery.exceptions.QueryClientException;
import org.javatuples.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

public class Utilities {
    public static final ObjectMapper objectMapper =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static final Logger logger = LoggerFactory.getLogger(Utilities.class);

    public static Pair<String, Integer> parseConnectString(String connectString) {
        String[] hostPort = connectString.split(":");
        if (hostPort.length != 2) {
            throw new IllegalArgumentException("Expected host:port, got " + connectString);
        }
        String host = hostPort[0];
        Integer port = Integer.parseInt(hostPort[1]);
        return new Pair<>(host, port);
    }

    public static ByteString objectToByteString(Object obj) {
        try {
            return ByteString.copyFrom(objectMapper.writeValueAsBytes(obj));
        } catch (JsonProcessingException e) {
            logger.error("Serialization Failed {} {}", obj, e.getMessage());
            throw new QueryClientException(0, "JSON serialization failed", e);
        }
    }

    public static JsonNode byteStringToTree(ByteString b) {
        try {
            return objectMapper.readTree(b.newInput());
        } catch (IOException e) {
            logger.error("Deserialization Failed ({} bytes) {}", b.size(), e.getMessage());
            throw new DecodeException("JSON deserialization failed", e);
        }
    }

    public static String toJson(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new QueryClientException(0, "JSON serialization failed", e);
        }
    }
}
