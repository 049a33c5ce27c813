package edu.stanford.futuredata.uniquery.model;

import java.util.Objects;

/**
 * Content format requested for query responses.
 */
public class SerializationOptions {
    public static final String JSON_TEXT = "JsonText";

    public static final SerializationOptions DEFAULT = new SerializationOptions(JSON_TEXT);

    public final String contentSerializationFormat;

    public SerializationOptions(String contentSerializationFormat) {
        this.contentSerializationFormat = Objects.requireNonNull(contentSerializationFormat);
    }
}
