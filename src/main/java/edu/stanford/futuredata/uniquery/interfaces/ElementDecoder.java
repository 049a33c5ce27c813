package edu.stanford.futuredata.uniquery.interfaces;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.google.protobuf.ByteString;
import edu.stanford.futuredata.uniquery.exceptions.DecodeException;
import edu.stanford.futuredata.uniquery.model.ResourceKind;
import edu.stanford.futuredata.uniquery.model.SerializationOptions;

public interface ElementDecoder {
    // Always an array, even for a single object or an empty body.
    ArrayNode decode(ByteString buffer, ResourceKind resourceKind, SerializationOptions serializationOptions)
            throws DecodeException;
}
