package edu.stanford.futuredata.uniquery.utilities;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.google.protobuf.ByteString;
import edu.stanford.futuredata.uniquery.exceptions.DecodeException;
import edu.stanford.futuredata.uniquery.interfaces.ElementDecoder;
import edu.stanford.futuredata.uniquery.model.ResourceKind;
import edu.stanford.futuredata.uniquery.model.SerializationOptions;

/**
 * Decodes JSON text bodies.  Feed responses wrap their items in an envelope keyed by resource kind,
 * e.g. {@code {"_rid": "...", "Documents": [...], "_count": 2}}; bare arrays and single objects are accepted too.
 */
public class JsonElementDecoder implements ElementDecoder {

    @Override
    public ArrayNode decode(ByteString buffer, ResourceKind resourceKind, SerializationOptions serializationOptions) {
        if (!SerializationOptions.JSON_TEXT.equals(serializationOptions.contentSerializationFormat)) {
            throw new DecodeException("Unsupported content serialization format: "
                    + serializationOptions.contentSerializationFormat);
        }
        ArrayNode elements = Utilities.objectMapper.createArrayNode();
        if (buffer.isEmpty()) {
            return elements;
        }
        JsonNode root = Utilities.byteStringToTree(buffer);
        if (root == null || root.isMissingNode()) {
            // Whitespace only.
            return elements;
        }
        if (root.isArray()) {
            return (ArrayNode) root;
        }
        if (!root.isObject()) {
            throw new DecodeException(String.format("Expected a JSON object or array for %s, got %s",
                    resourceKind, root.getNodeType()));
        }
        JsonNode envelope = root.get(resourceKind.envelopeField);
        if (envelope != null && envelope.isArray()) {
            return (ArrayNode) envelope;
        }
        elements.add(root);
        return elements;
    }
}
