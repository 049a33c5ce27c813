package edu.stanford.futuredata.uniquery.utilities;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.protobuf.ByteString;
import edu.stanford.futuredata.uniquery.interfaces.QuerySerializer;
import edu.stanford.futuredata.uniquery.model.QueryParameter;
import edu.stanford.futuredata.uniquery.model.QuerySpec;

/**
 * Encodes a query as {@code {"query": "...", "parameters": [{"name": "@p", "value": ...}]}}.
 */
public class JsonQuerySerializer implements QuerySerializer {

    @Override
    public ByteString encode(QuerySpec querySpec) {
        ObjectNode root = Utilities.objectMapper.createObjectNode();
        root.put("query", querySpec.queryText);
        ArrayNode parameters = root.putArray("parameters");
        for (QueryParameter p: querySpec.parameters) {
            ObjectNode parameter = parameters.addObject();
            parameter.put("name", p.name);
            parameter.set("value", Utilities.objectMapper.valueToTree(p.value));
        }
        return Utilities.objectToByteString(root);
    }
}
