package org.cfnrefactor.graph.intrinsic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

/**
 * {@code {"Fn::Join": [delimiter, [fragment, ...]]}}.
 */
public record Join(String delimiter, ArrayNode fragments) implements Intrinsic {

    @Override
    public String functionName() {
        return JOIN;
    }

    @Override
    public JsonNode toNode() {
        ArrayNode payload = JsonNodes.FACTORY.arrayNode();
        payload.add(delimiter);
        payload.add(fragments);
        return Intrinsic.wrap(JOIN, payload);
    }
}
