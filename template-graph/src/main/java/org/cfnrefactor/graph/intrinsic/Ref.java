package org.cfnrefactor.graph.intrinsic;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code {"Ref": logicalId}}. Pseudo parameters such as {@code AWS::Region} are also plain refs.
 */
public record Ref(String logicalId) implements Intrinsic {

    public static JsonNode to(String logicalId) {
        return new Ref(logicalId).toNode();
    }

    public boolean isPseudoParameter() {
        return logicalId.contains("::");
    }

    @Override
    public String functionName() {
        return REF;
    }

    @Override
    public JsonNode toNode() {
        return Intrinsic.wrap(REF, JsonNodes.FACTORY.textNode(logicalId));
    }
}
