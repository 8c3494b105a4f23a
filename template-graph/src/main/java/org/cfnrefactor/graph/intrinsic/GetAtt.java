package org.cfnrefactor.graph.intrinsic;

import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

/**
 * {@code {"Fn::GetAtt": [logicalId, attribute]}} or the dotted string form {@code "logicalId.attribute"}.
 * The form is remembered so re-encoding keeps the author's choice.
 */
public record GetAtt(String logicalId, String attribute, boolean dotted) implements Intrinsic {

    public static GetAtt of(String logicalId, String attribute) {
        return new GetAtt(logicalId, attribute, false);
    }

    static Optional<GetAtt> fromPayload(JsonNode payload) {
        if (payload.isArray() && payload.size() >= 2
            && payload.get(0).isTextual() && payload.get(1).isTextual()) {
            return Optional.of(new GetAtt(payload.get(0).asText(), payload.get(1).asText(), false));
        }
        if (payload.isTextual()) {
            String text = payload.asText();
            int dot = text.indexOf('.');
            if (dot > 0) {
                return Optional.of(new GetAtt(text.substring(0, dot), text.substring(dot + 1), true));
            }
        }
        return Optional.empty();
    }

    public GetAtt withLogicalId(String newLogicalId) {
        return new GetAtt(newLogicalId, attribute, dotted);
    }

    @Override
    public String functionName() {
        return GET_ATT;
    }

    @Override
    public JsonNode toNode() {
        if (dotted) {
            return Intrinsic.wrap(GET_ATT, JsonNodes.FACTORY.textNode(logicalId + "." + attribute));
        }
        ArrayNode payload = JsonNodes.FACTORY.arrayNode();
        payload.add(logicalId);
        payload.add(attribute);
        return Intrinsic.wrap(GET_ATT, payload);
    }
}
