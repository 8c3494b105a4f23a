package org.cfnrefactor.graph.intrinsic;

import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * {@code {"Fn::Sub": template}} or {@code {"Fn::Sub": [template, variables]}}.
 * {@code variables} is null for the single-string form.
 */
public record Sub(String template, ObjectNode variables) implements Intrinsic {

    static Optional<Sub> fromPayload(JsonNode payload) {
        if (payload.isTextual()) {
            return Optional.of(new Sub(payload.asText(), null));
        }
        if (payload.isArray() && payload.size() == 2
            && payload.get(0).isTextual() && payload.get(1).isObject()) {
            return Optional.of(new Sub(payload.get(0).asText(), (ObjectNode) payload.get(1)));
        }
        return Optional.empty();
    }

    /**
     * @return true when {@code name} is declared in the substitution map and therefore shadows any logical id
     */
    public boolean declaresVariable(String name) {
        return variables != null && variables.has(name);
    }

    @Override
    public String functionName() {
        return SUB;
    }

    @Override
    public JsonNode toNode() {
        if (variables == null) {
            return Intrinsic.wrap(SUB, JsonNodes.FACTORY.textNode(template));
        }
        ArrayNode payload = JsonNodes.FACTORY.arrayNode();
        payload.add(template);
        payload.add(variables);
        return Intrinsic.wrap(SUB, payload);
    }
}
