package org.cfnrefactor.graph.intrinsic;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Typed view of a CloudFormation intrinsic function node.
 * <p>
 * Templates are kept as long-form JSON trees ({@code {"Ref": "X"}}, {@code {"Fn::GetAtt": ["X", "Arn"]}}, ...).
 * {@link #decode(JsonNode)} recognises the single-key objects that carry an intrinsic and returns one of
 * {@link Ref}, {@link GetAtt}, {@link Sub}, {@link Join} or {@link OpaqueIntrinsic}. Opaque variants keep
 * their payload so traversals can still descend into it.
 */
public interface Intrinsic {

    String REF = "Ref";
    String GET_ATT = "Fn::GetAtt";
    String SUB = "Fn::Sub";
    String JOIN = "Fn::Join";

    Set<String> OPAQUE_FUNCTIONS = Set.of(
        "Fn::And",
        "Fn::Or",
        "Fn::Not",
        "Fn::Equals",
        "Fn::If",
        "Fn::FindInMap",
        "Fn::Select",
        "Fn::Split",
        "Fn::Cidr",
        "Fn::Base64",
        "Fn::ImportValue",
        "Fn::Transform",
        "Fn::Contains",
        "Fn::GetAZs",
        "Fn::Length",
        "Fn::ToJsonString",
        "Condition"
    );

    /**
     * @return the function key as it appears in the template, e.g. {@code Fn::Sub}
     */
    String functionName();

    /**
     * Build the long-form JSON node for this intrinsic.
     */
    JsonNode toNode();

    /**
     * Decode a template value into an intrinsic.
     * @param node any template value
     * @return the intrinsic, or empty when the value is not a single-key intrinsic object
     */
    static Optional<Intrinsic> decode(JsonNode node) {
        if (node == null || !node.isObject() || node.size() != 1) {
            return Optional.empty();
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        Map.Entry<String, JsonNode> entry = fields.next();
        String function = entry.getKey();
        JsonNode payload = entry.getValue();
        switch (function) {
            case REF:
                if (payload.isTextual()) {
                    return Optional.of(new Ref(payload.asText()));
                }
                return Optional.of(new OpaqueIntrinsic(function, payload));
            case GET_ATT:
                return Optional.of(GetAtt.fromPayload(payload)
                    .<Intrinsic>map(g -> g)
                    .orElseGet(() -> new OpaqueIntrinsic(function, payload)));
            case SUB:
                return Optional.of(Sub.fromPayload(payload)
                    .<Intrinsic>map(s -> s)
                    .orElseGet(() -> new OpaqueIntrinsic(function, payload)));
            case JOIN:
                if (payload.isArray() && payload.size() == 2
                    && payload.get(0).isTextual() && payload.get(1).isArray()) {
                    return Optional.of(new Join(payload.get(0).asText(), (ArrayNode) payload.get(1)));
                }
                return Optional.of(new OpaqueIntrinsic(function, payload));
            default:
                if (OPAQUE_FUNCTIONS.contains(function)) {
                    return Optional.of(new OpaqueIntrinsic(function, payload));
                }
                return Optional.empty();
        }
    }

    /**
     * @return true when the node is a single-key object named after an intrinsic function
     */
    static boolean isIntrinsic(JsonNode node) {
        return decode(node).isPresent();
    }

    static ObjectNode wrap(String function, JsonNode payload) {
        ObjectNode node = JsonNodes.FACTORY.objectNode();
        node.set(function, payload);
        return node;
    }
}
