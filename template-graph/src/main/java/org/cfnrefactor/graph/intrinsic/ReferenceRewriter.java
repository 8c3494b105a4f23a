package org.cfnrefactor.graph.intrinsic;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Structural rewrite of logical-id references through a rename map.
 * <p>
 * Containers are rewritten in place; the returned node is the same instance unless the root itself had to
 * be replaced. Literal strings outside intrinsics are never touched, see {@link EmbeddedIdRewriter} for that.
 */
public final class ReferenceRewriter {

    private final Map<String, String> renameMap;

    public ReferenceRewriter(Map<String, String> renameMap) {
        this.renameMap = Map.copyOf(renameMap);
    }

    public static JsonNode rewrite(JsonNode node, Map<String, String> renameMap) {
        if (renameMap.isEmpty()) {
            return node;
        }
        return new ReferenceRewriter(renameMap).rewrite(node);
    }

    public JsonNode rewrite(JsonNode node) {
        if (node == null) {
            return null;
        }
        var intrinsic = Intrinsic.decode(node);
        if (intrinsic.isPresent()) {
            return rewriteIntrinsic((ObjectNode) node, intrinsic.get());
        }
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            List<String> names = new ArrayList<>();
            object.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                JsonNode child = object.get(name);
                JsonNode rewritten = rewrite(child);
                if (rewritten != child) {
                    object.set(name, rewritten);
                }
            }
        } else if (node.isArray()) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                JsonNode child = array.get(i);
                JsonNode rewritten = rewrite(child);
                if (rewritten != child) {
                    array.set(i, rewritten);
                }
            }
        }
        return node;
    }

    private JsonNode rewriteIntrinsic(ObjectNode node, Intrinsic intrinsic) {
        if (intrinsic instanceof Ref) {
            String target = renameMap.get(((Ref) intrinsic).logicalId());
            if (target != null) {
                node.put(Intrinsic.REF, target);
            }
            return node;
        }
        if (intrinsic instanceof GetAtt) {
            GetAtt getAtt = (GetAtt) intrinsic;
            String target = renameMap.get(getAtt.logicalId());
            if (target == null) {
                return node;
            }
            JsonNode payload = node.get(Intrinsic.GET_ATT);
            if (payload.isArray()) {
                ((ArrayNode) payload).set(0, TextNode.valueOf(target));
            } else {
                node.put(Intrinsic.GET_ATT, target + "." + getAtt.attribute());
            }
            return node;
        }
        if (intrinsic instanceof Sub) {
            Sub sub = (Sub) intrinsic;
            Set<String> shadowed = sub.variables() == null ? Set.of() : fieldNames(sub.variables());
            String rewritten = References.replaceSubTokens(sub.template(), renameMap, shadowed);
            JsonNode payload = node.get(Intrinsic.SUB);
            if (payload.isTextual()) {
                node.put(Intrinsic.SUB, rewritten);
            } else {
                ((ArrayNode) payload).set(0, TextNode.valueOf(rewritten));
                rewrite(sub.variables());
            }
            return node;
        }
        // Join fragments and opaque payloads are ordinary containers
        String function = intrinsic.functionName();
        JsonNode payload = node.get(function);
        JsonNode rewritten = rewrite(payload);
        if (rewritten != payload) {
            node.set(function, rewritten);
        }
        return node;
    }

    /**
     * Rewrite the string or list form of a resource's {@code DependsOn}.
     */
    public void rewriteDependsOn(ObjectNode resource) {
        JsonNode dependsOn = resource.get("DependsOn");
        if (dependsOn == null) {
            return;
        }
        if (dependsOn.isTextual()) {
            String target = renameMap.get(dependsOn.asText());
            if (target != null) {
                resource.put("DependsOn", target);
            }
        } else if (dependsOn.isArray()) {
            ArrayNode entries = (ArrayNode) dependsOn;
            for (int i = 0; i < entries.size(); i++) {
                JsonNode entry = entries.get(i);
                String target = entry.isTextual() ? renameMap.get(entry.asText()) : null;
                if (target != null) {
                    entries.set(i, TextNode.valueOf(target));
                }
            }
        }
    }

    private static Set<String> fieldNames(ObjectNode object) {
        Set<String> names = new java.util.HashSet<>();
        object.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
