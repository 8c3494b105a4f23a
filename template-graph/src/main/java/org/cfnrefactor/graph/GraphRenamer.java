package org.cfnrefactor.graph;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.cfnrefactor.graph.intrinsic.ReferenceRewriter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Applies a logical-id rename map to a whole template.
 * <p>
 * The map is validated against the current resource set before anything is touched, so a rejected map
 * leaves the template unchanged. Resource keys keep their declaration order.
 */
@Slf4j
public final class GraphRenamer {

    private GraphRenamer() {}

    public static class InvalidRenameMapException extends RuntimeException {
        public InvalidRenameMapException(String message) {
            super(message);
        }
    }

    /**
     * Rename resources and every {@code Ref}, {@code GetAtt}, {@code Sub} token and {@code DependsOn}
     * entry that points at them. Identity entries are ignored.
     */
    public static void apply(Template template, Map<String, String> renameMap) {
        Map<String, String> effective = new LinkedHashMap<>();
        renameMap.forEach((from, to) -> {
            if (!from.equals(to)) {
                effective.put(from, to);
            }
        });
        if (effective.isEmpty()) {
            return;
        }
        ObjectNode resources = template.resources();
        validate(resources, effective);

        ReferenceRewriter rewriter = new ReferenceRewriter(effective);
        rewriter.rewrite(template.getRoot());

        Map<String, JsonNode> renamed = new LinkedHashMap<>();
        resources.fields().forEachRemaining(entry -> {
            if (entry.getValue() instanceof ObjectNode) {
                rewriter.rewriteDependsOn((ObjectNode) entry.getValue());
            }
            renamed.put(effective.getOrDefault(entry.getKey(), entry.getKey()), entry.getValue());
        });
        resources.removeAll();
        resources.setAll(renamed);
        log.debug("Applied {} logical id renames", effective.size());
    }

    private static void validate(ObjectNode resources, Map<String, String> renameMap) {
        Set<String> finalIds = new HashSet<>();
        var names = resources.fieldNames();
        while (names.hasNext()) {
            String current = names.next();
            String target = renameMap.getOrDefault(current, current);
            if (!finalIds.add(target)) {
                throw new InvalidRenameMapException("Rename map produces duplicate logical id " + target);
            }
        }
    }
}
