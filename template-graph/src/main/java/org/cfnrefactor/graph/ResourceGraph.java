package org.cfnrefactor.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.cfnrefactor.graph.intrinsic.References;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Graph-level operations over a template's resources.
 */
@Slf4j
public final class ResourceGraph {

    private ResourceGraph() {}

    /**
     * Delete resources and prune them from every remaining {@code DependsOn}.
     * Ids that are already absent are ignored; an emptied {@code DependsOn} is removed.
     */
    public static void removeResources(Template template, Collection<String> logicalIds) {
        if (logicalIds.isEmpty()) {
            return;
        }
        Set<String> targets = new HashSet<>(logicalIds);
        ObjectNode resources = template.resources();
        for (String logicalId : targets) {
            if (resources.remove(logicalId) != null) {
                log.debug("Removed resource {}", logicalId);
            }
        }
        resources.fields().forEachRemaining(entry -> {
            if (entry.getValue() instanceof ObjectNode) {
                pruneDependsOn((ObjectNode) entry.getValue(), targets);
            }
        });
    }

    private static void pruneDependsOn(ObjectNode resource, Set<String> removed) {
        JsonNode dependsOn = resource.get(ResourceNodes.DEPENDS_ON);
        if (dependsOn == null) {
            return;
        }
        if (dependsOn.isTextual()) {
            if (removed.contains(dependsOn.asText())) {
                resource.remove(ResourceNodes.DEPENDS_ON);
            }
            return;
        }
        if (dependsOn.isArray()) {
            ArrayNode kept = resource.arrayNode();
            for (JsonNode entry : dependsOn) {
                if (!(entry.isTextual() && removed.contains(entry.asText()))) {
                    kept.add(entry);
                }
            }
            if (kept.isEmpty()) {
                resource.remove(ResourceNodes.DEPENDS_ON);
            } else {
                resource.set(ResourceNodes.DEPENDS_ON, kept);
            }
        }
    }

    /**
     * @return {@code base} if unused, otherwise the first free {@code base2}, {@code base3}, ...
     */
    public static String generateUniqueName(Collection<String> existing, String base) {
        if (!existing.contains(base)) {
            return base;
        }
        int index = 2;
        while (existing.contains(base + index)) {
            index++;
        }
        return base + index;
    }

    public static Map<String, ObjectNode> resourcesOfType(Template template, String type) {
        Map<String, ObjectNode> matches = new LinkedHashMap<>();
        template.resourceEntries().forEach((id, resource) -> {
            if (ResourceNodes.isType(resource, type)) {
                matches.put(id, resource);
            }
        });
        return matches;
    }

    /**
     * Find the resources that would be left dangling if {@code targets} were removed.
     * <p>
     * Every resource outside {@code targets} and {@code ignored} is walked in full; {@code DependsOn}
     * entries are not counted since {@link #removeResources} prunes them.
     *
     * @return logical ids of blocking resources, in declaration order
     */
    public static List<String> blockingReferences(Template template, Collection<String> targets,
                                                  Collection<String> ignored) {
        List<String> blocking = new ArrayList<>();
        if (targets.isEmpty()) {
            return blocking;
        }
        Set<String> skip = new HashSet<>(targets);
        skip.addAll(ignored);
        template.resourceEntries().forEach((id, resource) -> {
            if (!skip.contains(id) && referencesIgnoringDependsOn(resource, targets)) {
                blocking.add(id);
            }
        });
        return blocking;
    }

    public static boolean isReferencedElsewhere(Template template, Collection<String> targets,
                                                Collection<String> ignored) {
        return !blockingReferences(template, targets, ignored).isEmpty()
            || isReferencedOutsideResources(template, targets);
    }

    /**
     * @return true when {@code Outputs}, {@code Conditions}, {@code Rules} or {@code Metadata} point at a target
     */
    public static boolean isReferencedOutsideResources(Template template, Collection<String> targets) {
        for (String section : List.of(Template.OUTPUTS, Template.CONDITIONS, Template.RULES, "Metadata")) {
            var node = template.findSection(section);
            if (node.isPresent() && References.referencesAny(node.get(), targets)) {
                return true;
            }
        }
        return false;
    }

    private static boolean referencesIgnoringDependsOn(ObjectNode resource, Collection<String> targets) {
        var it = resource.fields();
        while (it.hasNext()) {
            var entry = it.next();
            if (ResourceNodes.DEPENDS_ON.equals(entry.getKey())) {
                continue;
            }
            if (References.referencesAny(entry.getValue(), targets)) {
                return true;
            }
        }
        return false;
    }
}
