package org.cfnrefactor.graph;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.cfnrefactor.graph.intrinsic.GetAtt;
import org.cfnrefactor.graph.intrinsic.Intrinsic;
import org.cfnrefactor.graph.intrinsic.References;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Absolute paths of {@code AWS::ApiGateway::Resource} chains.
 * <p>
 * Each resource's path is its parent's path plus its {@code PathPart}; a parent given as
 * {@code GetAtt(Api, RootResourceId)} is {@code "/"}. Results are memoized per logical id. Chains with a
 * cycle, a missing parent or a non-string {@code PathPart} resolve to empty.
 */
@Slf4j
public class ApiResourcePathCache {

    public static final String API_RESOURCE_TYPE = "AWS::ApiGateway::Resource";
    private static final String ROOT_RESOURCE_ID = "RootResourceId";

    private final Template template;
    private final Map<String, Optional<String>> cache = new HashMap<>();

    public ApiResourcePathCache(Template template) {
        this.template = template;
    }

    public Optional<String> pathOf(String logicalId) {
        return resolve(logicalId, new HashSet<>());
    }

    /**
     * Resolve a method's {@code ResourceId} value (root sentinel or a reference to a resource).
     */
    public Optional<String> resolveMethodPath(JsonNode resourceId) {
        if (isRootSentinel(resourceId)) {
            return Optional.of("/");
        }
        return References.extractLogicalId(resourceId).flatMap(this::pathOf);
    }

    private Optional<String> resolve(String logicalId, Set<String> visiting) {
        Optional<String> cached = cache.get(logicalId);
        if (cached != null) {
            return cached;
        }
        if (!visiting.add(logicalId)) {
            log.warn("Cycle in API Gateway resource parents at {}", logicalId);
            return Optional.empty();
        }
        Optional<String> path = computePath(logicalId, visiting);
        cache.put(logicalId, path);
        return path;
    }

    private Optional<String> computePath(String logicalId, Set<String> visiting) {
        var resource = template.resource(logicalId);
        if (resource.isEmpty() || !ResourceNodes.isType(resource.get(), API_RESOURCE_TYPE)) {
            return Optional.empty();
        }
        var properties = ResourceNodes.properties(resource.get());
        if (properties.isEmpty()) {
            return Optional.empty();
        }
        JsonNode parent = properties.get().get("ParentId");
        Optional<String> parentPath;
        if (isRootSentinel(parent)) {
            parentPath = Optional.of("/");
        } else {
            var parentId = References.extractLogicalId(parent);
            if (parentId.isEmpty()) {
                return Optional.empty();
            }
            parentPath = resolve(parentId.get(), visiting);
        }
        var pathPart = ResourceNodes.textProperty(properties.get(), "PathPart");
        if (parentPath.isEmpty() || pathPart.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(joinPaths(parentPath.get(), pathPart.get()));
    }

    static boolean isRootSentinel(JsonNode node) {
        return Intrinsic.decode(node)
            .filter(GetAtt.class::isInstance)
            .map(GetAtt.class::cast)
            .map(g -> ROOT_RESOURCE_ID.equals(g.attribute()))
            .orElse(false);
    }

    public static String joinPaths(String parent, String child) {
        String base = parent == null || parent.isEmpty() ? "/" : parent;
        if ("/".equals(base)) {
            return child.isEmpty() ? "/" : "/" + child;
        }
        if (child.isEmpty()) {
            return base;
        }
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/" + child;
    }
}
