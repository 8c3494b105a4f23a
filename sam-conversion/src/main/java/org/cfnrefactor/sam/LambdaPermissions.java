package org.cfnrefactor.sam;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import org.cfnrefactor.graph.ResourceGraph;
import org.cfnrefactor.graph.ResourceNodes;
import org.cfnrefactor.graph.Template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Lookup of {@code AWS::Lambda::Permission} resources that SAM regenerates for folded events.
 */
public final class LambdaPermissions {

    private LambdaPermissions() {}

    /**
     * @return ids of permissions granting on {@code functionId} whose properties satisfy {@code filter}
     */
    public static List<String> forFunction(Template template, String functionId, Predicate<ObjectNode> filter) {
        List<String> matches = new ArrayList<>();
        ResourceGraph.resourcesOfType(template, SamTypes.LAMBDA_PERMISSION).forEach((id, resource) -> {
            var properties = ResourceNodes.properties(resource);
            if (properties.isEmpty()) {
                return;
            }
            var target = FunctionReferences.targetId(properties.get().get("FunctionName"));
            if (target.isPresent() && target.get().equals(functionId) && filter.test(properties.get())) {
                matches.add(id);
            }
        });
        return matches;
    }

    public static boolean hasPrincipal(ObjectNode properties, String principal) {
        return ResourceNodes.textProperty(properties, "Principal").map(principal::equals).orElse(false);
    }

    /**
     * @return true when the serialized {@code SourceArn} mentions {@code logicalId}
     */
    public static boolean sourceArnMentions(ObjectNode properties, String logicalId) {
        JsonNode sourceArn = properties.get("SourceArn");
        return sourceArn != null && sourceArn.toString().contains(logicalId);
    }
}
