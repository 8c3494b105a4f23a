package org.cfnrefactor.sam.events;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.cfnrefactor.graph.ResourceGraph;
import org.cfnrefactor.graph.ResourceNodes;
import org.cfnrefactor.graph.Template;
import org.cfnrefactor.graph.intrinsic.Ref;
import org.cfnrefactor.sam.ConversionContext;
import org.cfnrefactor.sam.ConversionPass;
import org.cfnrefactor.sam.FunctionEvents;
import org.cfnrefactor.sam.LambdaPermissions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Moves user pool {@code LambdaConfig} triggers onto the triggered functions as {@code Cognito} events.
 */
@Slf4j
public class CognitoTriggerPass implements ConversionPass {

    static final String USER_POOL_TYPE = "AWS::Cognito::UserPool";

    private static final String COGNITO_PRINCIPAL = "cognito-idp.amazonaws.com";

    @Override
    public String name() {
        return "cognito-triggers";
    }

    @Override
    public boolean apply(ConversionContext context) {
        Template template = context.getTemplate();
        Set<String> permissions = new LinkedHashSet<>();
        boolean changed = false;

        for (Map.Entry<String, ObjectNode> entry : ResourceGraph.resourcesOfType(template, USER_POOL_TYPE).entrySet()) {
            String poolId = entry.getKey();
            var properties = ResourceNodes.properties(entry.getValue());
            JsonNode triggers = properties.map(p -> p.get("LambdaConfig")).orElse(null);
            if (triggers == null || !triggers.isObject()) {
                continue;
            }
            List<String> folded = new ArrayList<>();
            triggers.fields().forEachRemaining(trigger -> {
                var functionId = context.convertedFunction(trigger.getValue());
                if (functionId.isEmpty()) {
                    return;
                }
                ObjectNode event = JsonNodeFactory.instance.objectNode();
                event.set("UserPool", Ref.to(poolId));
                event.put("Trigger", trigger.getKey());
                ObjectNode function = template.resource(functionId.get()).orElseThrow();
                String eventName = FunctionEvents.add(function, poolId + trigger.getKey(), 1, "Cognito", event);
                log.debug("Folded {} trigger of {} into {} event {}", trigger.getKey(), poolId, functionId.get(), eventName);
                folded.add(trigger.getKey());
                permissions.addAll(LambdaPermissions.forFunction(template, functionId.get(),
                    permission -> LambdaPermissions.hasPrincipal(permission, COGNITO_PRINCIPAL)
                        && LambdaPermissions.sourceArnMentions(permission, poolId)));
            });
            if (folded.isEmpty()) {
                continue;
            }
            ((ObjectNode) triggers).remove(folded);
            if (triggers.isEmpty()) {
                properties.get().remove("LambdaConfig");
            }
            changed = true;
        }
        ResourceGraph.removeResources(template, Satellites.removable(template, permissions, List.of()));
        return changed;
    }
}
