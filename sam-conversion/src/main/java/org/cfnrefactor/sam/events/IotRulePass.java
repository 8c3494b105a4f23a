package org.cfnrefactor.sam.events;

import java.util.ArrayList;
import java.util.List;

import org.cfnrefactor.graph.ResourceGraph;
import org.cfnrefactor.graph.ResourceNodes;
import org.cfnrefactor.graph.Template;
import org.cfnrefactor.sam.ConversionContext;
import org.cfnrefactor.sam.ConversionPass;
import org.cfnrefactor.sam.FunctionEvents;
import org.cfnrefactor.sam.LambdaPermissions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Folds an {@code AWS::IoT::TopicRule} with a single Lambda action into an {@code IoTRule} event.
 */
@Slf4j
public class IotRulePass implements ConversionPass {

    static final String TOPIC_RULE_TYPE = "AWS::IoT::TopicRule";

    private static final String IOT_PRINCIPAL = "iot.amazonaws.com";

    @Override
    public String name() {
        return "iot-rules";
    }

    @Override
    public boolean apply(ConversionContext context) {
        Template template = context.getTemplate();
        List<String> removals = new ArrayList<>();
        ResourceGraph.resourcesOfType(template, TOPIC_RULE_TYPE).forEach((ruleId, rule) -> {
            var properties = ResourceNodes.properties(rule);
            if (properties.isEmpty()) {
                return;
            }
            JsonNode payload = properties.get().get("TopicRulePayload");
            if (payload == null || !payload.isObject()) {
                return;
            }
            JsonNode actions = payload.has("Actions") ? payload.get("Actions") : properties.get().get("Actions");
            if (actions == null || !actions.isArray() || actions.size() != 1 || !actions.get(0).has("Lambda")) {
                return;
            }
            var functionId = context.convertedFunction(actions.get(0).path("Lambda").get("FunctionArn"));
            if (functionId.isEmpty()) {
                return;
            }
            JsonNode sql = payload.get("Sql");
            if (sql == null || sql.isNull() || (sql.isTextual() && sql.asText().isEmpty())) {
                log.debug("Skipping topic rule {}: no SQL statement", ruleId);
                return;
            }
            List<String> permissions = LambdaPermissions.forFunction(template, functionId.get(),
                permission -> isIotPermission(permission, ruleId));
            if (!Satellites.isRemovable(template, ruleId, permissions)
                || Satellites.removable(template, permissions, List.of(ruleId)).size() != permissions.size()) {
                log.debug("Skipping topic rule {}: referenced elsewhere", ruleId);
                return;
            }

            ObjectNode event = JsonNodeFactory.instance.objectNode();
            event.set("Sql", sql);
            for (String key : List.of("Description", "RuleDisabled", "AwsIotSqlVersion")) {
                JsonNode value = payload.get(key);
                if (value != null && !value.isNull()) {
                    event.set(key, value);
                }
            }
            ObjectNode function = template.resource(functionId.get()).orElseThrow();
            String eventName = FunctionEvents.add(function, ruleId, 1, "IoTRule", event);
            log.debug("Folded topic rule {} into {} event {}", ruleId, functionId.get(), eventName);
            removals.add(ruleId);
            removals.addAll(permissions);
        });
        ResourceGraph.removeResources(template, removals);
        return !removals.isEmpty();
    }

    /**
     * IoT permissions either name the rule in their {@code SourceArn} or carry none at all.
     */
    static boolean isIotPermission(ObjectNode permission, String ruleId) {
        return LambdaPermissions.hasPrincipal(permission, IOT_PRINCIPAL)
            && (!permission.has("SourceArn") || LambdaPermissions.sourceArnMentions(permission, ruleId));
    }
}
