package org.cfnrefactor.sam.events;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.cfnrefactor.graph.ResourceGraph;
import org.cfnrefactor.graph.ResourceNodes;
import org.cfnrefactor.graph.Template;
import org.cfnrefactor.sam.ConversionContext;
import org.cfnrefactor.sam.ConversionPass;
import org.cfnrefactor.sam.FunctionEvents;
import org.cfnrefactor.sam.LambdaPermissions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Folds single-target {@code AWS::Events::Rule} resources into {@code EventBridgeRule} (pattern rules)
 * or {@code Schedule} (schedule expressions) events.
 */
@Slf4j
public class EventsRulePass implements ConversionPass {

    static final String RULE_TYPE = "AWS::Events::Rule";

    private static final Set<String> PATTERN_KEYS = Set.of(
        "Name", "Description", "EventBusName", "EventPattern", "State", "Targets");
    private static final Set<String> SCHEDULE_KEYS = Set.of(
        "Name", "Description", "ScheduleExpression", "State", "Targets");
    private static final List<String> PATTERN_TARGET_KEYS = List.of("Input", "InputPath", "DeadLetterConfig", "RetryPolicy");
    private static final List<String> SCHEDULE_TARGET_KEYS = List.of("Input", "DeadLetterConfig", "RetryPolicy");

    @Override
    public String name() {
        return "events-rules";
    }

    @Override
    public boolean apply(ConversionContext context) {
        Template template = context.getTemplate();
        List<String> removals = new ArrayList<>();
        ResourceGraph.resourcesOfType(template, RULE_TYPE).forEach((ruleId, rule) -> {
            var properties = ResourceNodes.properties(rule);
            if (properties.isEmpty()) {
                return;
            }
            JsonNode targets = properties.get().get("Targets");
            if (targets == null || !targets.isArray() || targets.size() != 1 || !targets.get(0).isObject()) {
                return;
            }
            ObjectNode target = (ObjectNode) targets.get(0);
            var functionId = context.convertedFunction(target.get("Arn"));
            if (functionId.isEmpty()) {
                return;
            }
            if (target.has("InputTransformer")) {
                log.debug("Skipping rule {}: input transformers have no event equivalent", ruleId);
                return;
            }
            var event = toEvent(properties.get(), target);
            if (event.isEmpty()) {
                log.debug("Skipping rule {}: unsupported properties", ruleId);
                return;
            }
            List<String> permissions = LambdaPermissions.forFunction(template, functionId.get(),
                permission -> LambdaPermissions.sourceArnMentions(permission, ruleId));
            if (!Satellites.isRemovable(template, ruleId, permissions)
                || Satellites.removable(template, permissions, List.of(ruleId)).size() != permissions.size()) {
                log.debug("Skipping rule {}: referenced elsewhere", ruleId);
                return;
            }
            ObjectNode function = template.resource(functionId.get()).orElseThrow();
            String type = event.get().has("Pattern") ? "EventBridgeRule" : "Schedule";
            String eventName = FunctionEvents.add(function, ruleId, 1, type, event.get());
            log.debug("Folded rule {} into {} event {}", ruleId, functionId.get(), eventName);
            removals.add(ruleId);
            removals.addAll(permissions);
        });
        ResourceGraph.removeResources(template, removals);
        return !removals.isEmpty();
    }

    static Optional<ObjectNode> toEvent(ObjectNode rule, ObjectNode target) {
        ObjectNode event = rule.objectNode();
        if (rule.has("EventPattern")) {
            if (!onlyKeys(rule, PATTERN_KEYS) || !onlyTargetKeys(target, PATTERN_TARGET_KEYS)) {
                return Optional.empty();
            }
            event.set("Pattern", rule.get("EventPattern"));
            copy(rule, "EventBusName", event);
            enabled(rule, event);
            copy(rule, "Description", event);
            if (rule.has("Name")) {
                event.set("RuleName", rule.get("Name"));
            }
            for (String key : PATTERN_TARGET_KEYS) {
                copy(target, key, event);
            }
            return Optional.of(event);
        }
        if (!rule.has("ScheduleExpression") || !onlyKeys(rule, SCHEDULE_KEYS)
            || !onlyTargetKeys(target, SCHEDULE_TARGET_KEYS)) {
            return Optional.empty();
        }
        event.set("Schedule", rule.get("ScheduleExpression"));
        enabled(rule, event);
        copy(rule, "Description", event);
        copy(rule, "Name", event);
        for (String key : SCHEDULE_TARGET_KEYS) {
            copy(target, key, event);
        }
        return Optional.of(event);
    }

    private static void enabled(ObjectNode rule, ObjectNode event) {
        JsonNode state = rule.get("State");
        if (state != null) {
            event.put("Enabled", "ENABLED".equals(state.asText()));
        }
    }

    private static boolean onlyTargetKeys(ObjectNode target, List<String> passed) {
        var names = target.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!"Arn".equals(name) && !"Id".equals(name) && !passed.contains(name)) {
                return false;
            }
        }
        return true;
    }

    private static boolean onlyKeys(ObjectNode node, Set<String> allowed) {
        var names = node.fieldNames();
        while (names.hasNext()) {
            if (!allowed.contains(names.next())) {
                return false;
            }
        }
        return true;
    }

    private static void copy(ObjectNode from, String key, ObjectNode to) {
        JsonNode value = from.get(key);
        if (value != null) {
            to.set(key, value);
        }
    }
}
