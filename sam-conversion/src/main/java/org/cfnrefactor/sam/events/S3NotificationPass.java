package org.cfnrefactor.sam.events;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Moves the Lambda entries of a bucket's {@code NotificationConfiguration} onto the notified functions
 * as {@code S3} events. The bucket stays; only its notification entries and invoke permissions go.
 */
@Slf4j
public class S3NotificationPass implements ConversionPass {

    static final String BUCKET_TYPE = "AWS::S3::Bucket";

    private static final String S3_PRINCIPAL = "s3.amazonaws.com";

    @Override
    public String name() {
        return "s3-notifications";
    }

    @Override
    public boolean apply(ConversionContext context) {
        Template template = context.getTemplate();
        Set<String> permissions = new LinkedHashSet<>();
        boolean changed = false;

        for (var entry : ResourceGraph.resourcesOfType(template, BUCKET_TYPE).entrySet()) {
            String bucketId = entry.getKey();
            var properties = ResourceNodes.properties(entry.getValue());
            JsonNode notifications = properties.map(p -> p.get("NotificationConfiguration")).orElse(null);
            if (notifications == null || !notifications.isObject()) {
                continue;
            }
            JsonNode configs = notifications.get("LambdaConfigurations");
            if (configs == null || !configs.isArray()) {
                continue;
            }
            int count = configs.size();
            List<Integer> folded = new ArrayList<>();
            for (int index = 0; index < count; index++) {
                JsonNode config = configs.get(index);
                if (!config.isObject()) {
                    continue;
                }
                var functionId = context.convertedFunction(config.get("Function"));
                if (functionId.isEmpty()) {
                    continue;
                }
                ObjectNode event = toEvent(bucketId, (ObjectNode) config);
                if (event == null) {
                    log.debug("Skipping notification {} of bucket {}: no events", index, bucketId);
                    continue;
                }
                ObjectNode function = template.resource(functionId.get()).orElseThrow();
                String baseName = count == 1 ? bucketId : bucketId + index;
                String eventName = FunctionEvents.add(function, baseName, 1, "S3", event);
                log.debug("Folded notification {} of bucket {} into {} event {}", index, bucketId, functionId.get(),
                    eventName);
                folded.add(index);
                permissions.addAll(LambdaPermissions.forFunction(template, functionId.get(),
                    permission -> isBucketPermission(permission, bucketId)));
            }
            if (!folded.isEmpty()) {
                removeEntries(properties.get(), (ObjectNode) notifications, (ArrayNode) configs, folded);
                changed = true;
            }
        }
        ResourceGraph.removeResources(template, Satellites.removable(template, permissions, List.of()));
        return changed;
    }

    static boolean isBucketPermission(ObjectNode permission, String bucketId) {
        JsonNode principal = permission.get("Principal");
        if (principal != null && principal.isTextual() && !S3_PRINCIPAL.equals(principal.asText())) {
            return false;
        }
        return LambdaPermissions.sourceArnMentions(permission, bucketId);
    }

    static ObjectNode toEvent(String bucketId, ObjectNode config) {
        JsonNode events = config.get("Event");
        if (events == null || events.isNull()) {
            events = config.get("Events");
        }
        if (events == null || events.isNull() || (events.isArray() && events.isEmpty())) {
            return null;
        }
        ObjectNode properties = config.objectNode();
        properties.set("Bucket", Ref.to(bucketId));
        if (events.isArray()) {
            properties.set("Events", events);
        } else {
            properties.putArray("Events").add(events);
        }
        ArrayNode rules = filterRules(config.get("Filter"));
        if (!rules.isEmpty()) {
            properties.putObject("Filter").putObject("S3Key").set("Rules", rules);
        }
        return properties;
    }

    private static ArrayNode filterRules(JsonNode filter) {
        ArrayNode rules = JsonNodeFactory.instance.arrayNode();
        JsonNode source = filter == null ? null : filter.path("S3Key").get("Rules");
        if (source == null || !source.isArray()) {
            return rules;
        }
        for (JsonNode rule : source) {
            String name = rule.path("Name").asText("");
            JsonNode value = rule.get("Value");
            if (("prefix".equals(name) || "suffix".equals(name)) && value != null && !value.isNull()) {
                ObjectNode normalized = rules.addObject();
                normalized.put("Name", name);
                normalized.set("Value", value);
            }
        }
        return rules;
    }

    private static void removeEntries(ObjectNode properties, ObjectNode notifications, ArrayNode configs,
                                      List<Integer> folded) {
        for (int i = folded.size() - 1; i >= 0; i--) {
            configs.remove(folded.get(i));
        }
        if (configs.isEmpty()) {
            notifications.remove("LambdaConfigurations");
        }
        if (notifications.isEmpty()) {
            properties.remove("NotificationConfiguration");
        }
    }
}
