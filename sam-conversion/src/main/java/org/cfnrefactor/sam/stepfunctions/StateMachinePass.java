package org.cfnrefactor.sam.stepfunctions;

import java.util.Map;
import java.util.Optional;

import org.cfnrefactor.graph.ResourceGraph;
import org.cfnrefactor.graph.ResourceNodes;
import org.cfnrefactor.sam.ConversionContext;
import org.cfnrefactor.sam.ConversionPass;
import org.cfnrefactor.sam.SamTypes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * {@code AWS::StepFunctions::StateMachine} to {@code AWS::Serverless::StateMachine}. A state machine whose
 * {@code DefinitionString} cannot be turned into a structured definition is left alone.
 */
@Slf4j
public class StateMachinePass implements ConversionPass {

    static final String STATE_MACHINE_TYPE = "AWS::StepFunctions::StateMachine";

    private static final Map<String, String> RENAMES = Map.of(
        "LoggingConfiguration", "Logging",
        "StateMachineName", "Name",
        "StateMachineType", "Type",
        "RoleArn", "Role",
        "DefinitionS3Location", "DefinitionUri",
        "TracingConfiguration", "Tracing");

    @Override
    public String name() {
        return "state-machines";
    }

    @Override
    public boolean apply(ConversionContext context) {
        boolean changed = false;
        for (var entry : ResourceGraph.resourcesOfType(context.getTemplate(), STATE_MACHINE_TYPE).entrySet()) {
            var converted = convert(entry.getKey(), entry.getValue());
            if (converted.isPresent()) {
                entry.getValue().put(ResourceNodes.TYPE, SamTypes.STATE_MACHINE);
                entry.getValue().set(ResourceNodes.PROPERTIES, converted.get());
                context.recordConversion(entry.getKey());
                log.debug("Converted state machine {}", entry.getKey());
                changed = true;
            }
        }
        return changed;
    }

    static Optional<ObjectNode> convert(String logicalId, ObjectNode resource) {
        var properties = ResourceNodes.properties(resource);
        if (properties.isEmpty()) {
            return Optional.empty();
        }
        JsonNode definition = properties.get().get("Definition");
        JsonNode definitionString = properties.get().get("DefinitionString");
        if (definition == null && definitionString != null) {
            var parsed = DefinitionStrings.toDefinition(definitionString);
            if (parsed.isEmpty()) {
                log.debug("Skipping state machine {}: definition string is not convertible", logicalId);
                return Optional.empty();
            }
            definition = parsed.get();
        }
        var tags = tags(properties.get().get("Tags"));
        if (properties.get().has("Tags") && tags.isEmpty()) {
            log.debug("Skipping state machine {}: tags are not literal key/value pairs", logicalId);
            return Optional.empty();
        }

        ObjectNode converted = resource.objectNode();
        var fields = properties.get().fields();
        while (fields.hasNext()) {
            var field = fields.next();
            String key = field.getKey();
            if ("DefinitionString".equals(key)) {
                converted.set("Definition", definition);
            } else if ("Tags".equals(key)) {
                converted.set("Tags", tags.get());
            } else {
                converted.set(RENAMES.getOrDefault(key, key), field.getValue());
            }
        }
        return Optional.of(converted);
    }

    /**
     * Step Functions tags are a {@code [{Key, Value}]} list; SAM takes a map.
     */
    static Optional<ObjectNode> tags(JsonNode tags) {
        if (tags == null || !tags.isArray()) {
            return Optional.empty();
        }
        ObjectNode map = JsonNodeFactory.instance.objectNode();
        for (JsonNode tag : tags) {
            JsonNode key = tag.get("Key");
            JsonNode value = tag.get("Value");
            if (key == null || !key.isTextual() || value == null) {
                return Optional.empty();
            }
            map.set(key.asText(), value);
        }
        return Optional.of(map);
    }
}
