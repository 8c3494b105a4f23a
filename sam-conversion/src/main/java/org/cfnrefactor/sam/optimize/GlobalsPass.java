package org.cfnrefactor.sam.optimize;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.cfnrefactor.graph.ResourceGraph;
import org.cfnrefactor.graph.ResourceNodes;
import org.cfnrefactor.graph.Template;
import org.cfnrefactor.sam.ConversionContext;
import org.cfnrefactor.sam.ConversionPass;
import org.cfnrefactor.sam.SamTypes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Moves function properties with the same value on every {@code AWS::Serverless::Function} into
 * {@code Globals.Function}. Needs at least two functions.
 */
@Slf4j
public class GlobalsPass implements ConversionPass {

    static final List<String> HOISTED = List.of("Runtime", "MemorySize", "Timeout");
    private static final String ENVIRONMENT = "Environment";
    private static final String VARIABLES = "Variables";

    @Override
    public String name() {
        return "globals";
    }

    @Override
    public boolean apply(ConversionContext context) {
        Template template = context.getTemplate();
        List<ObjectNode> functions = new ArrayList<>();
        for (ObjectNode function : ResourceGraph.resourcesOfType(template, SamTypes.FUNCTION).values()) {
            var properties = ResourceNodes.properties(function);
            if (properties.isEmpty()) {
                return false;
            }
            functions.add(properties.get());
        }
        if (functions.size() < 2) {
            return false;
        }
        ObjectNode existing = template.findSection(Template.GLOBALS)
            .map(globals -> globals.get("Function"))
            .filter(ObjectNode.class::isInstance)
            .map(ObjectNode.class::cast)
            .orElse(null);

        Map<String, JsonNode> shared = new LinkedHashMap<>();
        for (String key : HOISTED) {
            if (existing != null && existing.has(key)) {
                continue;
            }
            commonValue(functions, key).ifPresent(value -> shared.put(key, value));
        }
        Map<String, JsonNode> sharedVariables = sharedVariables(functions, existing);
        if (shared.isEmpty() && sharedVariables.isEmpty()) {
            return false;
        }

        ObjectNode globalFunction = child(template.section(Template.GLOBALS), "Function");
        shared.forEach((key, value) -> {
            globalFunction.set(key, value.deepCopy());
            functions.forEach(properties -> properties.remove(key));
        });
        if (!sharedVariables.isEmpty()) {
            ObjectNode variables = child(child(globalFunction, ENVIRONMENT), VARIABLES);
            sharedVariables.forEach((name, value) -> variables.set(name, value.deepCopy()));
            functions.forEach(properties -> removeVariables(properties, sharedVariables.keySet()));
        }
        log.debug("Hoisted {} and environment variables {} into Globals", shared.keySet(), sharedVariables.keySet());
        return true;
    }

    private static Optional<JsonNode> commonValue(List<ObjectNode> functions, String key) {
        JsonNode first = functions.get(0).get(key);
        if (first == null) {
            return Optional.empty();
        }
        for (ObjectNode properties : functions) {
            if (!first.equals(properties.get(key))) {
                return Optional.empty();
            }
        }
        return Optional.of(first);
    }

    private static Map<String, JsonNode> sharedVariables(List<ObjectNode> functions, ObjectNode existing) {
        Map<String, JsonNode> shared = new LinkedHashMap<>();
        JsonNode existingVariables = existing == null ? null : existing.path(ENVIRONMENT).path(VARIABLES);
        JsonNode first = functions.get(0).path(ENVIRONMENT).path(VARIABLES);
        if (!first.isObject()) {
            return shared;
        }
        first.fields().forEachRemaining(variable -> {
            if (existingVariables != null && existingVariables.has(variable.getKey())) {
                return;
            }
            for (ObjectNode properties : functions) {
                JsonNode other = properties.path(ENVIRONMENT).path(VARIABLES).get(variable.getKey());
                if (!variable.getValue().equals(other)) {
                    return;
                }
            }
            shared.put(variable.getKey(), variable.getValue());
        });
        return shared;
    }

    private static void removeVariables(ObjectNode properties, Set<String> names) {
        JsonNode environment = properties.get(ENVIRONMENT);
        if (environment == null || !environment.isObject()) {
            return;
        }
        JsonNode variables = environment.get(VARIABLES);
        if (variables instanceof ObjectNode) {
            ((ObjectNode) variables).remove(names);
            if (variables.isEmpty()) {
                ((ObjectNode) environment).remove(VARIABLES);
            }
        }
        if (environment.isEmpty()) {
            properties.remove(ENVIRONMENT);
        }
    }

    private static ObjectNode child(ObjectNode parent, String name) {
        JsonNode existing = parent.get(name);
        return existing instanceof ObjectNode ? (ObjectNode) existing : parent.putObject(name);
    }
}
