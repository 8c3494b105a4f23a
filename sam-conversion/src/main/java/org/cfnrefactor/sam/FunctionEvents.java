package org.cfnrefactor.sam;

import org.cfnrefactor.graph.ResourceNodes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Adds entries to a function's {@code Events} map.
 */
public final class FunctionEvents {

    private FunctionEvents() {}

    public static ObjectNode events(ObjectNode function) {
        ObjectNode properties = ResourceNodes.propertiesOrCreate(function);
        JsonNode events = properties.get("Events");
        if (events instanceof ObjectNode) {
            return (ObjectNode) events;
        }
        return properties.putObject("Events");
    }

    /**
     * Add an event under {@code baseName}, or the first free {@code baseName<n>} counting from
     * {@code firstSuffix} when the name is taken.
     * @return the event name used
     */
    public static String add(ObjectNode function, String baseName, int firstSuffix, String type, ObjectNode properties) {
        ObjectNode events = events(function);
        String name = baseName;
        int suffix = firstSuffix;
        while (events.has(name)) {
            name = baseName + suffix++;
        }
        ObjectNode event = events.putObject(name);
        event.put("Type", type);
        event.set("Properties", properties);
        return name;
    }
}
