package org.cfnrefactor.graph;

import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Accessors for the standard keys of a resource node.
 */
public final class ResourceNodes {

    public static final String TYPE = "Type";
    public static final String PROPERTIES = "Properties";
    public static final String METADATA = "Metadata";
    public static final String DEPENDS_ON = "DependsOn";
    public static final String CDK_PATH = "aws:cdk:path";

    private ResourceNodes() {}

    public static String type(JsonNode resource) {
        JsonNode type = resource == null ? null : resource.get(TYPE);
        return type != null && type.isTextual() ? type.asText() : "";
    }

    public static boolean isType(JsonNode resource, String type) {
        return type.equals(type(resource));
    }

    public static Optional<ObjectNode> properties(JsonNode resource) {
        JsonNode properties = resource == null ? null : resource.get(PROPERTIES);
        return properties instanceof ObjectNode ? Optional.of((ObjectNode) properties) : Optional.empty();
    }

    public static ObjectNode propertiesOrCreate(ObjectNode resource) {
        JsonNode properties = resource.get(PROPERTIES);
        if (properties instanceof ObjectNode) {
            return (ObjectNode) properties;
        }
        return resource.putObject(PROPERTIES);
    }

    public static Optional<ObjectNode> metadata(JsonNode resource) {
        JsonNode metadata = resource == null ? null : resource.get(METADATA);
        return metadata instanceof ObjectNode ? Optional.of((ObjectNode) metadata) : Optional.empty();
    }

    public static Optional<String> metadataString(JsonNode resource, String key) {
        return metadata(resource)
            .map(m -> m.get(key))
            .filter(JsonNode::isTextual)
            .map(JsonNode::asText);
    }

    public static Optional<String> cdkPath(JsonNode resource) {
        return metadataString(resource, CDK_PATH);
    }

    /**
     * @return the text value of a property, empty when absent or not a string
     */
    public static Optional<String> textProperty(JsonNode properties, String name) {
        JsonNode value = properties == null ? null : properties.get(name);
        return value != null && value.isTextual() ? Optional.of(value.asText()) : Optional.empty();
    }
}
