package org.cfnrefactor.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Mutable view over a template root.
 * <p>
 * A {@code Template} owns its tree exclusively for the duration of a run; passes mutate it in place.
 */
@Slf4j
public class Template {

    public static final String RESOURCES = "Resources";
    public static final String PARAMETERS = "Parameters";
    public static final String CONDITIONS = "Conditions";
    public static final String OUTPUTS = "Outputs";
    public static final String RULES = "Rules";
    public static final String TRANSFORM = "Transform";
    public static final String GLOBALS = "Globals";
    public static final String SAM_TRANSFORM = "AWS::Serverless-2016-10-31";

    private static final List<String> STRIPPABLE_SECTIONS =
        List.of("Parameters", "Conditions", "Rules", "Outputs", "Mappings", "Metadata", "Globals");

    @Getter
    private final ObjectNode root;

    public Template(ObjectNode root) {
        this.root = root;
    }

    public static Template empty() {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.putObject(RESOURCES);
        return new Template(root);
    }

    /**
     * @return the {@code Resources} mapping, created if the template has none
     */
    public ObjectNode resources() {
        return section(RESOURCES);
    }

    /**
     * @return the named top-level mapping, created (and appended) if absent or not a mapping
     */
    public ObjectNode section(String name) {
        JsonNode existing = root.get(name);
        if (existing instanceof ObjectNode) {
            return (ObjectNode) existing;
        }
        return root.putObject(name);
    }

    public Optional<ObjectNode> findSection(String name) {
        JsonNode existing = root.get(name);
        return existing instanceof ObjectNode ? Optional.of((ObjectNode) existing) : Optional.empty();
    }

    public Optional<ObjectNode> resource(String logicalId) {
        JsonNode resources = root.get(RESOURCES);
        if (resources == null) {
            return Optional.empty();
        }
        JsonNode resource = resources.get(logicalId);
        return resource instanceof ObjectNode ? Optional.of((ObjectNode) resource) : Optional.empty();
    }

    public boolean hasResource(String logicalId) {
        return resource(logicalId).isPresent();
    }

    public Optional<String> typeOf(String logicalId) {
        return resource(logicalId).map(ResourceNodes::type).filter(t -> !t.isEmpty());
    }

    /**
     * Snapshot of the resources in declaration order. Mutating the template while iterating the snapshot is safe.
     */
    public Map<String, ObjectNode> resourceEntries() {
        Map<String, ObjectNode> entries = new LinkedHashMap<>();
        JsonNode resources = root.get(RESOURCES);
        if (resources == null || !resources.isObject()) {
            return entries;
        }
        resources.fields().forEachRemaining(e -> {
            if (e.getValue() instanceof ObjectNode) {
                entries.put(e.getKey(), (ObjectNode) e.getValue());
            }
        });
        return entries;
    }

    public List<String> logicalIds() {
        return new ArrayList<>(resourceEntries().keySet());
    }

    /**
     * Make sure {@code Transform} names the SAM transform, keeping any other transforms already declared.
     */
    public void ensureSamTransform() {
        JsonNode existing = root.get(TRANSFORM);
        if (existing == null || existing.isNull()) {
            root.put(TRANSFORM, SAM_TRANSFORM);
        } else if (existing.isArray()) {
            ArrayNode transforms = (ArrayNode) existing;
            for (JsonNode entry : transforms) {
                if (SAM_TRANSFORM.equals(entry.asText())) {
                    return;
                }
            }
            transforms.add(SAM_TRANSFORM);
        } else if (existing.isTextual() && !SAM_TRANSFORM.equals(existing.asText())) {
            ArrayNode transforms = root.arrayNode();
            transforms.add(existing.asText());
            transforms.add(SAM_TRANSFORM);
            root.set(TRANSFORM, transforms);
        }
    }

    public boolean usesSamTransform() {
        JsonNode existing = root.get(TRANSFORM);
        if (existing == null) {
            return false;
        }
        if (existing.isArray()) {
            for (JsonNode entry : existing) {
                if (SAM_TRANSFORM.equals(entry.asText())) {
                    return true;
                }
            }
            return false;
        }
        return SAM_TRANSFORM.equals(existing.asText());
    }

    /**
     * Drop top-level sections that ended up as empty mappings.
     */
    public void stripEmptySections() {
        for (String name : STRIPPABLE_SECTIONS) {
            JsonNode section = root.get(name);
            if (section != null && section.isObject() && section.isEmpty()) {
                log.debug("Removing empty {} section", name);
                root.remove(name);
            }
        }
    }

    public Template deepCopy() {
        return new Template(root.deepCopy());
    }
}
