package org.cfnrefactor.sam.stepfunctions;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.cfnrefactor.graph.intrinsic.GetAtt;
import org.cfnrefactor.graph.intrinsic.Intrinsic;
import org.cfnrefactor.graph.intrinsic.Join;
import org.cfnrefactor.graph.intrinsic.Ref;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns a state machine {@code DefinitionString} into a structured {@code Definition}.
 * <p>
 * A plain JSON string is parsed as is. A {@code Fn::Join} is rendered to JSON text with a placeholder per
 * intrinsic fragment, parsed, and the placeholders are put back: a string that is only a placeholder
 * becomes the original intrinsic, a string that embeds one becomes a {@code Fn::Sub}.
 */
@Slf4j
final class DefinitionStrings {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String PLACEHOLDER_PREFIX = "DefinitionToken";
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{(" + PLACEHOLDER_PREFIX + "\\d+)}");

    private DefinitionStrings() {}

    static Optional<JsonNode> toDefinition(JsonNode definitionString) {
        if (definitionString == null) {
            return Optional.empty();
        }
        if (definitionString.isTextual()) {
            return parse(definitionString.asText()).filter(JsonNode::isContainerNode);
        }
        var intrinsic = Intrinsic.decode(definitionString);
        if (intrinsic.isEmpty() || !(intrinsic.get() instanceof Join)) {
            return Optional.empty();
        }
        Map<String, JsonNode> placeholders = new LinkedHashMap<>();
        var rendered = render((Join) intrinsic.get(), placeholders);
        if (rendered.isEmpty()) {
            return Optional.empty();
        }
        return parse(rendered.get())
            .filter(JsonNode::isContainerNode)
            .map(parsed -> substitute(parsed, placeholders));
    }

    private static Optional<JsonNode> parse(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(MAPPER.readTree(trimmed));
        } catch (JsonProcessingException e) {
            log.debug("Definition is not JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static Optional<String> render(Join join, Map<String, JsonNode> placeholders) {
        String separator = join.delimiter() == null ? "" : join.delimiter();
        StringBuilder text = new StringBuilder();
        ArrayNode fragments = join.fragments();
        for (int i = 0; i < fragments.size(); i++) {
            if (i > 0) {
                text.append(separator);
            }
            JsonNode fragment = fragments.get(i);
            if (fragment.isValueNode() && !fragment.isNull()) {
                text.append(fragment.asText());
            } else {
                String name = PLACEHOLDER_PREFIX + placeholders.size();
                placeholders.put(name, fragment);
                text.append("${").append(name).append('}');
            }
        }
        return Optional.of(text.toString());
    }

    private static JsonNode substitute(JsonNode node, Map<String, JsonNode> placeholders) {
        if (node.isTextual()) {
            return substituteText(node, placeholders);
        }
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            object.fields().forEachRemaining(field -> field.setValue(substitute(field.getValue(), placeholders)));
            return object;
        }
        if (node.isArray()) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                array.set(i, substitute(array.get(i), placeholders));
            }
        }
        return node;
    }

    private static JsonNode substituteText(JsonNode node, Map<String, JsonNode> placeholders) {
        String text = node.asText();
        Matcher matcher = PLACEHOLDER.matcher(text);
        if (!matcher.find()) {
            return node;
        }
        if (matcher.start() == 0 && matcher.end() == text.length()) {
            return placeholders.get(matcher.group(1)).deepCopy();
        }
        matcher.reset();
        ObjectNode variables = JsonNodeFactory.instance.objectNode();
        StringBuilder template = new StringBuilder();
        int last = 0;
        while (matcher.find()) {
            template.append(escapeLiteral(text.substring(last, matcher.start())));
            JsonNode original = placeholders.get(matcher.group(1));
            var inline = inlineToken(original);
            if (inline.isPresent()) {
                template.append(inline.get());
            } else {
                template.append("${").append(matcher.group(1)).append('}');
                variables.set(matcher.group(1), original.deepCopy());
            }
            last = matcher.end();
        }
        template.append(escapeLiteral(text.substring(last)));
        if (variables.isEmpty()) {
            return Intrinsic.wrap(Intrinsic.SUB, JsonNodeFactory.instance.textNode(template.toString()));
        }
        ArrayNode payload = JsonNodeFactory.instance.arrayNode();
        payload.add(template.toString());
        payload.add(variables);
        return Intrinsic.wrap(Intrinsic.SUB, payload);
    }

    /**
     * {@code ${Id}} for a Ref, {@code ${Id.Attribute}} for a GetAtt; empty for anything else.
     */
    private static Optional<String> inlineToken(JsonNode original) {
        var intrinsic = Intrinsic.decode(original);
        if (intrinsic.isPresent() && intrinsic.get() instanceof Ref) {
            return Optional.of("${" + ((Ref) intrinsic.get()).logicalId() + "}");
        }
        if (intrinsic.isPresent() && intrinsic.get() instanceof GetAtt) {
            GetAtt getAtt = (GetAtt) intrinsic.get();
            return Optional.of("${" + getAtt.logicalId() + "." + getAtt.attribute() + "}");
        }
        return Optional.empty();
    }

    // literal "${" inside a Sub must be written "${!"
    private static String escapeLiteral(String text) {
        return text.replace("${", "${!");
    }
}
