package org.cfnrefactor.graph.intrinsic;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Best-effort rewrite of logical ids embedded inside literal strings.
 * <p>
 * Some synthesized ids are built by concatenating other ids (an AppSync API key is addressed as
 * {@code <ApiId><KeyId>}), and templates then carry those concatenations as plain text, including inside
 * {@code Fn::GetAtt} targets. This rewriter replaces every occurrence of an old id inside any text node in
 * one left-to-right pass, preferring the longest id at each position.
 * <p>
 * It is a heuristic: an id that happens to be a substring of an unrelated string is rewritten too, and an
 * id split across several fragments is missed. Run it only with rename maps whose keys are long,
 * distinctive ids.
 */
@Slf4j
public final class EmbeddedIdRewriter {

    private final Map<String, String> renameMap;
    private final Pattern embeddedIds;

    public EmbeddedIdRewriter(Map<String, String> renameMap) {
        this.renameMap = Map.copyOf(renameMap);
        List<String> ids = new ArrayList<>(renameMap.keySet());
        ids.sort(Comparator.comparingInt(String::length).reversed());
        this.embeddedIds = ids.isEmpty()
            ? null
            : Pattern.compile(ids.stream().map(Pattern::quote).collect(Collectors.joining("|")));
    }

    public JsonNode rewrite(JsonNode node) {
        if (node == null || embeddedIds == null) {
            return node;
        }
        if (node.isTextual()) {
            String text = node.asText();
            String replaced = replaceAll(text);
            return replaced.equals(text) ? node : TextNode.valueOf(replaced);
        }
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            List<String> names = new ArrayList<>();
            object.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                JsonNode child = object.get(name);
                JsonNode rewritten = rewrite(child);
                if (rewritten != child) {
                    object.set(name, rewritten);
                }
            }
        } else if (node.isArray()) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                JsonNode child = array.get(i);
                JsonNode rewritten = rewrite(child);
                if (rewritten != child) {
                    array.set(i, rewritten);
                }
            }
        }
        return node;
    }

    String replaceAll(String text) {
        if (embeddedIds == null) {
            return text;
        }
        // Single pass so a replacement is never matched again by a shorter id
        Matcher matcher = embeddedIds.matcher(text);
        StringBuilder out = new StringBuilder();
        boolean found = false;
        while (matcher.find()) {
            found = true;
            matcher.appendReplacement(out, Matcher.quoteReplacement(renameMap.get(matcher.group())));
        }
        if (!found) {
            return text;
        }
        matcher.appendTail(out);
        log.debug("Rewrote embedded ids in '{}' -> '{}'", text, out);
        return out.toString();
    }
}
