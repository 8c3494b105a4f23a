package org.cfnrefactor.graph.intrinsic;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Pure functions for finding logical-id references in template values.
 */
public final class References {

    private static final Pattern SUB_TOKEN = Pattern.compile("\\$\\{([^}]+)}");

    private References() {}

    /**
     * Extract the logical id a value points at.
     * <p>
     * {@code Ref} yields its target, {@code GetAtt} (list or dotted form) yields the base id with the
     * attribute dropped. A bare string is read as an id written literally (the {@code DependsOn} form),
     * so {@code "Queue.Arn"} yields {@code Queue}.
     *
     * @return the id, or empty for values that are neither references nor strings
     */
    public static Optional<String> extractLogicalId(JsonNode node) {
        if (node == null) {
            return Optional.empty();
        }
        if (node.isTextual()) {
            String text = node.asText();
            if (text.isEmpty()) {
                return Optional.empty();
            }
            int dot = text.indexOf('.');
            return Optional.of(dot >= 0 ? text.substring(0, dot) : text);
        }
        return Intrinsic.decode(node).flatMap(References::targetOf);
    }

    /**
     * Like {@link #extractLogicalId(JsonNode)} but only for {@code Ref}/{@code GetAtt} nodes.
     */
    public static Optional<String> extractReferencedId(JsonNode node) {
        return Intrinsic.decode(node).flatMap(References::targetOf);
    }

    private static Optional<String> targetOf(Intrinsic intrinsic) {
        if (intrinsic instanceof Ref) {
            return Optional.of(((Ref) intrinsic).logicalId());
        }
        if (intrinsic instanceof GetAtt) {
            return Optional.of(((GetAtt) intrinsic).logicalId());
        }
        return Optional.empty();
    }

    /**
     * Deep walk deciding whether {@code node} depends on any of {@code targets}.
     * <p>
     * Matches {@code Ref}/{@code GetAtt} targets, {@code Fn::Sub} tokens (unless shadowed by a substitution
     * variable) and literal strings equal to a target or starting with {@code target + "."}.
     * The walk is not memoized; each call visits the whole subtree.
     */
    public static boolean referencesAny(JsonNode node, Collection<String> targets) {
        if (node == null || targets.isEmpty()) {
            return false;
        }
        Set<String> targetSet = targets instanceof Set ? (Set<String>) targets : new LinkedHashSet<>(targets);
        return visitReferences(node, targetSet);
    }

    private static boolean visitReferences(JsonNode node, Set<String> targets) {
        if (node.isTextual()) {
            return literalMatches(node.asText(), targets);
        }
        var intrinsic = Intrinsic.decode(node);
        if (intrinsic.isPresent()) {
            Intrinsic value = intrinsic.get();
            var target = targetOf(value);
            if (target.isPresent()) {
                return targets.contains(target.get());
            }
            if (value instanceof Sub) {
                Sub sub = (Sub) value;
                for (String id : subTokenIds(sub.template())) {
                    if (targets.contains(id) && !sub.declaresVariable(id)) {
                        return true;
                    }
                }
                return sub.variables() != null && visitReferences(sub.variables(), targets);
            }
        }
        if (node.isContainerNode()) {
            for (JsonNode child : node) {
                if (visitReferences(child, targets)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean literalMatches(String text, Set<String> targets) {
        if (targets.contains(text)) {
            return true;
        }
        int dot = text.indexOf('.');
        return dot > 0 && targets.contains(text.substring(0, dot));
    }

    /**
     * Base ids of the {@code ${...}} tokens in a Sub template. Pseudo parameters ({@code ${AWS::Region}})
     * and escaped literals ({@code ${!Name}}) are not ids and are left out.
     */
    public static Set<String> subTokenIds(String template) {
        Set<String> ids = new LinkedHashSet<>();
        Matcher matcher = SUB_TOKEN.matcher(template);
        while (matcher.find()) {
            String token = matcher.group(1);
            if (isRewritableToken(token)) {
                ids.add(baseOf(token));
            }
        }
        return ids;
    }

    /**
     * Substitute every {@code ${Id}} / {@code ${Id.Attr}} whose base id is in {@code renameMap};
     * the attribute suffix is kept and {@code ::} tokens are never touched.
     */
    public static String replaceSubTokens(String template, Map<String, String> renameMap) {
        return replaceSubTokens(template, renameMap, Set.of());
    }

    static String replaceSubTokens(String template, Map<String, String> renameMap, Set<String> shadowed) {
        if (renameMap.isEmpty()) {
            return template;
        }
        return rewriteTokens(template, token -> {
            String base = baseOf(token);
            String renamed = renameMap.get(base);
            if (renamed == null || shadowed.contains(base)) {
                return null;
            }
            return renamed + token.substring(base.length());
        });
    }

    /**
     * Replace whole {@code ${token}} occurrences with literal text (the braces go too).
     * Used when a token's value is known statically, e.g. a stage name.
     */
    public static String inlineSubTokens(String template, Map<String, String> literals) {
        Matcher matcher = SUB_TOKEN.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String literal = literals.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(literal != null ? literal : matcher.group(0)));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String rewriteTokens(String template, UnaryOperator<String> tokenRewrite) {
        Matcher matcher = SUB_TOKEN.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String token = matcher.group(1);
            String replacement = isRewritableToken(token) ? tokenRewrite.apply(token) : null;
            String text = replacement == null ? matcher.group(0) : "${" + replacement + "}";
            matcher.appendReplacement(out, Matcher.quoteReplacement(text));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static boolean isRewritableToken(String token) {
        return !token.contains("::") && !token.startsWith("!");
    }

    private static String baseOf(String token) {
        int dot = token.indexOf('.');
        return dot >= 0 ? token.substring(0, dot) : token;
    }

    /**
     * Linearize a {@code Fn::Join} into one Sub template string.
     * <p>
     * Literal strings and numbers are copied, {@code Ref} becomes {@code ${Id}} and {@code GetAtt}
     * becomes {@code ${Id.Attr}}. Literal <code>${</code> text is escaped as <code>${!</code>.
     *
     * @return the template, or empty if any fragment has another shape
     */
    public static Optional<String> joinToSub(String delimiter, JsonNode fragments) {
        if (fragments == null || !fragments.isArray()) {
            return Optional.empty();
        }
        List<String> parts = new ArrayList<>();
        Iterator<JsonNode> it = fragments.elements();
        while (it.hasNext()) {
            JsonNode fragment = it.next();
            if (fragment.isTextual()) {
                parts.add(fragment.asText().replace("${", "${!"));
                continue;
            }
            if (fragment.isNumber()) {
                parts.add(fragment.asText());
                continue;
            }
            var intrinsic = Intrinsic.decode(fragment);
            if (intrinsic.isPresent() && intrinsic.get() instanceof Ref) {
                parts.add("${" + ((Ref) intrinsic.get()).logicalId() + "}");
            } else if (intrinsic.isPresent() && intrinsic.get() instanceof GetAtt) {
                GetAtt getAtt = (GetAtt) intrinsic.get();
                parts.add("${" + getAtt.logicalId() + "." + getAtt.attribute() + "}");
            } else {
                return Optional.empty();
            }
        }
        return Optional.of(String.join(delimiter == null ? "" : delimiter, parts));
    }
}
