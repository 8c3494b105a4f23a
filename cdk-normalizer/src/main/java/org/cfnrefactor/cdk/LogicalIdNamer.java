package org.cfnrefactor.cdk;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.cfnrefactor.graph.ResourceNodes;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.RequiredArgsConstructor;

/**
 * Derives the readable base name for one resource. Collisions between base names are resolved
 * afterwards by {@link CollisionResolver}.
 */
@RequiredArgsConstructor
class LogicalIdNamer {

    static final Pattern HASH_SUFFIX = Pattern.compile("[A-F0-9]{8}$");

    private static final List<String> HTTP_METHODS = List.of("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS", "ANY");

    private static final List<Rewrite> GENERATED_SIMPLIFICATIONS = List.of(
        new Rewrite(Pattern.compile("^(.*Subnet\\d+)Subnet$"), "$1"),
        new Rewrite(Pattern.compile("^(.*RouteTable\\d+)RouteTable$"), "$1"),
        new Rewrite(Pattern.compile("^(.*Route\\d+)Route$"), "$1")
    );

    // First match wins.
    private static final List<Rewrite> SEMANTIC_SUFFIXES = List.of(
        new Rewrite(Pattern.compile("^(.+)ServiceRole(?:[A-F0-9]{8})?$"), "$1Role"),
        new Rewrite(Pattern.compile("^(.+)ServiceRoleDefaultPolicy(?:[A-F0-9]{8})?$"), "$1Policy"),
        new Rewrite(Pattern.compile("^(.+)DefaultPolicy(?:[A-F0-9]{8})?$"), "$1Policy"),
        new Rewrite(Pattern.compile("^(.+)LogGroup(?:[A-F0-9]{8})?$"), "$1Logs"),
        new Rewrite(Pattern.compile("^CustomResourceProviderframework(?:[A-F0-9]{8})?$"), "CustomResourceProvider")
    );

    private final NormalizerOptions options;
    private final CdkMetadataLookup lookup;

    String baseName(String logicalId, JsonNode resource) {
        String base = derive(logicalId, resource);
        if (options.isStripHashes()) {
            base = stripHashes(base);
        }
        if (options.isSemanticNaming()) {
            base = applySemantics(base);
        }
        return base;
    }

    private String derive(String logicalId, JsonNode resource) {
        Optional<CdkConstructMetadata> known = lookup.lookup(logicalId)
            .filter(metadata -> metadata.constructName() != null && !metadata.constructName().isEmpty());
        if (known.isPresent()) {
            String constructName = known.get().constructName();
            if (known.get().generated()) {
                constructName = simplifyGenerated(constructName);
            }
            return sanitize(constructName);
        }
        return sanitize(ResourceNodes.cdkPath(resource)
            .flatMap(LogicalIdNamer::nameFromApiPath)
            .orElse(logicalId));
    }

    /**
     * API Gateway proxy resources and invoke permissions carry no useful name of their own;
     * their construct path does.
     */
    static Optional<String> nameFromApiPath(String path) {
        String[] parts = path.split("/");
        for (String part : parts) {
            if (part.contains("Lambda") || part.contains("Function")) {
                return Optional.empty();
            }
        }
        boolean apiPath = false;
        for (String part : parts) {
            if (part.contains("Api")) {
                apiPath = true;
                break;
            }
        }
        if (!apiPath) {
            return Optional.empty();
        }
        String lower = path.toLowerCase();
        if (lower.contains("proxy") && lower.contains("resource")) {
            return Optional.of("ApiGatewayProxyResource");
        }
        boolean permission = false;
        for (String part : parts) {
            if (part.toLowerCase().contains("permission")) {
                permission = true;
                break;
            }
        }
        if (permission) {
            for (String part : parts) {
                if (HTTP_METHODS.contains(part)) {
                    return Optional.of("ApiGateway" + part + "Permission");
                }
            }
        }
        return Optional.empty();
    }

    static String sanitize(String name) {
        StringBuilder cleaned = new StringBuilder();
        name.codePoints()
            .filter(c -> c < 128 && Character.isLetterOrDigit(c))
            .forEach(cleaned::appendCodePoint);
        if (cleaned.length() == 0) {
            return "Resource";
        }
        if (!Character.isLetter(cleaned.charAt(0))) {
            cleaned.insert(0, "Resource");
        }
        return cleaned.toString();
    }

    /** Repeated so {@code FooA1B2C3D4E5F60718} and a second run over the output both settle on {@code Foo}. */
    static String stripHashes(String name) {
        String current = name;
        while (current.length() > 8 && HASH_SUFFIX.matcher(current).find()) {
            current = current.substring(0, current.length() - 8);
        }
        return current;
    }

    static String applySemantics(String name) {
        for (Rewrite rewrite : SEMANTIC_SUFFIXES) {
            Matcher matcher = rewrite.pattern().matcher(name);
            if (matcher.matches()) {
                return matcher.replaceFirst(rewrite.replacement());
            }
        }
        return name;
    }

    static String simplifyGenerated(String name) {
        String current = name;
        for (Rewrite rewrite : GENERATED_SIMPLIFICATIONS) {
            current = rewrite.pattern().matcher(current).replaceFirst(rewrite.replacement());
        }
        return current;
    }

    private record Rewrite(Pattern pattern, String replacement) {}
}
