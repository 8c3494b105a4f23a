package org.cfnrefactor.sam.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import org.cfnrefactor.graph.ApiResourcePathCache;
import org.cfnrefactor.graph.ResourceGraph;
import org.cfnrefactor.graph.ResourceNodes;
import org.cfnrefactor.graph.Template;
import org.cfnrefactor.graph.intrinsic.References;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Recognises the CORS preflight methods CDK emits for a REST API: {@code OPTIONS} methods with a
 * {@code MOCK} integration answering with static {@code Access-Control-Allow-*} headers.
 */
final class CorsDetector {

    private static final String HEADER_PREFIX = "method.response.header.Access-Control-Allow-";

    private CorsDetector() {}

    /**
     * Methods of one API split into folded preflights and everything else.
     * @param config the SAM {@code Cors} block, empty when the preflights do not agree or no root preflight exists
     */
    record Detection(Optional<ObjectNode> config, List<String> corsMethods, List<String> otherMethods) {
    }

    private record Headers(String origin, String headers, String methods) {
    }

    static Detection detect(Template template, String restApiId, ApiResourcePathCache paths) {
        List<String> corsMethods = new ArrayList<>();
        List<String> otherMethods = new ArrayList<>();
        Headers agreed = null;
        boolean rootPreflight = false;

        for (var entry : ResourceGraph.resourcesOfType(template, ApiMethodPass.METHOD_TYPE).entrySet()) {
            var properties = ResourceNodes.properties(entry.getValue());
            if (properties.isEmpty()
                || !References.extractLogicalId(properties.get().get("RestApiId")).map(restApiId::equals).orElse(false)) {
                continue;
            }
            String method = ResourceNodes.textProperty(properties.get(), "HttpMethod").orElse("").toUpperCase(Locale.ROOT);
            var headers = "OPTIONS".equals(method)
                ? preflightHeaders(properties.get().get("Integration"))
                : Optional.<Headers>empty();
            if (headers.isEmpty()) {
                otherMethods.add(entry.getKey());
                continue;
            }
            if (agreed == null) {
                agreed = headers.get();
            } else if (!agrees(agreed, headers.get())) {
                otherMethods.add(entry.getKey());
                continue;
            } else {
                agreed = merge(agreed, headers.get());
            }
            if (paths.resolveMethodPath(properties.get().get("ResourceId")).map("/"::equals).orElse(false)) {
                rootPreflight = true;
            }
            corsMethods.add(entry.getKey());
        }

        if (corsMethods.isEmpty() || !otherMethods.isEmpty() || !rootPreflight) {
            return new Detection(Optional.empty(), corsMethods, otherMethods);
        }
        ObjectNode config = JsonNodeFactory.instance.objectNode();
        config.put("AllowOrigin", agreed.origin());
        if (agreed.headers() != null) {
            config.put("AllowHeaders", agreed.headers());
        }
        if (agreed.methods() != null) {
            config.put("AllowMethods", agreed.methods());
        }
        return new Detection(Optional.of(config), corsMethods, otherMethods);
    }

    private static Optional<Headers> preflightHeaders(JsonNode integration) {
        if (integration == null || !"MOCK".equalsIgnoreCase(integration.path("Type").asText())) {
            return Optional.empty();
        }
        JsonNode responses = integration.get("IntegrationResponses");
        if (responses == null || !responses.isArray() || responses.isEmpty()) {
            return Optional.empty();
        }
        JsonNode parameters = responses.get(0).get("ResponseParameters");
        if (parameters == null || !parameters.isObject()) {
            return Optional.empty();
        }
        JsonNode origin = parameters.get(HEADER_PREFIX + "Origin");
        JsonNode headers = parameters.get(HEADER_PREFIX + "Headers");
        JsonNode methods = parameters.get(HEADER_PREFIX + "Methods");
        if (origin == null || !origin.isTextual()
            || (headers != null && !headers.isTextual())
            || (methods != null && !methods.isTextual())) {
            return Optional.empty();
        }
        return Optional.of(new Headers(origin.asText(),
            headers == null ? null : headers.asText(),
            methods == null ? null : methods.asText()));
    }

    private static boolean agrees(Headers agreed, Headers candidate) {
        return agreed.origin().equals(candidate.origin())
            && (agreed.headers() == null || candidate.headers() == null || Objects.equals(agreed.headers(), candidate.headers()))
            && (agreed.methods() == null || candidate.methods() == null || Objects.equals(agreed.methods(), candidate.methods()));
    }

    private static Headers merge(Headers agreed, Headers candidate) {
        return new Headers(agreed.origin(),
            agreed.headers() != null ? agreed.headers() : candidate.headers(),
            agreed.methods() != null ? agreed.methods() : candidate.methods());
    }
}
