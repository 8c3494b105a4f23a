package org.cfnrefactor.sam.api;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.cfnrefactor.graph.ApiResourcePathCache;
import org.cfnrefactor.graph.ResourceGraph;
import org.cfnrefactor.graph.ResourceNodes;
import org.cfnrefactor.graph.Template;
import org.cfnrefactor.graph.intrinsic.References;
import org.cfnrefactor.sam.ConversionContext;
import org.cfnrefactor.sam.ConversionPass;
import org.cfnrefactor.sam.FunctionEvents;
import org.cfnrefactor.sam.FunctionReferences;
import org.cfnrefactor.sam.LambdaPermissions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Folds {@code AWS::ApiGateway::Method} resources with a Lambda proxy integration into {@code Api}
 * events on the integrated function. The invoke permissions API Gateway needed go with the method.
 */
@Slf4j
public class ApiMethodPass implements ConversionPass {

    static final String METHOD_TYPE = "AWS::ApiGateway::Method";

    @Override
    public String name() {
        return "api-methods";
    }

    @Override
    public boolean apply(ConversionContext context) {
        Template template = context.getTemplate();
        ApiResourcePathCache paths = new ApiResourcePathCache(template);
        List<String> removals = new ArrayList<>();
        Map<String, Set<String>> folded = new LinkedHashMap<>();

        ResourceGraph.resourcesOfType(template, METHOD_TYPE).forEach((methodId, method) -> {
            var properties = ResourceNodes.properties(method);
            if (properties.isEmpty()) {
                return;
            }
            JsonNode integration = properties.get().get("Integration");
            if (!isLambdaProxyIntegration(integration)) {
                return;
            }
            var functionId = context.convertedFunction(integrationUri(integration));
            if (functionId.isEmpty()) {
                return;
            }
            var path = paths.resolveMethodPath(properties.get().get("ResourceId"));
            if (path.isEmpty()) {
                log.debug("Skipping method {}: resource path unresolved", methodId);
                return;
            }
            if (!ResourceGraph.blockingReferences(template, List.of(methodId), removals).isEmpty()
                || ResourceGraph.isReferencedOutsideResources(template, List.of(methodId))) {
                log.debug("Skipping method {}: referenced elsewhere", methodId);
                return;
            }
            JsonNode restApiId = properties.get().get("RestApiId");
            String httpMethod = ResourceNodes.textProperty(properties.get(), "HttpMethod")
                .orElse("ANY")
                .toUpperCase(Locale.ROOT);

            ObjectNode eventProperties = method.objectNode();
            if (restApiId != null) {
                eventProperties.set("RestApiId", restApiId);
            }
            eventProperties.put("Path", path.get());
            eventProperties.put("Method", httpMethod);
            ObjectNode function = template.resource(functionId.get()).orElseThrow();
            String eventName = FunctionEvents.add(function, eventName(httpMethod, path.get()), 2, "Api", eventProperties);
            log.debug("Folded method {} into {} event {}", methodId, functionId.get(), eventName);

            removals.add(methodId);
            folded.computeIfAbsent(functionId.get(), k -> new LinkedHashSet<>())
                .add(References.extractLogicalId(restApiId).orElse(null));
        });

        // permissions stay while an unfolded method still invokes the function
        Set<String> stillInvoked = invokedFunctions(template, removals);
        List<String> permissions = new ArrayList<>();
        folded.forEach((functionId, apiIds) -> {
            if (stillInvoked.contains(functionId)) {
                return;
            }
            for (String apiId : apiIds) {
                permissions.addAll(LambdaPermissions.forFunction(template, functionId,
                    permission -> isApiGatewayPermission(permission, apiId)));
            }
        });
        removals.addAll(removablePermissions(template, permissions, removals));
        ResourceGraph.removeResources(template, removals);
        return !removals.isEmpty();
    }

    /**
     * A permission goes only when nothing outside the folded methods and the other candidate
     * permissions references it.
     */
    private static List<String> removablePermissions(Template template, List<String> permissions, List<String> methods) {
        Set<String> ignored = new HashSet<>(methods);
        ignored.addAll(permissions);
        List<String> removable = new ArrayList<>();
        for (String permissionId : permissions) {
            List<String> target = List.of(permissionId);
            if (ResourceGraph.blockingReferences(template, target, ignored).isEmpty()
                && !ResourceGraph.isReferencedOutsideResources(template, target)) {
                removable.add(permissionId);
            } else {
                log.debug("Keeping permission {}: referenced elsewhere", permissionId);
            }
        }
        return removable;
    }

    private static Set<String> invokedFunctions(Template template, List<String> removedMethods) {
        Set<String> invoked = new HashSet<>();
        ResourceGraph.resourcesOfType(template, METHOD_TYPE).forEach((methodId, method) -> {
            if (removedMethods.contains(methodId)) {
                return;
            }
            ResourceNodes.properties(method)
                .map(p -> p.get("Integration"))
                .filter(i -> i != null && i.isObject())
                .map(ApiMethodPass::integrationUri)
                .flatMap(FunctionReferences::targetId)
                .ifPresent(invoked::add);
        });
        return invoked;
    }

    static boolean isLambdaProxyIntegration(JsonNode integration) {
        if (integration == null || !integration.isObject()) {
            return false;
        }
        JsonNode type = integration.get("Type");
        if (type != null && type.isTextual() && !"AWS_PROXY".equalsIgnoreCase(type.asText())) {
            return false;
        }
        return integrationUri(integration) != null;
    }

    static JsonNode integrationUri(JsonNode integration) {
        JsonNode uri = integration.get("Uri");
        return uri != null ? uri : integration.get("IntegrationUri");
    }

    static boolean isApiGatewayPermission(ObjectNode permission, String apiId) {
        if (!LambdaPermissions.hasPrincipal(permission, "apigateway.amazonaws.com")) {
            return false;
        }
        return apiId == null || LambdaPermissions.sourceArnMentions(permission, apiId);
    }

    /**
     * {@code GET /orders/{id}} becomes {@code ApiGetOrdersId}; the root path becomes {@code Root}.
     */
    static String eventName(String httpMethod, String path) {
        StringBuilder name = new StringBuilder("Api").append(capitalize(httpMethod));
        int before = name.length();
        for (String part : path.split("[^A-Za-z0-9]+")) {
            if (!part.isEmpty()) {
                name.append(capitalize(part));
            }
        }
        if (name.length() == before) {
            name.append("Root");
        }
        return name.toString();
    }

    private static String capitalize(String word) {
        return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT);
    }
}
