package org.cfnrefactor.sam.api;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.cfnrefactor.graph.ResourceGraph;
import org.cfnrefactor.graph.ResourceNodes;
import org.cfnrefactor.graph.Template;
import org.cfnrefactor.graph.intrinsic.References;
import org.cfnrefactor.sam.ConversionContext;
import org.cfnrefactor.sam.ConversionPass;
import org.cfnrefactor.sam.SamTypes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Collapses an HTTP {@code AWS::ApiGatewayV2::Api} without routes into {@code AWS::Serverless::HttpApi},
 * absorbing its integrations and stages. WebSocket APIs are left alone.
 */
@Slf4j
public class HttpApiShellPass implements ConversionPass {

    static final String API_TYPE = "AWS::ApiGatewayV2::Api";
    static final String INTEGRATION_TYPE = "AWS::ApiGatewayV2::Integration";
    static final String ROUTE_TYPE = "AWS::ApiGatewayV2::Route";
    static final String STAGE_TYPE = "AWS::ApiGatewayV2::Stage";
    static final String DEFAULT_STAGE = "$default";

    private static final Set<String> SHELL_TYPES = Set.of(API_TYPE, INTEGRATION_TYPE, ROUTE_TYPE, STAGE_TYPE);

    private static final Map<String, String> PROPERTY_NAMES = propertyNames();

    @Override
    public String name() {
        return "http-api-shells";
    }

    @Override
    public boolean apply(ConversionContext context) {
        Template template = context.getTemplate();
        boolean changed = false;
        for (Map.Entry<String, ObjectNode> entry : ResourceGraph.resourcesOfType(template, API_TYPE).entrySet()) {
            if (fold(template, entry.getKey(), entry.getValue())) {
                context.recordConversion(entry.getKey());
                changed = true;
            }
        }
        return changed;
    }

    private boolean fold(Template template, String apiId, ObjectNode api) {
        var properties = ResourceNodes.properties(api);
        if (properties.isEmpty()) {
            return false;
        }
        String protocol = ResourceNodes.textProperty(properties.get(), "ProtocolType").orElse("HTTP");
        if (!"HTTP".equals(protocol)) {
            log.debug("Skipping {} API {}", protocol, apiId);
            return false;
        }
        List<String> unsupported = new ArrayList<>();
        properties.get().fieldNames().forEachRemaining(key -> {
            if (!PROPERTY_NAMES.containsKey(key) && !"ProtocolType".equals(key)) {
                unsupported.add(key);
            }
        });
        if (!unsupported.isEmpty()) {
            log.debug("Skipping HTTP API {}: no SAM equivalent for {}", apiId, unsupported);
            return false;
        }
        if (!ownedBy(template, ROUTE_TYPE, apiId).isEmpty()) {
            log.debug("Skipping HTTP API {}: routes remain", apiId);
            return false;
        }
        List<String> satellites = new ArrayList<>(ownedBy(template, INTEGRATION_TYPE, apiId));
        List<String> stages = ownedBy(template, STAGE_TYPE, apiId);
        satellites.addAll(stages);

        List<String> targets = new ArrayList<>(satellites);
        targets.add(apiId);
        Set<String> shell = new HashSet<>();
        template.resourceEntries().forEach((id, resource) -> {
            if (SHELL_TYPES.contains(ResourceNodes.type(resource))) {
                shell.add(id);
            }
        });
        if (!ResourceGraph.blockingReferences(template, targets, shell).isEmpty()
            || ResourceGraph.isReferencedOutsideResources(template, satellites)) {
            log.debug("Skipping HTTP API {}: referenced elsewhere", apiId);
            return false;
        }

        ObjectNode converted = api.objectNode();
        PROPERTY_NAMES.forEach((source, target) -> {
            JsonNode value = properties.get().get(source);
            if (value != null) {
                converted.set(target, value);
            }
        });
        for (String stageId : stages) {
            template.resource(stageId)
                .flatMap(ResourceNodes::properties)
                .flatMap(p -> ResourceNodes.textProperty(p, "StageName"))
                .filter(name -> !DEFAULT_STAGE.equals(name) && !converted.has("StageName"))
                .ifPresent(name -> converted.put("StageName", name));
        }

        api.put(ResourceNodes.TYPE, SamTypes.HTTP_API);
        api.set(ResourceNodes.PROPERTIES, converted);
        ResourceGraph.removeResources(template, satellites);
        log.debug("Collapsed HTTP API {}", apiId);
        return true;
    }

    private static List<String> ownedBy(Template template, String type, String apiId) {
        List<String> owned = new ArrayList<>();
        ResourceGraph.resourcesOfType(template, type).forEach((id, resource) -> {
            boolean matches = ResourceNodes.properties(resource)
                .flatMap(p -> References.extractLogicalId(p.get("ApiId")))
                .map(apiId::equals)
                .orElse(false);
            if (matches) {
                owned.add(id);
            }
        });
        return owned;
    }

    private static Map<String, String> propertyNames() {
        Map<String, String> names = new LinkedHashMap<>();
        for (String same : List.of("Name", "Description", "FailOnWarnings", "CorsConfiguration",
            "DefaultRouteSettings", "RouteSettings", "StageVariables", "Tags", "PropagateTags",
            "DisableExecuteApiEndpoint")) {
            names.put(same, same);
        }
        names.put("Body", "DefinitionBody");
        names.put("BodyS3Location", "DefinitionUri");
        return names;
    }
}
