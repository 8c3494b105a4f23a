package org.cfnrefactor.sam.api;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.cfnrefactor.graph.ApiResourcePathCache;
import org.cfnrefactor.graph.ResourceGraph;
import org.cfnrefactor.graph.ResourceNodes;
import org.cfnrefactor.graph.Template;
import org.cfnrefactor.graph.intrinsic.Intrinsic;
import org.cfnrefactor.graph.intrinsic.References;
import org.cfnrefactor.sam.ConversionContext;
import org.cfnrefactor.sam.ConversionPass;
import org.cfnrefactor.sam.LambdaPermissions;
import org.cfnrefactor.sam.SamTypes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Collapses an {@code AWS::ApiGateway::RestApi} whose methods were all folded into function events
 * (or are CORS preflights) into {@code AWS::Serverless::Api}, together with its deployment, stage,
 * path resources and invoke permissions. Apis with more than one deployment or stage stay as they are.
 */
@Slf4j
public class RestApiShellPass implements ConversionPass {

    static final String REST_API_TYPE = "AWS::ApiGateway::RestApi";
    static final String DEPLOYMENT_TYPE = "AWS::ApiGateway::Deployment";
    static final String STAGE_TYPE = "AWS::ApiGateway::Stage";

    private static final Set<String> SHELL_TYPES = Set.of(
        DEPLOYMENT_TYPE, STAGE_TYPE, REST_API_TYPE, SamTypes.FUNCTION, SamTypes.API);

    private static final Map<String, String> API_PROPERTIES = apiProperties();

    /** Stage settings SAM accepts on the api itself. */
    private static final List<String> STAGE_PROPERTIES = List.of(
        "MethodSettings", "TracingEnabled", "Variables", "CacheClusterEnabled", "CacheClusterSize",
        "AccessLogSetting", "CanarySetting");

    @Override
    public String name() {
        return "rest-api-shells";
    }

    @Override
    public boolean apply(ConversionContext context) {
        Template template = context.getTemplate();
        boolean changed = false;
        for (Map.Entry<String, ObjectNode> entry : ResourceGraph.resourcesOfType(template, REST_API_TYPE).entrySet()) {
            if (fold(context, entry.getKey(), entry.getValue())) {
                context.recordConversion(entry.getKey());
                changed = true;
            }
        }
        return changed;
    }

    private boolean fold(ConversionContext context, String apiId, ObjectNode api) {
        Template template = context.getTemplate();
        var properties = ResourceNodes.properties(api);
        if (properties.isEmpty()) {
            return false;
        }
        var unsupported = unsupportedProperties(properties.get());
        if (!unsupported.isEmpty()) {
            log.debug("Skipping REST API {}: no SAM equivalent for {}", apiId, unsupported);
            return false;
        }
        var cors = CorsDetector.detect(template, apiId, new ApiResourcePathCache(template));
        if (!cors.otherMethods().isEmpty()) {
            log.debug("Skipping REST API {}: methods {} remain", apiId, cors.otherMethods());
            return false;
        }
        if (!cors.corsMethods().isEmpty() && cors.config().isEmpty()) {
            log.debug("Skipping REST API {}: CORS preflights do not reduce to one configuration", apiId);
            return false;
        }

        List<String> deployments = ownedBy(template, DEPLOYMENT_TYPE, apiId);
        List<String> stages = ownedBy(template, STAGE_TYPE, apiId);
        List<String> children = ownedBy(template, ApiResourcePathCache.API_RESOURCE_TYPE, apiId);
        List<String> permissions = apiPermissions(template, apiId);

        if (deploymentSharedWithOtherApi(template, apiId, deployments)) {
            log.debug("Skipping REST API {}: deployment staged by another API", apiId);
            return false;
        }

        // SAM models one deployment and one stage per api
        if (deployments.size() > 1 || stages.size() != 1) {
            log.debug("Skipping REST API {}: {} deployments and {} stages", apiId, deployments.size(), stages.size());
            return false;
        }
        Optional<ObjectNode> stage = template.resource(stages.get(0)).flatMap(ResourceNodes::properties);
        Optional<String> stageName = stage.flatMap(p -> ResourceNodes.textProperty(p, "StageName"))
            .filter(name -> !name.isEmpty());
        if (stageName.isEmpty()) {
            log.debug("Skipping REST API {}: stage {} has no literal name", apiId, stages.get(0));
            return false;
        }

        Set<String> folded = new LinkedHashSet<>();
        folded.addAll(deployments);
        folded.addAll(stages);
        folded.addAll(cors.corsMethods());
        folded.addAll(children);
        folded.addAll(permissions);
        Set<String> stageIds = new HashSet<>(stages);
        Template inlined = template.deepCopy();
        inlineStageReferences(inlined.getRoot(), stageIds, stageName.get());
        if (isBlocked(inlined, apiId, folded)) {
            log.debug("Skipping REST API {}: deployment or stage referenced elsewhere", apiId);
            return false;
        }
        inlineStageReferences(template.getRoot(), stageIds, stageName.get());

        ObjectNode converted = api.objectNode();
        API_PROPERTIES.forEach((source, target) -> {
            JsonNode value = properties.get().get(source);
            if (value != null) {
                converted.set(target, value);
            }
        });
        stageName.ifPresent(name -> converted.put("StageName", name));
        stage.ifPresent(stageProperties -> {
            for (String key : STAGE_PROPERTIES) {
                JsonNode value = stageProperties.get(key);
                if (value != null && !converted.has(key)) {
                    converted.set(key, value);
                }
            }
        });
        cors.config().ifPresent(config -> converted.set("Cors", config));

        api.put(ResourceNodes.TYPE, SamTypes.API);
        api.set(ResourceNodes.PROPERTIES, converted);
        ResourceGraph.removeResources(template, folded);
        log.debug("Collapsed REST API {} with {} satellite resources", apiId, folded.size());
        return true;
    }

    /**
     * The api itself may be referenced by other shell members and by functions (their {@code Api} events);
     * the folded satellites may only be referenced by each other.
     */
    private static boolean isBlocked(Template template, String apiId, Set<String> folded) {
        Set<String> shell = new HashSet<>(folded);
        template.resourceEntries().forEach((id, resource) -> {
            if (SHELL_TYPES.contains(ResourceNodes.type(resource))) {
                shell.add(id);
            }
        });
        if (!ResourceGraph.blockingReferences(template, List.of(apiId), shell).isEmpty()) {
            return true;
        }
        Set<String> ignored = new HashSet<>(folded);
        ignored.add(apiId);
        return !ResourceGraph.blockingReferences(template, folded, ignored).isEmpty()
            || ResourceGraph.isReferencedOutsideResources(template, folded);
    }

    private static List<String> unsupportedProperties(ObjectNode properties) {
        List<String> unsupported = new ArrayList<>();
        properties.fieldNames().forEachRemaining(name -> {
            if (!API_PROPERTIES.containsKey(name)) {
                unsupported.add(name);
            }
        });
        return unsupported;
    }

    private static Map<String, String> apiProperties() {
        Map<String, String> names = new LinkedHashMap<>();
        for (String same : List.of("Name", "Description", "FailOnWarnings", "EndpointConfiguration",
            "BinaryMediaTypes", "MinimumCompressionSize", "Mode", "ApiKeySourceType", "Policy",
            "DisableExecuteApiEndpoint", "Tags")) {
            names.put(same, same);
        }
        names.put("Body", "DefinitionBody");
        names.put("BodyS3Location", "DefinitionUri");
        return names;
    }

    private static List<String> ownedBy(Template template, String type, String apiId) {
        List<String> owned = new ArrayList<>();
        ResourceGraph.resourcesOfType(template, type).forEach((id, resource) -> {
            boolean matches = ResourceNodes.properties(resource)
                .flatMap(p -> References.extractLogicalId(p.get("RestApiId")))
                .map(apiId::equals)
                .orElse(false);
            if (matches) {
                owned.add(id);
            }
        });
        return owned;
    }

    private static boolean deploymentSharedWithOtherApi(Template template, String apiId, List<String> deployments) {
        for (ObjectNode stage : ResourceGraph.resourcesOfType(template, STAGE_TYPE).values()) {
            var properties = ResourceNodes.properties(stage);
            if (properties.isEmpty()) {
                continue;
            }
            boolean otherApi = !References.extractLogicalId(properties.get().get("RestApiId")).map(apiId::equals).orElse(false);
            boolean ourDeployment = References.extractLogicalId(properties.get().get("DeploymentId"))
                .map(deployments::contains)
                .orElse(false);
            if (otherApi && ourDeployment) {
                return true;
            }
        }
        return false;
    }

    private static List<String> apiPermissions(Template template, String apiId) {
        List<String> permissions = new ArrayList<>();
        ResourceGraph.resourcesOfType(template, SamTypes.LAMBDA_PERMISSION).forEach((id, permission) ->
            ResourceNodes.properties(permission)
                .filter(p -> LambdaPermissions.hasPrincipal(p, "apigateway.amazonaws.com"))
                .filter(p -> sourceArnRefersTo(p.get("SourceArn"), apiId))
                .ifPresent(p -> permissions.add(id)));
        return permissions;
    }

    static boolean sourceArnRefersTo(JsonNode sourceArn, String apiId) {
        if (sourceArn == null) {
            return false;
        }
        if (sourceArn.isTextual()) {
            return sourceArn.asText().contains(apiId);
        }
        return References.referencesAny(sourceArn, List.of(apiId)) || sourceArn.toString().contains(apiId);
    }

    /**
     * Replace {@code ${Stage}} Sub tokens and {@code Ref Stage} Join fragments with the literal stage name.
     */
    static void inlineStageReferences(JsonNode node, Set<String> stageIds, String stageName) {
        if (node == null) {
            return;
        }
        if (node.isArray()) {
            node.forEach(child -> inlineStageReferences(child, stageIds, stageName));
            return;
        }
        if (!node.isObject()) {
            return;
        }
        ObjectNode object = (ObjectNode) node;
        JsonNode sub = object.get(Intrinsic.SUB);
        if (object.size() == 1 && sub != null) {
            if (sub.isTextual()) {
                object.put(Intrinsic.SUB, inlineTokens(sub.asText(), stageIds, stageName));
            } else if (sub.isArray() && sub.size() > 0 && sub.get(0).isTextual()) {
                ((ArrayNode) sub).set(0, TextNode.valueOf(inlineTokens(sub.get(0).asText(), stageIds, stageName)));
                inlineStageReferences(sub.get(1), stageIds, stageName);
            }
            return;
        }
        JsonNode join = object.get(Intrinsic.JOIN);
        if (object.size() == 1 && join != null && join.isArray() && join.size() == 2 && join.get(1).isArray()) {
            ArrayNode fragments = (ArrayNode) join.get(1);
            for (int i = 0; i < fragments.size(); i++) {
                JsonNode fragment = fragments.get(i);
                var ref = References.extractReferencedId(fragment)
                    .filter(id -> fragment.has(Intrinsic.REF) && stageIds.contains(id));
                if (ref.isPresent()) {
                    fragments.set(i, TextNode.valueOf(stageName));
                } else if (fragment.isTextual()) {
                    fragments.set(i, TextNode.valueOf(inlineTokens(fragment.asText(), stageIds, stageName)));
                } else {
                    inlineStageReferences(fragment, stageIds, stageName);
                }
            }
            return;
        }
        object.elements().forEachRemaining(child -> inlineStageReferences(child, stageIds, stageName));
    }

    private static String inlineTokens(String text, Set<String> stageIds, String stageName) {
        String result = text;
        for (String stageId : stageIds) {
            result = result.replace("${" + stageId + "}", stageName);
        }
        return result;
    }
}
