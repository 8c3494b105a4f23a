package org.cfnrefactor.sam.function;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.cfnrefactor.graph.ResourceGraph;
import org.cfnrefactor.graph.ResourceNodes;
import org.cfnrefactor.graph.Template;
import org.cfnrefactor.sam.ConversionContext;
import org.cfnrefactor.sam.ConversionPass;
import org.cfnrefactor.sam.LambdaPermissions;
import org.cfnrefactor.sam.SamTypes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Folds {@code AWS::Lambda::Url} into the target function's {@code FunctionUrlConfig}.
 * SAM names the generated URL resource {@code <Function>Url}; references to the folded resource are
 * redirected there.
 */
@Slf4j
public class FunctionUrlPass implements ConversionPass {

    private static final List<String> URL_CONFIG_KEYS = List.of("AuthType", "Cors", "InvokeMode");

    @Override
    public String name() {
        return "function-urls";
    }

    @Override
    public boolean apply(ConversionContext context) {
        Template template = context.getTemplate();
        Map<String, String> generatedIds = new LinkedHashMap<>();
        List<String> removals = new ArrayList<>();

        ResourceGraph.resourcesOfType(template, SamTypes.LAMBDA_URL).forEach((urlId, url) -> {
            var properties = ResourceNodes.properties(url);
            if (properties.isEmpty()) {
                return;
            }
            var functionId = context.convertedFunction(properties.get().get("TargetFunctionArn"));
            if (functionId.isEmpty()) {
                return;
            }
            if (url.has("Condition") || properties.get().has("Qualifier")) {
                log.debug("Skipping function URL {}: conditional or qualified", urlId);
                return;
            }
            ObjectNode functionProperties = ResourceNodes.propertiesOrCreate(template.resource(functionId.get()).orElseThrow());
            if (!functionProperties.has("FunctionUrlConfig")) {
                ObjectNode config = functionProperties.objectNode();
                for (String key : URL_CONFIG_KEYS) {
                    JsonNode value = properties.get().get(key);
                    if (value != null) {
                        config.set(key, value);
                    }
                }
                if (config.isEmpty()) {
                    return;
                }
                functionProperties.set("FunctionUrlConfig", config);
            }
            removals.add(urlId);
            removals.addAll(LambdaPermissions.forFunction(template, functionId.get(), FunctionUrlPass::isUrlPermission));
            generatedIds.put(urlId, functionId.get() + "Url");
            log.debug("Folded function URL {} into {}", urlId, functionId.get());
        });

        if (removals.isEmpty()) {
            return false;
        }
        ResourceGraph.removeResources(template, removals);
        context.redirectReferences(generatedIds);
        return true;
    }

    static boolean isUrlPermission(ObjectNode permission) {
        return permission.has("FunctionUrlAuthType") || permission.path("InvokedViaFunctionUrl").asBoolean(false);
    }
}
