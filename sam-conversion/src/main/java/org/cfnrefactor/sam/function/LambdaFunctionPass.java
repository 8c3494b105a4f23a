package org.cfnrefactor.sam.function;

import java.nio.file.Path;
import java.util.Map;

import org.cfnrefactor.assets.AssetLocator;
import org.cfnrefactor.graph.ResourceGraph;
import org.cfnrefactor.graph.ResourceNodes;
import org.cfnrefactor.sam.ConversionContext;
import org.cfnrefactor.sam.ConversionPass;
import org.cfnrefactor.sam.InlineCode;
import org.cfnrefactor.sam.S3Code;
import org.cfnrefactor.sam.SamTypes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * {@code AWS::Lambda::Function} to {@code AWS::Serverless::Function}.
 * <p>
 * {@code Code} is resolved in this order: the local CDK asset named by {@code aws:asset:path}, inline
 * {@code ZipFile} source, an S3 bucket and key, and finally the path of a CDK asset that is missing on disk.
 * A function whose code matches none of these is left untouched.
 */
@Slf4j
public class LambdaFunctionPass implements ConversionPass {

    static final String ASSET_PATH = "aws:asset:path";
    static final String ASSET_PROPERTY = "aws:asset:property";

    @Override
    public String name() {
        return "lambda-functions";
    }

    @Override
    public boolean apply(ConversionContext context) {
        boolean changed = false;
        Map<String, ObjectNode> functions = ResourceGraph.resourcesOfType(context.getTemplate(), SamTypes.LAMBDA_FUNCTION);
        for (Map.Entry<String, ObjectNode> entry : functions.entrySet()) {
            if (convert(context, entry.getKey(), entry.getValue())) {
                context.recordFunction(entry.getKey(), entry.getValue());
                changed = true;
            }
        }
        return changed;
    }

    boolean convert(ConversionContext context, String logicalId, ObjectNode resource) {
        var properties = ResourceNodes.properties(resource);
        if (properties.isEmpty()) {
            log.debug("Skipping {}: no properties", logicalId);
            return false;
        }
        ObjectNode converted = resource.objectNode();
        Path missingAsset = null;
        boolean codeHandled = false;

        var assetPath = ResourceNodes.metadataString(resource, ASSET_PATH);
        var assetProperty = ResourceNodes.metadataString(resource, ASSET_PROPERTY);
        if (assetPath.isPresent() && assetProperty.map("Code"::equals).orElse(true)) {
            AssetLocator.LocatedAsset located = context.getLocator().locate(assetPath.get());
            if (located.exists()) {
                Path codePath = context.stager()
                    .map(stager -> stager.stageLocalPath(logicalId, located.path()))
                    .orElse(located.path());
                converted.put("CodeUri", context.codeUri(codePath));
                codeHandled = true;
            } else {
                missingAsset = located.path();
            }
        }

        JsonNode code = properties.get().get("Code");
        if (!codeHandled && code != null && code.isObject()) {
            JsonNode zipFile = code.get("ZipFile");
            if (zipFile != null && zipFile.isTextual()) {
                String source = InlineCode.prepare(zipFile.asText());
                if (context.getOptions().isPreferExternalAssets() && context.stager().isPresent()) {
                    String fileName = InlineCode.inferFileName(
                        ResourceNodes.textProperty(properties.get(), "Handler").orElse(null),
                        ResourceNodes.textProperty(properties.get(), "Runtime").orElse(null));
                    Path staged = context.stager().get().stageInlineText(logicalId, source, fileName);
                    converted.put("CodeUri", context.codeUri(staged.getParent()));
                } else {
                    converted.put("InlineCode", source);
                }
                codeHandled = true;
            } else if (S3Code.isS3Code(code)) {
                converted.set("CodeUri", S3Code.codeUri(context, logicalId, code, false));
                codeHandled = true;
            }
        }

        if (!codeHandled && missingAsset != null) {
            log.atDebug().setMessage("Asset for {} not found, keeping its path {}")
                .addArgument(logicalId)
                .addArgument(missingAsset)
                .log();
            converted.put("CodeUri", context.codeUri(missingAsset));
            codeHandled = true;
        }
        if (!codeHandled) {
            log.debug("Skipping {}: unsupported Code shape", logicalId);
            return false;
        }

        properties.get().fields().forEachRemaining(field -> {
            if (!"Code".equals(field.getKey())) {
                converted.set(field.getKey(), field.getValue());
            }
        });
        resource.put(ResourceNodes.TYPE, SamTypes.FUNCTION);
        resource.set(ResourceNodes.PROPERTIES, converted);
        log.debug("Converted {} to {}", logicalId, SamTypes.FUNCTION);
        return true;
    }
}
