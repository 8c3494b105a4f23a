package org.cfnrefactor.sam.optimize;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import org.cfnrefactor.graph.ResourceGraph;
import org.cfnrefactor.graph.ResourceNodes;
import org.cfnrefactor.sam.ConversionContext;
import org.cfnrefactor.sam.ConversionPass;
import org.cfnrefactor.sam.S3Code;
import org.cfnrefactor.sam.SamTypes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * {@code AWS::Lambda::LayerVersion} to {@code AWS::Serverless::LayerVersion}, taking the content from
 * the local CDK asset when it exists, else from S3.
 */
@Slf4j
public class LayerVersionPass implements ConversionPass {

    static final String ASSET_PATH = "aws:asset:path";
    static final String ASSET_PROPERTY = "aws:asset:property";

    private static final List<String> COPIED = List.of(
        "Description", "LayerName", "CompatibleRuntimes", "LicenseInfo", "RetentionPolicy",
        "CompatibleArchitectures");
    private static final Set<String> ALLOWED = Set.of(
        "Content", "Description", "LayerName", "CompatibleRuntimes", "LicenseInfo", "RetentionPolicy",
        "CompatibleArchitectures");

    @Override
    public String name() {
        return "layer-versions";
    }

    @Override
    public boolean apply(ConversionContext context) {
        boolean changed = false;
        for (var entry : ResourceGraph.resourcesOfType(context.getTemplate(), SamTypes.LAMBDA_LAYER).entrySet()) {
            if (convert(context, entry.getKey(), entry.getValue())) {
                context.recordConversion(entry.getKey());
                changed = true;
            }
        }
        return changed;
    }

    private boolean convert(ConversionContext context, String logicalId, ObjectNode layer) {
        var properties = ResourceNodes.properties(layer);
        if (properties.isEmpty()) {
            return false;
        }
        JsonNode content = properties.get().get("Content");
        if (content == null || !content.isObject()) {
            return false;
        }
        var names = properties.get().fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!ALLOWED.contains(name)) {
                log.debug("Skipping layer {}: no SAM equivalent for {}", logicalId, name);
                return false;
            }
        }

        JsonNode contentUri = null;
        var assetPath = ResourceNodes.metadataString(layer, ASSET_PATH);
        var assetProperty = ResourceNodes.metadataString(layer, ASSET_PROPERTY);
        if (assetPath.isPresent() && assetProperty.map("Content"::equals).orElse(true)) {
            var located = context.getLocator().locate(assetPath.get());
            if (located.exists()) {
                Path contentPath = context.stager()
                    .map(stager -> stager.stageLocalPath(logicalId, located.path()))
                    .orElse(located.path());
                contentUri = layer.textNode(context.codeUri(contentPath));
            }
        }
        if (contentUri == null && S3Code.isS3Code(content)) {
            contentUri = S3Code.codeUri(context, logicalId, content, true);
        }
        if (contentUri == null) {
            log.debug("Skipping layer {}: content is neither a local asset nor in S3", logicalId);
            return false;
        }

        ObjectNode converted = layer.objectNode();
        converted.set("ContentUri", contentUri);
        for (String key : COPIED) {
            JsonNode value = properties.get().get(key);
            if (value != null) {
                converted.set(key, value);
            }
        }
        layer.put(ResourceNodes.TYPE, SamTypes.LAYER_VERSION);
        layer.set(ResourceNodes.PROPERTIES, converted);
        log.debug("Converted layer {}", logicalId);
        return true;
    }
}
