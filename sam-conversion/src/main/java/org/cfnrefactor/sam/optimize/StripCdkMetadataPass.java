package org.cfnrefactor.sam.optimize;

import java.util.ArrayList;
import java.util.List;

import org.cfnrefactor.graph.ResourceNodes;
import org.cfnrefactor.graph.Template;
import org.cfnrefactor.sam.ConversionContext;
import org.cfnrefactor.sam.ConversionPass;
import org.cfnrefactor.sam.SamTypes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Removes {@code aws:cdk:path} from every {@code Metadata} mapping, and {@code aws:asset:*} keys from SAM
 * resources whose code now lives in {@code CodeUri}/{@code ContentUri}. Mappings left empty are dropped.
 */
@Slf4j
public class StripCdkMetadataPass implements ConversionPass {

    private static final String ASSET_PREFIX = "aws:asset:";

    @Override
    public String name() {
        return "strip-cdk-metadata";
    }

    @Override
    public boolean apply(ConversionContext context) {
        Template template = context.getTemplate();
        boolean changed = stripPaths(template.getRoot());
        for (var entry : template.resourceEntries().entrySet()) {
            ObjectNode resource = entry.getValue();
            if (ResourceNodes.type(resource).startsWith(SamTypes.SERVERLESS_PREFIX)) {
                changed |= stripAssets(resource);
            }
            JsonNode metadata = resource.get(ResourceNodes.METADATA);
            if (metadata != null && metadata.isObject() && metadata.isEmpty()) {
                resource.remove(ResourceNodes.METADATA);
                changed = true;
            }
        }
        if (changed) {
            log.debug("Stripped CDK metadata");
        }
        return changed;
    }

    private static boolean stripPaths(JsonNode node) {
        boolean changed = false;
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            JsonNode metadata = object.get(ResourceNodes.METADATA);
            if (metadata instanceof ObjectNode && metadata.has(ResourceNodes.CDK_PATH)) {
                ((ObjectNode) metadata).remove(ResourceNodes.CDK_PATH);
                changed = true;
            }
            for (JsonNode child : object) {
                changed |= stripPaths(child);
            }
        } else if (node.isArray()) {
            for (JsonNode child : node) {
                changed |= stripPaths(child);
            }
        }
        return changed;
    }

    private static boolean stripAssets(ObjectNode resource) {
        var metadata = ResourceNodes.metadata(resource);
        if (metadata.isEmpty()) {
            return false;
        }
        List<String> assetKeys = new ArrayList<>();
        metadata.get().fieldNames().forEachRemaining(key -> {
            if (key.startsWith(ASSET_PREFIX)) {
                assetKeys.add(key);
            }
        });
        metadata.get().remove(assetKeys);
        return !assetKeys.isEmpty();
    }
}
