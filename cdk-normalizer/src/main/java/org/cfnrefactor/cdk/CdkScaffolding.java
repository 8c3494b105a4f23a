package org.cfnrefactor.cdk;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.cfnrefactor.graph.ResourceGraph;
import org.cfnrefactor.graph.ResourceNodes;
import org.cfnrefactor.graph.Template;
import org.cfnrefactor.graph.intrinsic.Intrinsic;
import org.cfnrefactor.graph.intrinsic.Ref;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Removal of the bookkeeping CDK synthesizes next to the real resources.
 */
final class CdkScaffolding {

    static final String CDK_METADATA_TYPE = "AWS::CDK::Metadata";
    static final String CDK_METADATA_CONDITION = "CDKMetadataAvailable";
    static final String ASSET_PARAMETER_PREFIX = "AssetParameters";

    private CdkScaffolding() {}

    static void trimInlineCode(Template template) {
        template.resourceEntries().values().forEach(resource -> {
            if (!ResourceNodes.isType(resource, "AWS::Lambda::Function")) {
                return;
            }
            ResourceNodes.properties(resource)
                .map(properties -> properties.get("Code"))
                .filter(JsonNode::isObject)
                .map(ObjectNode.class::cast)
                .ifPresent(code -> {
                    JsonNode zipFile = code.get("ZipFile");
                    if (zipFile != null && zipFile.isTextual()) {
                        code.put("ZipFile", zipFile.asText().stripTrailing());
                    }
                });
        });
    }

    static List<String> removeMetadataResources(Template template) {
        List<String> ids = new ArrayList<>(ResourceGraph.resourcesOfType(template, CDK_METADATA_TYPE).keySet());
        ResourceGraph.removeResources(template, ids);
        return ids;
    }

    static void removeMetadataCondition(Template template) {
        template.findSection(Template.CONDITIONS).ifPresent(conditions -> conditions.remove(CDK_METADATA_CONDITION));
    }

    static void stripAssetMetadata(Template template, boolean keepPath) {
        template.resourceEntries().values().forEach(resource -> ResourceNodes.metadata(resource).ifPresent(metadata -> {
            List<String> names = new ArrayList<>();
            metadata.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                if (name.startsWith("aws:asset") || name.startsWith("aws:cdk:asset")
                    || (!keepPath && ResourceNodes.CDK_PATH.equals(name))) {
                    metadata.remove(name);
                }
            }
        }));
    }

    /**
     * Drops CDK v1 {@code AssetParameters*} parameters and replaces each {@code Ref} to one with a
     * placeholder string keyed on the parameter's suffix.
     *
     * @return the removed parameter names
     */
    static List<String> replaceAssetParameters(Template template) {
        var parameters = template.findSection(Template.PARAMETERS);
        if (parameters.isEmpty()) {
            return List.of();
        }
        Map<String, String> placeholders = new LinkedHashMap<>();
        parameters.get().fieldNames().forEachRemaining(name -> {
            if (name.startsWith(ASSET_PARAMETER_PREFIX)) {
                placeholders.put(name, placeholder(name));
            }
        });
        if (placeholders.isEmpty()) {
            return List.of();
        }
        parameters.get().remove(placeholders.keySet());
        replaceRefs(template.getRoot(), placeholders);
        return new ArrayList<>(placeholders.keySet());
    }

    static String placeholder(String parameterName) {
        if (parameterName.endsWith("S3Bucket")) {
            return "<asset-bucket>";
        }
        if (parameterName.endsWith("S3VersionKey")) {
            return "<asset-key>";
        }
        if (parameterName.endsWith("ArtifactHash")) {
            return "<asset-hash>";
        }
        return "<asset-param>";
    }

    private static JsonNode replaceRefs(JsonNode node, Map<String, String> placeholders) {
        var intrinsic = Intrinsic.decode(node);
        if (intrinsic.isPresent() && intrinsic.get() instanceof Ref) {
            String placeholder = placeholders.get(((Ref) intrinsic.get()).logicalId());
            return placeholder == null ? node : TextNode.valueOf(placeholder);
        }
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            List<String> names = new ArrayList<>();
            object.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                JsonNode child = object.get(name);
                JsonNode replaced = replaceRefs(child, placeholders);
                if (replaced != child) {
                    object.set(name, replaced);
                }
            }
        } else if (node.isArray()) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                JsonNode child = array.get(i);
                JsonNode replaced = replaceRefs(child, placeholders);
                if (replaced != child) {
                    array.set(i, replaced);
                }
            }
        }
        return node;
    }
}
