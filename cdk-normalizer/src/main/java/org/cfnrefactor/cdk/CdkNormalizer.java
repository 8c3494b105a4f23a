package org.cfnrefactor.cdk;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.cfnrefactor.graph.GraphRenamer;
import org.cfnrefactor.graph.Template;

import lombok.extern.slf4j.Slf4j;

/**
 * Rewrites CDK-synthesized identity into stable readable names.
 * <p>
 * The template is mutated in place. Stages run in a fixed order, each behind its own option:
 * inline code trimming, removal of {@code AWS::CDK::Metadata}, asset metadata stripping, legacy
 * asset parameter cleanup, logical id renaming and finally removal of the {@code CDKMetadataAvailable}
 * condition. Renames are applied through {@link GraphRenamer}, so either every reference moves or
 * nothing does.
 */
@Slf4j
public class CdkNormalizer {

    private final NormalizerOptions options;
    private final LogicalIdNamer namer;
    private final CollisionResolver collisionResolver;

    public CdkNormalizer(NormalizerOptions options) {
        this(options, CdkMetadataLookup.none());
    }

    public CdkNormalizer(NormalizerOptions options, CdkMetadataLookup lookup) {
        this.options = options;
        this.namer = new LogicalIdNamer(options, lookup);
        this.collisionResolver = new CollisionResolver(options.getCollisionStrategy());
    }

    public NormalizationResult normalize(Template template) {
        CdkScaffolding.trimInlineCode(template);

        List<String> removedResources = List.of();
        if (options.isRemoveCdkMetadata()) {
            removedResources = CdkScaffolding.removeMetadataResources(template);
        }
        if (options.isStripAssetMetadata()) {
            CdkScaffolding.stripAssetMetadata(template, options.isKeepPathMetadata());
        }

        List<String> removedParameters = List.of();
        Map<String, String> renameMap = Map.of();
        if (options.isRenameLogicalIds()) {
            if (options.getMode() == NormalizerOptions.Mode.READABLE) {
                removedParameters = CdkScaffolding.replaceAssetParameters(template);
            }
            renameMap = computeRenameMap(template);
            GraphRenamer.apply(template, renameMap);
        }

        if (options.isRemoveCdkMetadata()) {
            CdkScaffolding.removeMetadataCondition(template);
        }
        log.atDebug().setMessage("Normalized template: {} renames, {} metadata resources and {} asset parameters removed")
            .addArgument(renameMap.size())
            .addArgument(removedResources.size())
            .addArgument(removedParameters.size())
            .log();
        return new NormalizationResult(template, renameMap, removedResources, removedParameters);
    }

    Map<String, String> computeRenameMap(Template template) {
        Map<String, String> baseNames = new LinkedHashMap<>();
        template.resourceEntries().forEach((id, resource) -> baseNames.put(id, namer.baseName(id, resource)));

        Set<String> reserved = new HashSet<>();
        template.findSection(Template.PARAMETERS).ifPresent(parameters -> parameters.fieldNames().forEachRemaining(reserved::add));

        Map<String, String> renames = new LinkedHashMap<>();
        collisionResolver.resolve(baseNames, reserved).forEach((from, to) -> {
            if (!from.equals(to)) {
                log.debug("Renaming {} to {}", from, to);
                renames.put(from, to);
            }
        });
        return renames;
    }
}
