package org.cfnrefactor.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.cfnrefactor.assets.AssetStager;
import org.cfnrefactor.assets.StagedAsset;
import org.cfnrefactor.cdk.CdkMetadataLookup;
import org.cfnrefactor.cdk.CdkNormalizer;
import org.cfnrefactor.cdk.NormalizationResult;
import org.cfnrefactor.cdk.NormalizerOptions;
import org.cfnrefactor.graph.Template;
import org.cfnrefactor.graph.TemplateMapper;
import org.cfnrefactor.pipeline.sink.TemplateSink;
import org.cfnrefactor.sam.ConversionResult;
import org.cfnrefactor.sam.SamConverter;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs a template through CDK normalization and SAM conversion.
 * <p>
 * The stages know nothing about each other: the normalizer renames ids, the stager is told about the
 * renames so per-resource asset directories follow, and the converter then works on the renamed template.
 * Asset metadata is kept through normalization when converting, since the converter locates local code
 * through it; the converter strips it at the end.
 */
@Slf4j
public class TemplateRefactorPipeline {

    private final PipelineOptions options;
    private final AssetStager stager;
    private final CdkMetadataLookup metadataLookup;
    private final TemplateMapper mapper;

    public TemplateRefactorPipeline(PipelineOptions options, AssetStager stager) {
        this(options, stager, CdkMetadataLookup.none());
    }

    public TemplateRefactorPipeline(PipelineOptions options, AssetStager stager, CdkMetadataLookup metadataLookup) {
        this.options = options;
        this.stager = stager;
        this.metadataLookup = metadataLookup;
        this.mapper = new TemplateMapper();
    }

    /**
     * Refactor {@code template} in place.
     */
    public RefactorResult run(Template template) {
        Map<String, String> renameMap = new LinkedHashMap<>();
        if (options.isNormalize()) {
            NormalizationResult normalized = new CdkNormalizer(normalizerOptions(), metadataLookup).normalize(template);
            renameMap.putAll(normalized.renameMap());
            if (stager != null && !normalized.renameMap().isEmpty()) {
                stager.applyRenameMap(normalized.renameMap());
            }
        }

        List<String> converted = List.of();
        if (options.isSamify()) {
            ConversionResult result = new SamConverter(options.getConversion(), stager).convert(template);
            compose(renameMap, result.renameMap());
            converted = result.convertedIds();
        }

        List<StagedAsset> staged = stager == null ? List.of() : stager.getRecords();
        log.atInfo().setMessage("Refactored template: {} ids renamed, {} resources converted, {} assets staged")
            .addArgument(renameMap.size())
            .addArgument(converted.size())
            .addArgument(staged.size())
            .log();
        return new RefactorResult(template, renameMap, staged, converted);
    }

    /**
     * Read {@code input}, refactor it and hand the result to {@code sink}.
     */
    public RefactorResult run(Path input, TemplateSink sink) throws IOException {
        Template template = mapper.read(input);
        RefactorResult result = run(template);
        sink.write(result.template());
        return result;
    }

    private NormalizerOptions normalizerOptions() {
        NormalizerOptions normalizer = options.getNormalizer() == null
            ? NormalizerOptions.readable()
            : options.getNormalizer();
        if (options.isSamify() && normalizer.isStripAssetMetadata()) {
            return normalizer.toBuilder().stripAssetMetadata(false).build();
        }
        return normalizer;
    }

    /**
     * Chain conversion renames onto the normalizer's so every entry maps an original id to its final id.
     */
    static void compose(Map<String, String> renameMap, Map<String, String> later) {
        Set<String> renamedIds = new HashSet<>(renameMap.values());
        renameMap.replaceAll((from, to) -> later.getOrDefault(to, to));
        later.forEach((from, to) -> {
            if (!renamedIds.contains(from)) {
                renameMap.put(from, to);
            }
        });
    }
}
