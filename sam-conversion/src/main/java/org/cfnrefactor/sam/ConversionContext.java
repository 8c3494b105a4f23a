package org.cfnrefactor.sam;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.cfnrefactor.assets.AssetLocator;
import org.cfnrefactor.assets.AssetStager;
import org.cfnrefactor.graph.Template;
import org.cfnrefactor.graph.intrinsic.ReferenceRewriter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.Getter;

/**
 * State shared by the passes of one conversion run. A context owns its template exclusively.
 */
public class ConversionContext {

    @Getter
    private final Template template;
    @Getter
    private final ConversionOptions options;
    private final AssetStager stager;
    @Getter
    private final AssetLocator locator;
    private final Path relativeTo;

    private final Map<String, ObjectNode> convertedFunctions = new LinkedHashMap<>();
    private final Set<String> convertedIds = new LinkedHashSet<>();
    private final Map<String, String> renames = new LinkedHashMap<>();

    public ConversionContext(Template template, ConversionOptions options, AssetStager stager) {
        this.template = template;
        this.options = options;
        this.stager = stager;
        List<Path> roots = new ArrayList<>();
        if (options.getAssetSearchPaths() != null) {
            options.getAssetSearchPaths().forEach(p -> roots.add(Path.of(p)));
        }
        this.locator = new AssetLocator(roots);
        this.relativeTo = options.getRelativeTo() == null ? null : Path.of(options.getRelativeTo());
    }

    public Optional<AssetStager> stager() {
        return Optional.ofNullable(stager);
    }

    /**
     * Express a local path as a {@code CodeUri}/{@code ContentUri} value.
     */
    public String codeUri(Path path) {
        if (stager != null) {
            return stager.formatCodeUri(path);
        }
        return AssetLocator.formatPath(path, relativeTo);
    }

    public void recordFunction(String logicalId, ObjectNode resource) {
        convertedFunctions.put(logicalId, resource);
        recordConversion(logicalId);
    }

    public void recordConversion(String logicalId) {
        convertedIds.add(logicalId);
    }

    /**
     * @return the id of a function converted by this run that {@code value} points at
     */
    public Optional<String> convertedFunction(JsonNode value) {
        return FunctionReferences.targetId(value)
            .filter(id -> convertedFunctions.containsKey(id) && template.hasResource(id));
    }

    /**
     * Point every reference at ids SAM will generate in place of resources that were folded away.
     */
    public void redirectReferences(Map<String, String> generatedIds) {
        if (generatedIds.isEmpty()) {
            return;
        }
        ReferenceRewriter rewriter = new ReferenceRewriter(generatedIds);
        rewriter.rewrite(template.getRoot());
        template.resourceEntries().values().forEach(rewriter::rewriteDependsOn);
        renames.putAll(generatedIds);
    }

    /**
     * @return functions converted by this run, in conversion order
     */
    public Map<String, ObjectNode> getConvertedFunctions() {
        return Collections.unmodifiableMap(convertedFunctions);
    }

    public List<String> getConvertedIds() {
        return List.copyOf(convertedIds);
    }

    public Map<String, String> getRenames() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(renames));
    }
}
