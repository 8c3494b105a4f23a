package org.cfnrefactor.cdk;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.cfnrefactor.graph.Template;

/**
 * @param template           the normalized template, the same instance that was passed in
 * @param renameMap          old logical id to new logical id, renamed ids only
 * @param removedResources   CDK metadata resources dropped from the template
 * @param removedParameters  legacy asset parameters dropped from the template
 */
public record NormalizationResult(
    Template template,
    Map<String, String> renameMap,
    List<String> removedResources,
    List<String> removedParameters
) {
    public NormalizationResult {
        renameMap = Collections.unmodifiableMap(new LinkedHashMap<>(renameMap));
        removedResources = List.copyOf(removedResources);
        removedParameters = List.copyOf(removedParameters);
    }
}
