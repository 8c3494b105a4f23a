package org.cfnrefactor.pipeline;

import java.util.List;
import java.util.Map;

import org.cfnrefactor.assets.StagedAsset;
import org.cfnrefactor.graph.Template;

/**
 * @param renameMap    original logical id to its final id, covering both CDK renames and the ids SAM
 *                     generates for folded resources
 * @param stagedAssets assets copied or downloaded next to the output
 * @param converted    resources whose type was replaced by a SAM type
 */
public record RefactorResult(Template template, Map<String, String> renameMap, List<StagedAsset> stagedAssets,
                             List<String> converted) {
}
