package org.cfnrefactor.sam;

import java.util.List;
import java.util.Map;

import org.cfnrefactor.graph.Template;

/**
 * Outcome of one conversion run.
 * @param convertedIds resources whose type was replaced by a SAM type, in conversion order
 * @param renameMap ids that SAM will generate for resources folded into another one
 */
public record ConversionResult(Template template, boolean changed, List<String> convertedIds,
                               Map<String, String> renameMap) {
}
