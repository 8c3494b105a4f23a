package org.cfnrefactor.sam.optimize;

import java.util.List;

import org.cfnrefactor.graph.ResourceGraph;
import org.cfnrefactor.graph.ResourceNodes;
import org.cfnrefactor.graph.Template;
import org.cfnrefactor.sam.ConversionContext;
import org.cfnrefactor.sam.ConversionPass;
import org.cfnrefactor.sam.SamTypes;

import lombok.extern.slf4j.Slf4j;

/**
 * Last pass of a run: declares the SAM transform once any serverless resource exists, drops the CDK
 * bootstrap version check and removes sections left empty. Templates without serverless resources are
 * left alone.
 */
@Slf4j
public class TemplateFinishingPass implements ConversionPass {

    static final String BOOTSTRAP_PARAMETER = "BootstrapVersion";
    static final String BOOTSTRAP_RULE = "CheckBootstrapVersion";

    @Override
    public String name() {
        return "finish-template";
    }

    @Override
    public boolean apply(ConversionContext context) {
        Template template = context.getTemplate();
        boolean serverless = template.resourceEntries().values().stream()
            .anyMatch(resource -> ResourceNodes.type(resource).startsWith(SamTypes.SERVERLESS_PREFIX));
        if (!serverless) {
            return false;
        }
        boolean changed = !template.usesSamTransform();
        template.ensureSamTransform();

        var rules = template.findSection(Template.RULES);
        if (rules.isPresent() && rules.get().has(BOOTSTRAP_RULE)) {
            rules.get().remove(BOOTSTRAP_RULE);
            changed = true;
        }
        var parameters = template.findSection(Template.PARAMETERS);
        if (parameters.isPresent() && parameters.get().has(BOOTSTRAP_PARAMETER)
            && !ResourceGraph.isReferencedElsewhere(template, List.of(BOOTSTRAP_PARAMETER), List.of())) {
            parameters.get().remove(BOOTSTRAP_PARAMETER);
            changed = true;
        }
        int before = template.getRoot().size();
        template.stripEmptySections();
        changed |= template.getRoot().size() != before;
        if (changed) {
            log.debug("Finished SAM template");
        }
        return changed;
    }
}
