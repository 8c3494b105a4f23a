package org.cfnrefactor.sam;

import java.util.ArrayList;
import java.util.List;

import org.cfnrefactor.assets.AssetStager;
import org.cfnrefactor.graph.Template;
import org.cfnrefactor.sam.api.ApiMethodPass;
import org.cfnrefactor.sam.api.HttpApiShellPass;
import org.cfnrefactor.sam.api.RestApiShellPass;
import org.cfnrefactor.sam.appsync.AppSyncPass;
import org.cfnrefactor.sam.events.CognitoTriggerPass;
import org.cfnrefactor.sam.events.EventSourceMappingPass;
import org.cfnrefactor.sam.events.EventsRulePass;
import org.cfnrefactor.sam.events.IotRulePass;
import org.cfnrefactor.sam.events.S3NotificationPass;
import org.cfnrefactor.sam.function.FunctionUrlPass;
import org.cfnrefactor.sam.function.LambdaFunctionPass;
import org.cfnrefactor.sam.function.RoleAbsorptionPass;
import org.cfnrefactor.sam.optimize.GlobalsPass;
import org.cfnrefactor.sam.optimize.LayerVersionPass;
import org.cfnrefactor.sam.optimize.SimpleTablePass;
import org.cfnrefactor.sam.optimize.StripCdkMetadataPass;
import org.cfnrefactor.sam.optimize.TemplateFinishingPass;
import org.cfnrefactor.sam.stepfunctions.StateMachinePass;

import lombok.extern.slf4j.Slf4j;

/**
 * Rewrites a plain CloudFormation template into its AWS SAM form.
 * <p>
 * The template is mutated in place by a fixed sequence of {@link ConversionPass passes}. Functions are
 * converted first so that later passes can fold roles, permissions, API methods and event sources into
 * them. Candidates a pass cannot express in SAM are left untouched; invalid input stops the run with a
 * {@link TemplateValidationException}.
 */
@Slf4j
public class SamConverter {

    private final ConversionOptions options;
    private final AssetStager stager;
    private final List<ConversionPass> passes;

    public SamConverter(ConversionOptions options) {
        this(options, null);
    }

    public SamConverter(ConversionOptions options, AssetStager stager) {
        this(options, stager, defaultPasses(options));
    }

    public SamConverter(ConversionOptions options, AssetStager stager, List<ConversionPass> passes) {
        this.options = options;
        this.stager = stager;
        this.passes = List.copyOf(passes);
    }

    public static List<ConversionPass> defaultPasses(ConversionOptions options) {
        List<ConversionPass> passes = new ArrayList<>();
        passes.add(new LambdaFunctionPass());
        passes.add(new RoleAbsorptionPass());
        passes.add(new FunctionUrlPass());
        passes.add(new ApiMethodPass());
        passes.add(new EventSourceMappingPass());
        passes.add(new EventsRulePass());
        passes.add(new S3NotificationPass());
        passes.add(new RestApiShellPass());
        passes.add(new HttpApiShellPass());
        passes.add(new StateMachinePass());
        passes.add(new AppSyncPass());
        if (options.isConvertSimpleTables()) {
            passes.add(new SimpleTablePass());
        }
        passes.add(new LayerVersionPass());
        passes.add(new IotRulePass());
        passes.add(new CognitoTriggerPass());
        if (options.isHoistGlobals()) {
            passes.add(new GlobalsPass());
        }
        if (options.isStripCdkMetadata()) {
            passes.add(new StripCdkMetadataPass());
        }
        passes.add(new TemplateFinishingPass());
        return passes;
    }

    public ConversionResult convert(Template template) {
        ConversionContext context = new ConversionContext(template, options, stager);
        boolean changed = false;
        for (ConversionPass pass : passes) {
            if (pass.apply(context)) {
                log.debug("Pass {} changed the template", pass.name());
                changed = true;
            }
        }
        log.atInfo().setMessage("Converted {} resources to SAM, {} references redirected to generated ids")
            .addArgument(() -> context.getConvertedIds().size())
            .addArgument(() -> context.getRenames().size())
            .log();
        return new ConversionResult(template, changed, context.getConvertedIds(), context.getRenames());
    }
}
