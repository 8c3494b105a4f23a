package org.cfnrefactor.pipeline;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.cfnrefactor.assets.AwsEnvironment;
import org.cfnrefactor.assets.DirectoryAssetStager;
import org.cfnrefactor.assets.StagedAsset;
import org.cfnrefactor.cdk.NormalizerOptions;
import org.cfnrefactor.graph.Template;
import org.cfnrefactor.graph.TemplateMapper;
import org.cfnrefactor.pipeline.sink.FileTemplateSink;
import org.cfnrefactor.sam.ConversionOptions;
import org.cfnrefactor.sam.SamTypes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;

import static org.junit.jupiter.api.Assertions.*;

class TemplateRefactorPipelineTest {

    @TempDir
    Path tempDir;

    private Path cdkOut;
    private Path input;
    private Path project;

    @BeforeEach
    void setUp() throws Exception {
        cdkOut = Files.createDirectories(tempDir.resolve("cdk.out"));
        Path asset = Files.createDirectories(cdkOut.resolve("asset.7f3a9c"));
        Files.writeString(asset.resolve("index.py"), "def handler(event, context):\n    return event\n");
        input = cdkOut.resolve("Stack.template.json");
        Files.copy(Path.of(getClass().getResource("/templates/cdk-app-stack.json").toURI()), input);
        project = tempDir.resolve("sam-app");
    }

    private DirectoryAssetStager stager() {
        return new DirectoryAssetStager(project, null, AwsEnvironment.of("123456789012", "us-east-1"));
    }

    private PipelineOptions options() {
        return PipelineOptions.builder()
            .conversion(ConversionOptions.builder().assetSearchPaths(List.of(cdkOut.toString())).build())
            .build();
    }

    @Test
    void testCdkStackBecomesSamProject() throws Exception {
        CollectingTemplateSink sink = new CollectingTemplateSink();

        RefactorResult result = new TemplateRefactorPipeline(options(), stager()).run(input, sink);

        assertEquals(1, sink.getWritten().size());
        Template template = sink.getWritten().get(0);
        assertEquals(List.of("Handler", "ItemsQueue"), template.logicalIds());
        assertTrue(template.usesSamTransform());
        JsonNode root = template.getRoot();
        assertFalse(root.has("Parameters"));
        assertFalse(root.has("Conditions"));
        assertFalse(root.has("Rules"));
        assertEquals("Handler", root.at("/Outputs/FunctionName/Value/Ref").asText());

        JsonNode handler = template.resource("Handler").orElseThrow();
        assertEquals(SamTypes.FUNCTION, handler.get("Type").asText());
        assertFalse(handler.has("Metadata"));
        assertFalse(handler.has("DependsOn"));
        assertEquals("src/asset.7f3a9c", handler.at("/Properties/CodeUri").asText());
        assertTrue(Files.exists(project.resolve("src/asset.7f3a9c/index.py")));
        assertEquals("ItemsQueue", handler.at("/Properties/Policies/0/SQSPollerPolicy/QueueName/Fn::GetAtt/0").asText());

        JsonNode event = handler.at("/Properties/Events/HandlerSqsEventSourceStackItemsQueue");
        assertEquals("SQS", event.get("Type").asText());
        assertEquals("ItemsQueue", event.at("/Properties/Queue/Fn::GetAtt/0").asText());
        assertEquals(5, event.at("/Properties/BatchSize").asInt());
        assertFalse(template.resource("ItemsQueue").orElseThrow().has("Metadata"));

        assertEquals("Handler", result.renameMap().get("Handler886CB40B"));
        assertEquals("HandlerRole", result.renameMap().get("HandlerServiceRoleFCDC14AE"));
        assertEquals("ItemsQueue", result.renameMap().get("ItemsQueueA1A1A1A1"));
        assertTrue(result.converted().contains("Handler"));
        assertEquals(1, result.stagedAssets().size());
        StagedAsset staged = result.stagedAssets().get(0);
        assertEquals("Handler", staged.logicalId());
        assertEquals(StagedAsset.Kind.LOCAL_PATH, staged.kind());
    }

    @Test
    void testNormalizeOnlyKeepsResourceTypes() throws Exception {
        Template template = new TemplateMapper().read(input);
        PipelineOptions options = options().toBuilder().samify(false).build();

        RefactorResult result = new TemplateRefactorPipeline(options, null).run(template);

        assertEquals("AWS::Lambda::Function", template.typeOf("Handler").orElseThrow());
        assertFalse(template.getRoot().has("Transform"));
        assertTrue(template.resource("Handler").orElseThrow().at("/Metadata/aws:asset:path").isMissingNode());
        assertTrue(result.converted().isEmpty());
        assertTrue(result.stagedAssets().isEmpty());
    }

    @Test
    void testSamifyWithoutNormalizingKeepsCdkIds() throws Exception {
        Template template = new TemplateMapper().read(input);
        PipelineOptions options = options().toBuilder().normalize(false).build();

        RefactorResult result = new TemplateRefactorPipeline(options, null).run(template);

        assertEquals(SamTypes.FUNCTION, template.typeOf("Handler886CB40B").orElseThrow());
        assertTrue(template.hasResource("CDKMetadata"));
        assertTrue(result.renameMap().isEmpty());
    }

    @Test
    void testResultIsWrittenToFile() throws Exception {
        Path output = project.resolve("template.json");

        new TemplateRefactorPipeline(options(), stager()).run(input, new FileTemplateSink(output));

        Template written = new TemplateMapper().read(output);
        assertEquals(SamTypes.FUNCTION, written.typeOf("Handler").orElseThrow());
    }

    @Test
    void testRenamesChainAcrossStages() {
        Map<String, String> renameMap = new LinkedHashMap<>();
        renameMap.put("HandlerUrlA1B2C3D4", "HandlerUrl1");
        renameMap.put("Handler886CB40B", "Handler");

        TemplateRefactorPipeline.compose(renameMap, Map.of("HandlerUrl1", "HandlerUrl", "ApiKey", "ApiApiKey"));

        assertEquals(Map.of(
            "HandlerUrlA1B2C3D4", "HandlerUrl",
            "Handler886CB40B", "Handler",
            "ApiKey", "ApiApiKey"), renameMap);
    }

    @Test
    void testOptionsAreReadFromJson() throws Exception {
        Path file = tempDir.resolve("options.json");
        Files.writeString(file, "{\"samify\": false, \"normalizer\": {\"mode\": \"DEPLOYABLE\", \"renameLogicalIds\": false},"
            + " \"conversion\": {\"hoistGlobals\": false}, \"unknown\": 1}");

        PipelineOptions options = PipelineOptions.read(file);

        assertTrue(options.isNormalize());
        assertFalse(options.isSamify());
        assertEquals(NormalizerOptions.Mode.DEPLOYABLE, options.getNormalizer().getMode());
        assertFalse(options.getNormalizer().isRenameLogicalIds());
        assertTrue(options.getNormalizer().isStripHashes());
        assertFalse(options.getConversion().isHoistGlobals());
        assertTrue(options.getConversion().isConvertSimpleTables());
    }
}
