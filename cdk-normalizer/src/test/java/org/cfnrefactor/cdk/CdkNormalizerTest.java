package org.cfnrefactor.cdk;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.cfnrefactor.graph.Template;
import org.cfnrefactor.graph.TemplateMapper;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;

import static org.junit.jupiter.api.Assertions.*;

class CdkNormalizerTest {

    private final TemplateMapper mapper = new TemplateMapper();

    private Template fixture() throws Exception {
        return mapper.read(Path.of(getClass().getResource("/templates/cdk-function-stack.json").toURI()));
    }

    @Test
    void testReadableModeRenamesAndRemovesScaffolding() throws Exception {
        Template template = fixture();

        NormalizationResult result = new CdkNormalizer(NormalizerOptions.readable()).normalize(template);

        assertSame(template, result.template());
        assertEquals(List.of("HandlerRole", "HandlerPolicy", "Handler", "HandlerLogs", "ItemsQueue", "ItemsQueue2"),
            template.logicalIds());
        assertEquals(Map.of(
            "HandlerServiceRoleFCDC14AE", "HandlerRole",
            "HandlerServiceRoleDefaultPolicyCBD0CC91", "HandlerPolicy",
            "Handler886CB40B", "Handler",
            "HandlerLogGroupA1B2C3D4", "HandlerLogs",
            "ItemsQueueA1A1A1A1", "ItemsQueue",
            "ItemsQueueB2B2B2B2", "ItemsQueue2"), result.renameMap());
        assertEquals(List.of("CDKMetadata"), result.removedResources());

        JsonNode root = template.getRoot();
        assertEquals("HandlerRole", root.at("/Resources/Handler/Properties/Role/Fn::GetAtt/0").asText());
        assertEquals("HandlerRole", root.at("/Resources/HandlerPolicy/Properties/Roles/0/Ref").asText());
        assertEquals("ItemsQueue", root.at("/Resources/HandlerPolicy/Properties/PolicyDocument/Statement/0/Resource/Fn::GetAtt/0").asText());
        assertEquals("ItemsQueue2", root.at("/Resources/Handler/Properties/Environment/Variables/BACKUP_QUEUE_URL/Ref").asText());
        assertEquals("/aws/lambda/${Handler}", root.at("/Resources/HandlerLogs/Properties/LogGroupName/Fn::Sub").asText());
        assertEquals("HandlerPolicy", root.at("/Resources/Handler/DependsOn/0").asText());
        assertEquals("HandlerRole", root.at("/Resources/Handler/DependsOn/1").asText());
        assertEquals("Handler", root.at("/Outputs/FunctionArn/Value/Fn::GetAtt/0").asText());
        assertEquals("HandlerLogs", root.at("/Outputs/LogGroupName/Value/Ref").asText());
    }

    @Test
    void testReadableModeCleansMetadataAndAssetParameters() throws Exception {
        Template template = fixture();

        NormalizationResult result = new CdkNormalizer(NormalizerOptions.readable()).normalize(template);

        JsonNode root = template.getRoot();
        assertFalse(root.at("/Conditions").has("CDKMetadataAvailable"));
        JsonNode metadata = root.at("/Resources/Handler/Metadata");
        assertEquals("Stack/Handler/Resource", metadata.get("aws:cdk:path").asText());
        assertFalse(metadata.has("aws:asset:path"));
        assertFalse(metadata.has("aws:asset:property"));
        assertFalse(metadata.has("aws:asset:is-bundled"));

        assertEquals(List.of("AssetParametersHandlerCodeS3Bucket", "AssetParametersHandlerCodeS3VersionKey",
            "AssetParametersHandlerCodeArtifactHash"), result.removedParameters());
        assertTrue(root.at("/Parameters").has("BootstrapVersion"));
        assertEquals(1, root.at("/Parameters").size());
        assertEquals("<asset-bucket>", root.at("/Resources/Handler/Properties/Code/S3Bucket").asText());
        assertEquals("<asset-key>", root.at("/Resources/Handler/Properties/Code/S3Key/Fn::Join/1/0").asText());
    }

    @Test
    void testSecondRunChangesNothing() throws Exception {
        CdkNormalizer normalizer = new CdkNormalizer(NormalizerOptions.readable());
        Template template = fixture();
        normalizer.normalize(template);
        Template once = template.deepCopy();

        NormalizationResult second = normalizer.normalize(template);

        assertTrue(second.renameMap().isEmpty());
        assertEquals(once.getRoot(), template.getRoot());
    }

    @Test
    void testDeployableModeKeepsIdentity() throws Exception {
        Template template = fixture();
        Template before = template.deepCopy();

        NormalizationResult result = new CdkNormalizer(NormalizerOptions.deployable()).normalize(template);

        assertTrue(result.renameMap().isEmpty());
        assertTrue(result.removedResources().isEmpty());
        assertEquals(before.logicalIds(), template.logicalIds());
        assertEquals(before.getRoot().get("Parameters"), template.getRoot().get("Parameters"));
        assertTrue(template.getRoot().at("/Resources/Handler886CB40B/Metadata").has("aws:asset:path"));
        assertTrue(template.getRoot().at("/Conditions").has("CDKMetadataAvailable"));
    }

    @Test
    void testPathMetadataCanBeDropped() throws Exception {
        Template template = fixture();
        NormalizerOptions options = NormalizerOptions.readable().toBuilder().keepPathMetadata(false).build();

        new CdkNormalizer(options).normalize(template);

        assertFalse(template.getRoot().at("/Resources/Handler/Metadata").has("aws:cdk:path"));
        assertFalse(template.getRoot().at("/Resources/HandlerRole/Metadata").has("aws:cdk:path"));
    }

    @Test
    void testShortHashCollisionStrategy() throws Exception {
        Template template = fixture();
        NormalizerOptions options = NormalizerOptions.readable().toBuilder()
            .collisionStrategy(NormalizerOptions.CollisionStrategy.SHORT_HASH)
            .build();

        NormalizationResult result = new CdkNormalizer(options).normalize(template);

        assertEquals("ItemsQueue", result.renameMap().get("ItemsQueueA1A1A1A1"));
        assertEquals("ItemsQueue73BF", result.renameMap().get("ItemsQueueB2B2B2B2"));
    }

    @Test
    void testHashesKeptWhenStrippingDisabled() throws Exception {
        Template template = fixture();
        NormalizerOptions options = NormalizerOptions.readable().toBuilder()
            .stripHashes(false)
            .semanticNaming(false)
            .build();

        NormalizationResult result = new CdkNormalizer(options).normalize(template);

        assertTrue(result.renameMap().isEmpty());
        assertTrue(template.hasResource("Handler886CB40B"));
        assertFalse(template.hasResource("CDKMetadata"));
    }

    @Test
    void testLookupSuppliesConstructNames() throws Exception {
        Template template = fixture();
        CdkMetadataLookup lookup = CdkMetadataLookup.of(Map.of(
            "ItemsQueueA1A1A1A1", CdkConstructMetadata.builder().constructName("OrdersQueue").build(),
            "ItemsQueueB2B2B2B2", CdkConstructMetadata.fromPath("Stack/Vpc/PrivateSubnet1/Subnet", "AWS::SQS::Queue")));

        NormalizationResult result = new CdkNormalizer(NormalizerOptions.readable(), lookup).normalize(template);

        assertEquals("OrdersQueue", result.renameMap().get("ItemsQueueA1A1A1A1"));
        assertEquals("PrivateSubnet1", result.renameMap().get("ItemsQueueB2B2B2B2"));
        assertEquals("Handler", result.renameMap().get("Handler886CB40B"));
    }

    @Test
    void testInlineCodeTrailingWhitespaceTrimmed() {
        Template template = mapper.read("{\"Resources\": {\"Fn\": {\"Type\": \"AWS::Lambda::Function\","
            + " \"Properties\": {\"Code\": {\"ZipFile\": \"def handler(e, c):\\n  return 1\\n\\n  \"}}}}}");

        new CdkNormalizer(NormalizerOptions.deployable()).normalize(template);

        assertEquals("def handler(e, c):\n  return 1", template.getRoot().at("/Resources/Fn/Properties/Code/ZipFile").asText());
    }

    @Test
    void testResourceNamedLikeParameterGetsSuffix() {
        Template template = mapper.read("{\"Parameters\": {\"Stage\": {\"Type\": \"String\"}},"
            + " \"Resources\": {\"StageC0FFEE00\": {\"Type\": \"AWS::ApiGateway::Stage\"}}}");

        NormalizationResult result = new CdkNormalizer(NormalizerOptions.readable()).normalize(template);

        assertEquals(Map.of("StageC0FFEE00", "Stage2"), result.renameMap());
    }
}
