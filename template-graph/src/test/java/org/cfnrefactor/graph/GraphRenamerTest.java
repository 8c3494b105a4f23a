package org.cfnrefactor.graph;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GraphRenamerTest {

    private final TemplateMapper mapper = new TemplateMapper();

    private Template template() {
        return mapper.read("{\"Resources\": {"
            + "\"MyBucketF68F3FF0\": {\"Type\": \"AWS::S3::Bucket\"},"
            + "\"Policy\": {\"Type\": \"AWS::S3::BucketPolicy\", \"DependsOn\": \"MyBucketF68F3FF0\","
            + "  \"Properties\": {\"Bucket\": {\"Ref\": \"MyBucketF68F3FF0\"}}},"
            + "\"Reader\": {\"Type\": \"AWS::IAM::Role\"}"
            + "}, \"Outputs\": {\"BucketArn\": {\"Value\": {\"Fn::GetAtt\": \"MyBucketF68F3FF0.Arn\"}}}}");
    }

    @Test
    void testRenamesKeysReferencesAndDependsOn() {
        Template template = template();

        GraphRenamer.apply(template, Map.of("MyBucketF68F3FF0", "MyBucket", "Reader", "Reader"));

        assertEquals(List.of("MyBucket", "Policy", "Reader"), template.logicalIds());
        assertEquals("MyBucket", template.getRoot().at("/Resources/Policy/Properties/Bucket/Ref").asText());
        assertEquals("MyBucket", template.getRoot().at("/Resources/Policy/DependsOn").asText());
        assertEquals("MyBucket.Arn", template.getRoot().at("/Outputs/BucketArn/Value/Fn::GetAtt").asText());
    }

    @Test
    void testRejectsCollidingRenamesWithoutTouchingTemplate() {
        Template template = template();
        Template before = template.deepCopy();

        assertThrows(GraphRenamer.InvalidRenameMapException.class,
            () -> GraphRenamer.apply(template, Map.of("MyBucketF68F3FF0", "Reader")));
        assertEquals(before.getRoot(), template.getRoot());
    }

    @Test
    void testSwapIsAllowed() {
        Template template = template();

        GraphRenamer.apply(template, Map.of("Policy", "Reader", "Reader", "Policy"));

        assertEquals("AWS::IAM::Role", template.typeOf("Policy").orElseThrow());
        assertEquals("AWS::S3::BucketPolicy", template.typeOf("Reader").orElseThrow());
    }
}
