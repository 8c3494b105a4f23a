package org.cfnrefactor.sam.optimize;

import org.cfnrefactor.graph.Template;
import org.cfnrefactor.sam.TemplateFixtures;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;

import static org.junit.jupiter.api.Assertions.*;

class StripCdkMetadataPassTest {

    @Test
    void testCdkPathsAndServerlessAssetKeysAreRemoved() {
        Template template = TemplateFixtures.parse("{\"Resources\": {"
            + "\"Fn\": {\"Type\": \"AWS::Serverless::Function\", \"Properties\": {\"CodeUri\": \"src/Fn\"},"
            + "\"Metadata\": {\"aws:cdk:path\": \"Stack/Fn/Resource\", \"aws:asset:path\": \"asset.1\","
            + "\"aws:asset:property\": \"Code\"}},"
            + "\"Bucket\": {\"Type\": \"AWS::S3::Bucket\","
            + "\"Metadata\": {\"aws:cdk:path\": \"Stack/Bucket/Resource\", \"aws:asset:path\": \"asset.2\"}},"
            + "\"Docs\": {\"Type\": \"AWS::S3::Bucket\","
            + "\"Metadata\": {\"aws:cdk:path\": \"Stack/Docs/Resource\", \"cfn_nag\": {\"rules_to_suppress\": []}}}},"
            + "\"Metadata\": {\"aws:cdk:path\": \"Stack\"}}");

        assertTrue(new StripCdkMetadataPass().apply(TemplateFixtures.context(template)));

        assertFalse(template.resource("Fn").orElseThrow().has("Metadata"));
        JsonNode bucket = template.resource("Bucket").orElseThrow().get("Metadata");
        assertEquals("asset.2", bucket.get("aws:asset:path").asText());
        assertFalse(bucket.has("aws:cdk:path"));
        assertTrue(template.resource("Docs").orElseThrow().at("/Metadata/cfn_nag").isObject());
        assertFalse(template.getRoot().get("Metadata").has("aws:cdk:path"));
    }

    @Test
    void testTemplateWithoutCdkMetadataIsUnchanged() {
        Template template = TemplateFixtures.parse("{\"Resources\": {\"Bucket\": {\"Type\": \"AWS::S3::Bucket\"}}}");

        assertFalse(new StripCdkMetadataPass().apply(TemplateFixtures.context(template)));
    }
}
