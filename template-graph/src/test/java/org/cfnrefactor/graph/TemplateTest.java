package org.cfnrefactor.graph;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TemplateTest {

    private final TemplateMapper mapper = new TemplateMapper();

    @Test
    void testEnsureSamTransformAddsTransform() {
        Template template = Template.empty();
        template.ensureSamTransform();
        template.ensureSamTransform();

        assertEquals(Template.SAM_TRANSFORM, template.getRoot().get("Transform").asText());
        assertTrue(template.usesSamTransform());
    }

    @Test
    void testEnsureSamTransformKeepsExistingTransforms() {
        Template template = mapper.read("{\"Transform\": \"AWS::LanguageExtensions\", \"Resources\": {}}");
        template.ensureSamTransform();

        assertEquals(2, template.getRoot().get("Transform").size());
        assertEquals("AWS::LanguageExtensions", template.getRoot().at("/Transform/0").asText());
        assertEquals(Template.SAM_TRANSFORM, template.getRoot().at("/Transform/1").asText());

        Template listed = mapper.read("{\"Transform\": [\"AWS::Serverless-2016-10-31\"], \"Resources\": {}}");
        listed.ensureSamTransform();
        assertEquals(1, listed.getRoot().get("Transform").size());
    }

    @Test
    void testStripEmptySections() {
        Template template = mapper.read(
            "{\"Parameters\": {}, \"Conditions\": {\"IsProd\": {\"Fn::Equals\": [\"a\", \"b\"]}}, \"Outputs\": {}, \"Resources\": {}}");
        template.stripEmptySections();

        assertFalse(template.getRoot().has("Parameters"));
        assertFalse(template.getRoot().has("Outputs"));
        assertTrue(template.getRoot().has("Conditions"));
        assertTrue(template.getRoot().has("Resources"));
    }

    @Test
    void testMapperRejectsNonObjectRoots() {
        assertThrows(TemplateMapper.TemplateMappingException.class, () -> mapper.read("[1, 2]"));
        assertThrows(TemplateMapper.TemplateMappingException.class, () -> mapper.read("{not json"));
    }

    @Test
    void testMapperRoundTripKeepsKeyOrder() {
        String json = "{\"Resources\":{\"Zeta\":{\"Type\":\"AWS::SNS::Topic\"},\"Alpha\":{\"Type\":\"AWS::SQS::Queue\"}}}";
        Template template = mapper.read(json);

        assertEquals(java.util.List.of("Zeta", "Alpha"), template.logicalIds());
        assertEquals(template.getRoot(), mapper.read(mapper.write(template)).getRoot());
    }
}
