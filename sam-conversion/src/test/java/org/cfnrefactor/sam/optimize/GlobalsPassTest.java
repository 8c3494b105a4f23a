package org.cfnrefactor.sam.optimize;

import org.cfnrefactor.graph.Template;
import org.cfnrefactor.sam.TemplateFixtures;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;

import static org.junit.jupiter.api.Assertions.*;

class GlobalsPassTest {

    private static String function(String runtime, int timeout, String stage) {
        return "{\"Type\": \"AWS::Serverless::Function\", \"Properties\": {"
            + "\"Handler\": \"index.handler\", \"Runtime\": \"" + runtime + "\", \"Timeout\": " + timeout + ","
            + "\"InlineCode\": \"exports.handler = async () => {};\","
            + "\"Environment\": {\"Variables\": {\"STAGE\": \"" + stage + "\", \"LOG_LEVEL\": \"info\"}}}}";
    }

    @Test
    void testSharedValuesMoveToGlobals() {
        Template template = TemplateFixtures.parse("{\"Resources\": {"
            + "\"First\": " + function("nodejs20.x", 30, "prod") + ","
            + "\"Second\": " + function("nodejs20.x", 10, "prod") + "}}");

        assertTrue(new GlobalsPass().apply(TemplateFixtures.context(template)));

        JsonNode globals = template.getRoot().at("/Globals/Function");
        assertEquals("nodejs20.x", globals.get("Runtime").asText());
        assertFalse(globals.has("Timeout"));
        assertEquals("prod", globals.at("/Environment/Variables/STAGE").asText());
        assertEquals("info", globals.at("/Environment/Variables/LOG_LEVEL").asText());

        JsonNode first = template.resource("First").orElseThrow().get("Properties");
        assertFalse(first.has("Runtime"));
        assertFalse(first.has("Environment"));
        assertEquals(30, first.get("Timeout").asInt());
    }

    @Test
    void testDifferingVariableStaysOnFunctions() {
        Template template = TemplateFixtures.parse("{\"Resources\": {"
            + "\"First\": " + function("python3.12", 30, "prod") + ","
            + "\"Second\": " + function("python3.12", 30, "dev") + "}}");

        new GlobalsPass().apply(TemplateFixtures.context(template));

        assertEquals("dev", template.resource("Second").orElseThrow()
            .at("/Properties/Environment/Variables/STAGE").asText());
        assertTrue(template.resource("Second").orElseThrow()
            .at("/Properties/Environment/Variables/LOG_LEVEL").isMissingNode());
        assertEquals(30, template.getRoot().at("/Globals/Function/Timeout").asInt());
    }

    @Test
    void testSingleFunctionIsLeftAlone() {
        Template template = TemplateFixtures.parse("{\"Resources\": {\"Only\": "
            + function("nodejs20.x", 30, "prod") + "}}");

        assertFalse(new GlobalsPass().apply(TemplateFixtures.context(template)));
        assertFalse(template.getRoot().has("Globals"));
    }

    @Test
    void testExistingGlobalsAreNotOverridden() {
        Template template = TemplateFixtures.parse("{\"Globals\": {\"Function\": {\"Runtime\": \"nodejs18.x\"}},"
            + "\"Resources\": {"
            + "\"First\": " + function("nodejs20.x", 30, "prod") + ","
            + "\"Second\": " + function("nodejs20.x", 30, "prod") + "}}");

        new GlobalsPass().apply(TemplateFixtures.context(template));

        assertEquals("nodejs18.x", template.getRoot().at("/Globals/Function/Runtime").asText());
        assertEquals("nodejs20.x", template.resource("First").orElseThrow().at("/Properties/Runtime").asText());
        assertEquals(30, template.getRoot().at("/Globals/Function/Timeout").asInt());
    }
}
