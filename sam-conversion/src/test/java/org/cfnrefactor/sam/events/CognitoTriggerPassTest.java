package org.cfnrefactor.sam.events;

import org.cfnrefactor.graph.Template;
import org.cfnrefactor.sam.TemplateFixtures;
import org.cfnrefactor.sam.function.LambdaFunctionPass;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static org.junit.jupiter.api.Assertions.*;

class CognitoTriggerPassTest {

    @Test
    void testTriggerBecomesCognitoEvent() throws Exception {
        Template template = TemplateFixtures.load("events-stack.json");

        TemplateFixtures.run(template, new LambdaFunctionPass(), new CognitoTriggerPass());

        JsonNode pool = template.resource("Pool").orElseThrow();
        assertTrue(pool.at("/Properties/LambdaConfig").isMissingNode());
        assertEquals("users", pool.at("/Properties/UserPoolName").asText());
        assertFalse(template.hasResource("PoolPermission"));

        JsonNode event = template.resource("Worker").orElseThrow().at("/Properties/Events/PoolPreSignUp");
        assertEquals("Cognito", event.get("Type").asText());
        assertEquals("Pool", event.at("/Properties/UserPool/Ref").asText());
        assertEquals("PreSignUp", event.at("/Properties/Trigger").asText());
    }

    @Test
    void testNonFunctionLambdaConfigEntriesStay() throws Exception {
        Template template = TemplateFixtures.load("events-stack.json");
        ObjectNode config = (ObjectNode) template.resource("Pool").orElseThrow().at("/Properties/LambdaConfig");
        config.put("KMSKeyID", "arn:aws:kms:us-east-1:123456789012:key/k");

        TemplateFixtures.run(template, new LambdaFunctionPass(), new CognitoTriggerPass());

        JsonNode remaining = template.resource("Pool").orElseThrow().at("/Properties/LambdaConfig");
        assertEquals(1, remaining.size());
        assertTrue(remaining.has("KMSKeyID"));
    }
}
