package org.cfnrefactor.sam.events;

import org.cfnrefactor.graph.Template;
import org.cfnrefactor.sam.TemplateFixtures;
import org.cfnrefactor.sam.function.LambdaFunctionPass;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static org.junit.jupiter.api.Assertions.*;

class IotRulePassTest {

    @Test
    void testTopicRuleBecomesIotEvent() throws Exception {
        Template template = TemplateFixtures.load("events-stack.json");

        TemplateFixtures.run(template, new LambdaFunctionPass(), new IotRulePass());

        assertFalse(template.hasResource("SensorRule"));
        assertFalse(template.hasResource("SensorRulePermission"));
        JsonNode event = template.resource("Worker").orElseThrow().at("/Properties/Events/SensorRule");
        assertEquals("IoTRule", event.get("Type").asText());
        assertEquals("SELECT * FROM 'sensors/#'", event.at("/Properties/Sql").asText());
        assertFalse(event.at("/Properties/RuleDisabled").asBoolean(true));
    }

    @Test
    void testRuleWithSecondActionIsKept() throws Exception {
        Template template = TemplateFixtures.load("events-stack.json");
        ArrayNode actions = (ArrayNode) template.resource("SensorRule").orElseThrow()
            .at("/Properties/TopicRulePayload/Actions");
        ObjectNode republish = actions.addObject().putObject("Republish");
        republish.put("Topic", "archive/sensors");
        republish.put("RoleArn", "arn:aws:iam::123456789012:role/iot");

        TemplateFixtures.run(template, new LambdaFunctionPass(), new IotRulePass());

        assertTrue(template.hasResource("SensorRule"));
        assertTrue(template.hasResource("SensorRulePermission"));
    }

    @Test
    void testIotPermissionMatching() {
        ObjectNode permission = TemplateFixtures.parse("{\"Resources\": {}}").getRoot().objectNode();
        permission.put("Principal", "iot.amazonaws.com");
        assertTrue(IotRulePass.isIotPermission(permission, "SensorRule"));

        permission.putObject("SourceArn").putArray("Fn::GetAtt").add("OtherRule").add("Arn");
        assertFalse(IotRulePass.isIotPermission(permission, "SensorRule"));

        permission.put("Principal", "events.amazonaws.com");
        permission.putObject("SourceArn").putArray("Fn::GetAtt").add("SensorRule").add("Arn");
        assertFalse(IotRulePass.isIotPermission(permission, "SensorRule"));
    }
}
