package org.cfnrefactor.sam.events;

import org.cfnrefactor.graph.ResourceNodes;
import org.cfnrefactor.graph.Template;
import org.cfnrefactor.sam.TemplateFixtures;
import org.cfnrefactor.sam.function.LambdaFunctionPass;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static org.junit.jupiter.api.Assertions.*;

class EventsRulePassTest {

    private Template template;

    @BeforeEach
    void setUp() throws Exception {
        template = TemplateFixtures.load("events-stack.json");
    }

    @Test
    void testScheduleRuleBecomesScheduleEvent() {
        TemplateFixtures.run(template, new LambdaFunctionPass(), new EventsRulePass());

        assertFalse(template.hasResource("NightlyRule"));
        assertFalse(template.hasResource("NightlyRulePermission"));
        JsonNode event = events().get("NightlyRule");
        assertEquals("Schedule", event.get("Type").asText());
        assertEquals("rate(1 day)", event.at("/Properties/Schedule").asText());
        assertTrue(event.at("/Properties/Enabled").asBoolean());
        assertEquals("{\"mode\":\"full\"}", event.at("/Properties/Input").asText());
    }

    @Test
    void testPatternRuleBecomesEventBridgeRule() {
        ResourceNodes.propertiesOrCreate(template.resource("OrdersRule").orElseThrow()).put("Name", "orders-placed");

        TemplateFixtures.run(template, new LambdaFunctionPass(), new EventsRulePass());

        assertFalse(template.hasResource("OrdersRule"));
        assertFalse(template.hasResource("OrdersRulePermission"));
        JsonNode event = events().get("OrdersRule");
        assertEquals("EventBridgeRule", event.get("Type").asText());
        assertEquals("orders", event.at("/Properties/Pattern/source/0").asText());
        assertEquals("orders-bus", event.at("/Properties/EventBusName").asText());
        assertEquals("orders-placed", event.at("/Properties/RuleName").asText());
        assertFalse(event.at("/Properties/Enabled").asBoolean(true));
        assertFalse(event.get("Properties").has("Name"));
    }

    @Test
    void testInputTransformerSkipsRule() {
        ObjectNode target = (ObjectNode) template.resource("NightlyRule").orElseThrow().at("/Properties/Targets/0");
        target.remove("Input");
        target.putObject("InputTransformer").put("InputTemplate", "\"<time>\"");

        TemplateFixtures.run(template, new LambdaFunctionPass(), new EventsRulePass());

        assertTrue(template.hasResource("NightlyRule"));
        assertTrue(template.hasResource("NightlyRulePermission"));
        assertFalse(events().has("NightlyRule"));
    }

    @Test
    void testRuleWithReferencedPermissionIsKept() {
        template.section(Template.OUTPUTS).putObject("Grant").putObject("Value").put("Ref", "OrdersRulePermission");

        TemplateFixtures.run(template, new LambdaFunctionPass(), new EventsRulePass());

        assertTrue(template.hasResource("OrdersRule"));
        assertTrue(template.hasResource("OrdersRulePermission"));
        assertFalse(template.hasResource("NightlyRule"));
    }

    private JsonNode events() {
        return template.resource("Worker").orElseThrow().at("/Properties/Events");
    }
}
