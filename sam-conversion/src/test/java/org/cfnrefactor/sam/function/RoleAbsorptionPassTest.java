package org.cfnrefactor.sam.function;

import org.cfnrefactor.graph.ResourceNodes;
import org.cfnrefactor.graph.Template;
import org.cfnrefactor.graph.intrinsic.GetAtt;
import org.cfnrefactor.sam.TemplateFixtures;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static org.junit.jupiter.api.Assertions.*;

class RoleAbsorptionPassTest {

    @Test
    void testPolicyAndBasicRoleAreAbsorbed() throws Exception {
        Template template = TemplateFixtures.load("function-stack.json");

        TemplateFixtures.run(template, new LambdaFunctionPass(), new RoleAbsorptionPass());

        assertFalse(template.hasResource("HandlerRole"));
        assertFalse(template.hasResource("HandlerRoleDefaultPolicy"));
        JsonNode handler = template.resource("Handler").orElseThrow();
        assertFalse(handler.get("Properties").has("Role"));
        assertFalse(handler.has("DependsOn"));
        assertEquals(new ObjectMapper().readTree("[{\"DynamoDBCrudPolicy\": {\"TableName\": {\"Ref\": \"Table\"}}}]"),
            handler.at("/Properties/Policies"));
    }

    @Test
    void testRoleReferencedElsewhereIsKept() throws Exception {
        Template template = TemplateFixtures.load("function-stack.json");
        template.section(Template.OUTPUTS).putObject("RoleArn").set("Value", GetAtt.of("HandlerRole", "Arn").toNode());

        TemplateFixtures.run(template, new LambdaFunctionPass(), new RoleAbsorptionPass());

        assertTrue(template.hasResource("HandlerRole"));
        assertTrue(template.hasResource("HandlerRoleDefaultPolicy"));
        JsonNode handler = template.resource("Handler").orElseThrow();
        assertEquals("HandlerRole", handler.at("/Properties/Role/Fn::GetAtt/0").asText());
        assertTrue(handler.at("/Properties/Policies").isMissingNode());
        assertEquals(2, handler.get("DependsOn").size());
    }

    @Test
    void testPoliciesOfSharedRoleAreKept() throws Exception {
        Template template = TemplateFixtures.load("function-stack.json");
        template.resources().putObject("Other").put("Type", "AWS::StepFunctions::StateMachine")
            .putObject("Properties").set("RoleArn", GetAtt.of("HandlerRole", "Arn").toNode());

        TemplateFixtures.run(template, new LambdaFunctionPass(), new RoleAbsorptionPass());

        assertTrue(template.hasResource("HandlerRoleDefaultPolicy"));
        assertTrue(template.hasResource("HandlerRole"));
        assertTrue(template.resource("Handler").orElseThrow().at("/Properties/Policies").isMissingNode());
    }

    @Test
    void testPoliciesOfCustomRoleStayAttached() throws Exception {
        Template template = TemplateFixtures.load("function-stack.json");
        ResourceNodes.propertiesOrCreate(template.resource("HandlerRole").orElseThrow()).put("RoleName", "handler-role");

        TemplateFixtures.run(template, new LambdaFunctionPass(), new RoleAbsorptionPass());

        assertTrue(template.hasResource("HandlerRole"));
        assertTrue(template.hasResource("HandlerRoleDefaultPolicy"));
        assertTrue(template.resource("Handler").orElseThrow().at("/Properties/Role").isObject());
    }

    @Test
    void testRoleWithExtraPropertiesIsNotBasic() throws Exception {
        JsonNode role = new ObjectMapper().readTree("{\"Type\": \"AWS::IAM::Role\", \"Properties\": {"
            + "\"AssumeRolePolicyDocument\": {\"Statement\": {\"Effect\": \"Allow\", \"Action\": \"sts:AssumeRole\","
            + "\"Principal\": {\"Service\": [\"lambda.amazonaws.com\"]}}},"
            + "\"ManagedPolicyArns\": [\"arn:aws:iam::aws:policy/service-role/AWSLambdaBasicExecutionRole\"]}}");

        assertTrue(RoleAbsorptionPass.isBasicLambdaRole(role));
        ((ObjectNode) role.get("Properties")).put("RoleName", "custom");
        assertFalse(RoleAbsorptionPass.isBasicLambdaRole(role));
    }
}
