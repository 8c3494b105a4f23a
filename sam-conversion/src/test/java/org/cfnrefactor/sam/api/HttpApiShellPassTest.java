package org.cfnrefactor.sam.api;

import org.cfnrefactor.graph.Template;
import org.cfnrefactor.sam.SamTypes;
import org.cfnrefactor.sam.TemplateFixtures;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;

import static org.junit.jupiter.api.Assertions.*;

class HttpApiShellPassTest {

    private static Template httpApi(String protocol, String extraResources) {
        return TemplateFixtures.parse("{\"Resources\": {"
            + "\"HttpApi\": {\"Type\": \"AWS::ApiGatewayV2::Api\", \"Properties\": {\"Name\": \"orders\","
            + "  \"ProtocolType\": \"" + protocol + "\", \"Body\": {\"openapi\": \"3.0.1\"},"
            + "  \"CorsConfiguration\": {\"AllowOrigins\": [\"*\"]}}},"
            + "\"HttpApiStage\": {\"Type\": \"AWS::ApiGatewayV2::Stage\", \"Properties\": {"
            + "  \"ApiId\": {\"Ref\": \"HttpApi\"}, \"StageName\": \"$default\", \"AutoDeploy\": true}}"
            + extraResources
            + "}, \"Outputs\": {\"Url\": {\"Value\": {\"Fn::GetAtt\": [\"HttpApi\", \"ApiEndpoint\"]}}}}");
    }

    @Test
    void testHttpApiWithoutRoutesCollapses() {
        Template template = httpApi("HTTP", "");

        TemplateFixtures.run(template, new HttpApiShellPass());

        assertFalse(template.hasResource("HttpApiStage"));
        JsonNode api = template.resource("HttpApi").orElseThrow();
        assertEquals(SamTypes.HTTP_API, api.get("Type").asText());
        assertEquals("orders", api.at("/Properties/Name").asText());
        assertEquals("3.0.1", api.at("/Properties/DefinitionBody/openapi").asText());
        assertEquals("*", api.at("/Properties/CorsConfiguration/AllowOrigins/0").asText());
        assertFalse(api.get("Properties").has("ProtocolType"));
        assertFalse(api.get("Properties").has("StageName"));
    }

    @Test
    void testWebSocketApiIsLeftAlone() {
        Template template = httpApi("WEBSOCKET", "");

        TemplateFixtures.run(template, new HttpApiShellPass());

        assertEquals(HttpApiShellPass.API_TYPE, template.resource("HttpApi").orElseThrow().get("Type").asText());
        assertTrue(template.hasResource("HttpApiStage"));
    }

    @Test
    void testRemainingRoutesKeepTheApi() {
        Template template = httpApi("HTTP", ",\"Route\": {\"Type\": \"AWS::ApiGatewayV2::Route\", \"Properties\": {"
            + "\"ApiId\": {\"Ref\": \"HttpApi\"}, \"RouteKey\": \"GET /orders\"}}");

        TemplateFixtures.run(template, new HttpApiShellPass());

        assertEquals(HttpApiShellPass.API_TYPE, template.resource("HttpApi").orElseThrow().get("Type").asText());
    }

    @Test
    void testReferencedStageKeepsTheApi() {
        Template template = httpApi("HTTP", ",\"Alarm\": {\"Type\": \"AWS::CloudWatch::Alarm\", \"Properties\": {"
            + "\"Dimensions\": [{\"Name\": \"Stage\", \"Value\": {\"Ref\": \"HttpApiStage\"}}]}}");

        TemplateFixtures.run(template, new HttpApiShellPass());

        assertTrue(template.hasResource("HttpApiStage"));
        assertEquals(HttpApiShellPass.API_TYPE, template.resource("HttpApi").orElseThrow().get("Type").asText());
    }
}
