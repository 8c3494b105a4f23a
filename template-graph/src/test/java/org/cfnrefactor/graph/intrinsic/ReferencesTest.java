package org.cfnrefactor.graph.intrinsic;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.junit.jupiter.api.Assertions.*;

class ReferencesTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException(text, e);
        }
    }

    static Stream<Arguments> logicalIdForms() {
        return Stream.of(
            Arguments.of("{\"Ref\": \"Bucket\"}", "Bucket"),
            Arguments.of("{\"Fn::GetAtt\": [\"Role\", \"Arn\"]}", "Role"),
            Arguments.of("{\"Fn::GetAtt\": \"Role.Arn\"}", "Role"),
            Arguments.of("{\"Fn::GetAtt\": [\"Stack\", \"Outputs.Url\"]}", "Stack"),
            Arguments.of("\"Queue.Arn\"", "Queue"),
            Arguments.of("\"Queue\"", "Queue")
        );
    }

    @ParameterizedTest
    @MethodSource("logicalIdForms")
    void testExtractLogicalId(String value, String expected) {
        assertEquals(Optional.of(expected), References.extractLogicalId(json(value)));
    }

    @Test
    void testExtractLogicalIdRejectsNonReferences() {
        assertTrue(References.extractLogicalId(json("42")).isEmpty());
        assertTrue(References.extractLogicalId(json("{\"Fn::Sub\": \"${Bucket}\"}")).isEmpty());
        assertTrue(References.extractLogicalId(json("{\"Key\": \"Value\"}")).isEmpty());
        assertTrue(References.extractLogicalId(null).isEmpty());
        assertTrue(References.extractReferencedId(json("\"Queue\"")).isEmpty());
    }

    @Test
    void testReferencesAnyFindsNestedReferences() {
        JsonNode resource = json("{\"Properties\": {\"Environment\": {\"Variables\": "
            + "{\"TABLE\": {\"Fn::If\": [\"IsProd\", {\"Ref\": \"Table\"}, \"none\"]}}}}}");

        assertTrue(References.referencesAny(resource, Set.of("Table")));
        assertFalse(References.referencesAny(resource, Set.of("Queue")));
    }

    @Test
    void testReferencesAnyChecksSubTokensAndLiterals() {
        assertTrue(References.referencesAny(json("{\"Fn::Sub\": \"arn:${AWS::Partition}:s3:::${Bucket}/*\"}"),
            List.of("Bucket")));
        assertTrue(References.referencesAny(json("{\"Fn::Sub\": \"${Bucket.Arn}/*\"}"), List.of("Bucket")));
        assertTrue(References.referencesAny(json("[\"Bucket.Arn\"]"), List.of("Bucket")));
        assertFalse(References.referencesAny(json("\"BucketPolicy\""), List.of("Bucket")));
    }

    @Test
    void testSubVariableShadowsLogicalId() {
        JsonNode sub = json("{\"Fn::Sub\": [\"${Bucket}-logs\", {\"Bucket\": \"literal\"}]}");
        assertFalse(References.referencesAny(sub, List.of("Bucket")));

        JsonNode viaVariable = json("{\"Fn::Sub\": [\"${Name}\", {\"Name\": {\"Ref\": \"Bucket\"}}]}");
        assertTrue(References.referencesAny(viaVariable, List.of("Bucket")));
    }

    @Test
    void testSubTokenIdsSkipPseudoParametersAndEscapes() {
        Set<String> ids = References.subTokenIds("${AWS::Region}-${Api}-${Fn.Arn}-${!Literal}");
        assertEquals(Set.of("Api", "Fn"), ids);
    }

    @Test
    void testReplaceSubTokensKeepsAttributeSuffix() {
        String rewritten = References.replaceSubTokens(
            "arn:${AWS::Partition}:iam::${AWS::AccountId}:role/${MyRole3C357FF2} ${MyRole3C357FF2.Arn} ${Other}",
            Map.of("MyRole3C357FF2", "MyRole"));

        assertEquals("arn:${AWS::Partition}:iam::${AWS::AccountId}:role/${MyRole} ${MyRole.Arn} ${Other}", rewritten);
    }

    @Test
    void testInlineSubTokens() {
        assertEquals("https://${Api}.execute-api.${AWS::Region}.amazonaws.com/prod/",
            References.inlineSubTokens("https://${Api}.execute-api.${AWS::Region}.amazonaws.com/${ApiStage}/",
                Map.of("ApiStage", "prod")));
    }

    @Test
    void testJoinToSub() {
        JsonNode fragments = json("[\"arn:aws:s3:::\", {\"Ref\": \"Bucket\"}, \"/\", {\"Fn::GetAtt\": [\"Fn\", \"Arn\"]}, 7]");
        assertEquals(Optional.of("arn:aws:s3:::${Bucket}/${Fn.Arn}7"), References.joinToSub("", fragments));
        assertEquals(Optional.of("a,${Bucket}"), References.joinToSub(",", json("[\"a\", {\"Ref\": \"Bucket\"}]")));
    }

    @Test
    void testJoinToSubRefusesUnsupportedFragments() {
        JsonNode fragments = json("[\"prefix\", {\"Fn::Select\": [0, [\"a\"]]}]");
        assertTrue(References.joinToSub("", fragments).isEmpty());
        assertTrue(References.joinToSub("", json("\"not-a-list\"")).isEmpty());
    }

    @Test
    void testDecodeRecognisesIntrinsicKinds() {
        assertInstanceOf(Ref.class, Intrinsic.decode(json("{\"Ref\": \"X\"}")).orElseThrow());
        assertInstanceOf(GetAtt.class, Intrinsic.decode(json("{\"Fn::GetAtt\": \"X.Arn\"}")).orElseThrow());
        assertInstanceOf(Sub.class, Intrinsic.decode(json("{\"Fn::Sub\": \"${X}\"}")).orElseThrow());
        assertInstanceOf(Join.class, Intrinsic.decode(json("{\"Fn::Join\": [\"\", [\"a\"]]}")).orElseThrow());
        assertInstanceOf(OpaqueIntrinsic.class, Intrinsic.decode(json("{\"Fn::Select\": [0, []]}")).orElseThrow());
        assertTrue(Intrinsic.decode(json("{\"Name\": \"X\"}")).isEmpty());
        assertTrue(Intrinsic.decode(json("{\"Ref\": \"X\", \"Extra\": 1}")).isEmpty());
    }

    @Test
    void testGetAttKeepsItsForm() {
        assertEquals(json("{\"Fn::GetAtt\": \"Api.RootResourceId\"}"),
            Intrinsic.decode(json("{\"Fn::GetAtt\": \"Api.RootResourceId\"}")).orElseThrow().toNode());
        assertEquals(json("{\"Fn::GetAtt\": [\"Api\", \"RootResourceId\"]}"),
            GetAtt.of("Api", "RootResourceId").toNode());
    }
}
