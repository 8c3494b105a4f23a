package org.cfnrefactor.cdk;

import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static org.junit.jupiter.api.Assertions.*;

class LogicalIdNamerTest {

    private final LogicalIdNamer namer = new LogicalIdNamer(NormalizerOptions.readable(), CdkMetadataLookup.none());

    private static ObjectNode withPath(String path) {
        ObjectNode resource = JsonNodeFactory.instance.objectNode();
        resource.put("Type", "AWS::Lambda::Permission");
        resource.putObject("Metadata").put("aws:cdk:path", path);
        return resource;
    }

    @ParameterizedTest
    @CsvSource({
        "MyBucketF68F3FF0, MyBucket",
        "HandlerServiceRoleFCDC14AE, HandlerRole",
        "HandlerServiceRoleDefaultPolicyCBD0CC91, HandlerPolicy",
        "WorkerDefaultPolicy0A1B2C3D, WorkerPolicy",
        "HandlerLogGroupA1B2C3D4, HandlerLogs",
        "CustomResourceProviderframework1A2B3C4D, CustomResourceProvider",
        "NestedA1B2C3D4E5F60718, Nested",
        "Queue, Queue",
        "deadbeef, deadbeef"
    })
    void testBaseNameFromLogicalId(String logicalId, String expected) {
        assertEquals(expected, namer.baseName(logicalId, JsonNodeFactory.instance.objectNode()));
    }

    @ParameterizedTest
    @CsvSource({
        "my-bucket, mybucket",
        "1stQueue, Resource1stQueue",
        "'--', Resource"
    })
    void testSanitize(String input, String expected) {
        assertEquals(expected, LogicalIdNamer.sanitize(input));
    }

    @Test
    void testApiPathHeuristics() {
        assertEquals("ApiGatewayProxyResource",
            namer.baseName("RestApiproxyA1B2C3D4", withPath("Stack/RestApi/Default/{proxy+}/Resource")));
        assertEquals("ApiGatewayGETPermission",
            namer.baseName("RestApiGETApiPermissionStackRestApiGET01234567",
                withPath("Stack/RestApi/Default/GET/ApiPermission.StackRestApi.GET..")));
        assertEquals(Optional.empty(), LogicalIdNamer.nameFromApiPath("Stack/ApiHandlerFunction/Resource"));
        assertEquals(Optional.empty(), LogicalIdNamer.nameFromApiPath("Stack/Bucket/Resource"));
    }

    @Test
    void testSemanticNamingCanBeDisabled() {
        LogicalIdNamer plain = new LogicalIdNamer(
            NormalizerOptions.builder().semanticNaming(false).build(), CdkMetadataLookup.none());

        assertEquals("HandlerServiceRole", plain.baseName("HandlerServiceRoleFCDC14AE", JsonNodeFactory.instance.objectNode()));
    }

    @Test
    void testGeneratedLookupNamesAreSimplified() {
        assertEquals("PublicSubnet1", LogicalIdNamer.simplifyGenerated("PublicSubnet1Subnet"));
        assertEquals("PublicSubnet1RouteTable2", LogicalIdNamer.simplifyGenerated("PublicSubnet1RouteTable2RouteTable"));
        assertEquals("DefaultRoute3", LogicalIdNamer.simplifyGenerated("DefaultRoute3Route"));
        assertEquals("Bucket", LogicalIdNamer.simplifyGenerated("Bucket"));
    }
}
