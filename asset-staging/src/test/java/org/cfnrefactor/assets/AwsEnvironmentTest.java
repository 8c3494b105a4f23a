package org.cfnrefactor.assets;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class AwsEnvironmentTest {

    @ParameterizedTest
    @CsvSource({
        "us-east-1, aws",
        "eu-west-2, aws",
        "us-gov-west-1, aws-us-gov",
        "US-GOV-EAST-1, aws-us-gov",
        "cn-north-1, aws-cn",
        "'', aws"
    })
    void testInferPartition(String region, String partition) {
        assertEquals(partition, AwsEnvironment.inferPartition(region));
    }

    @ParameterizedTest
    @CsvSource({"cn-northwest-1, amazonaws.com.cn", "ap-south-1, amazonaws.com"})
    void testUrlSuffix(String region, String suffix) {
        assertEquals(suffix, AwsEnvironment.of("111111111111", region).urlSuffix());
    }
}
