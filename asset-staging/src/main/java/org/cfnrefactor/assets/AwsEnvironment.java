package org.cfnrefactor.assets;

import java.util.Locale;

/**
 * Account, region and partition that pseudo parameters resolve against.
 */
public record AwsEnvironment(String accountId, String region, String partition) {

    public static AwsEnvironment of(String accountId, String region) {
        return new AwsEnvironment(accountId, region, inferPartition(region));
    }

    public static String inferPartition(String region) {
        if (region == null || region.isEmpty()) {
            return "aws";
        }
        String lowered = region.toLowerCase(Locale.ROOT);
        if (lowered.startsWith("us-gov")) {
            return "aws-us-gov";
        }
        if (lowered.startsWith("cn-")) {
            return "aws-cn";
        }
        return "aws";
    }

    public String urlSuffix() {
        return "aws-cn".equals(partition) ? "amazonaws.com.cn" : "amazonaws.com";
    }
}
