package org.cfnrefactor.assets;

import java.util.Optional;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.regions.providers.DefaultAwsRegionProviderChain;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityResponse;

/**
 * Looks up the caller's account via STS and the region via the default provider chain.
 */
@Slf4j
public class AwsEnvironmentDetector {

    private static final String DEFAULT_REGION = "us-east-1";

    public Optional<AwsEnvironment> detect() {
        String region = detectRegion();
        try (StsClient sts = StsClient.builder()
            .region(Region.of(region))
            .credentialsProvider(DefaultCredentialsProvider.builder().build())
            .build()) {
            GetCallerIdentityResponse identity = sts.getCallerIdentity();
            if (identity.account() == null || identity.account().isEmpty()) {
                return Optional.empty();
            }
            log.atInfo().setMessage("Detected AWS account {} in region {}")
                .addArgument(identity::account)
                .addArgument(region)
                .log();
            return Optional.of(AwsEnvironment.of(identity.account(), region));
        } catch (SdkException e) {
            log.warn("Could not detect AWS account, pseudo parameters stay unresolved", e);
            return Optional.empty();
        }
    }

    private static String detectRegion() {
        try {
            return new DefaultAwsRegionProviderChain().getRegion().id();
        } catch (SdkException e) {
            log.debug("No region configured, using {}", DEFAULT_REGION);
            return DEFAULT_REGION;
        }
    }
}
