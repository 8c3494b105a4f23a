package org.cfnrefactor.assets.s3;

import java.net.URI;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Utilities;

/**
 * Bucket, key and optional version of an S3 code asset.
 */
@Builder
public record S3Location(
    @JsonProperty("bucket") String bucket,
    @JsonProperty("key") String key,
    @JsonProperty("version") String version
) {

    public S3Location {
        if (bucket == null || bucket.trim().isEmpty()) {
            throw new IllegalArgumentException("Bucket name cannot be null or empty");
        }
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Object key cannot be null or empty");
        }
    }

    public S3Location(String bucket, String key) {
        this(bucket, key, null);
    }

    /**
     * Parse {@code s3://bucket/key} (an AppSync {@code CodeS3Location}, for instance).
     * A {@code versionId} query parameter is kept as the version.
     */
    public static S3Location parse(String rawUri) {
        if (rawUri == null || !rawUri.startsWith("s3://")) {
            throw new IllegalArgumentException("URI must start with s3://: " + rawUri);
        }
        String withoutQuery = rawUri;
        String version = null;
        int query = rawUri.indexOf('?');
        if (query >= 0) {
            withoutQuery = rawUri.substring(0, query);
            for (String parameter : rawUri.substring(query + 1).split("&")) {
                if (parameter.startsWith("versionId=")) {
                    version = parameter.substring("versionId=".length());
                }
            }
        }
        try {
            S3Utilities s3Utilities = S3Utilities.builder()
                .region(Region.US_EAST_1)
                .build();
            var parsed = s3Utilities.parseUri(URI.create(withoutQuery));
            String bucket = parsed.bucket().orElseThrow(
                () -> new IllegalArgumentException("No bucket found in S3 URI: " + rawUri)
            );
            String key = parsed.key().orElseThrow(
                () -> new IllegalArgumentException("No key found in S3 URI: " + rawUri)
            );
            return new S3Location(bucket, key, version);
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalArgumentException("Invalid S3 URI: " + rawUri, e);
        }
    }

    public String toUri() {
        String base = "s3://" + bucket + "/" + key;
        return version == null || version.isEmpty() ? base : base + "?versionId=" + version;
    }

    /**
     * @return the last key segment, e.g. {@code handler.js} for {@code code/handler.js}
     */
    public String fileName() {
        int slash = key.lastIndexOf('/');
        return slash >= 0 ? key.substring(slash + 1) : key;
    }
}
