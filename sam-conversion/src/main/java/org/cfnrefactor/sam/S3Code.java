package org.cfnrefactor.sam;

import java.util.Optional;

import org.cfnrefactor.assets.AssetStager;
import org.cfnrefactor.assets.AssetStagingException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns a CloudFormation {@code {S3Bucket, S3Key, S3ObjectVersion}} code block into a SAM code URI.
 * With a stager and a fully resolvable location the bundle is downloaded and the local directory is
 * used; otherwise the SAM {@code {Bucket, Key, Version}} object keeps the original values.
 */
@Slf4j
public final class S3Code {

    private S3Code() {}

    public static boolean isS3Code(JsonNode code) {
        return code != null && code.isObject() && code.has("S3Bucket") && code.has("S3Key");
    }

    /**
     * @param lenient fall back to the S3 object when staging fails instead of propagating the error
     */
    public static JsonNode codeUri(ConversionContext context, String logicalId, JsonNode code, boolean lenient) {
        JsonNode bucket = code.get("S3Bucket");
        JsonNode key = code.get("S3Key");
        JsonNode version = code.get("S3ObjectVersion");

        var stager = context.stager();
        if (stager.isPresent()) {
            var resolvedBucket = resolve(stager.get(), bucket);
            var resolvedKey = resolve(stager.get(), key);
            if (resolvedBucket.isPresent() && resolvedKey.isPresent()) {
                String resolvedVersion = version != null && version.isTextual() ? version.asText() : null;
                try {
                    var staged = stager.get().stageS3Code(logicalId, resolvedBucket.get(), resolvedKey.get(), resolvedVersion);
                    return JsonNodeFactory.instance.textNode(context.codeUri(staged));
                } catch (AssetStagingException e) {
                    if (!lenient) {
                        throw e;
                    }
                    log.warn("Keeping S3 code location for {}: {}", logicalId, e.getMessage());
                }
            }
        }
        ObjectNode uri = JsonNodeFactory.instance.objectNode();
        uri.set("Bucket", bucket);
        uri.set("Key", key);
        if (version != null && !version.isNull()) {
            uri.set("Version", version);
        }
        return uri;
    }

    private static Optional<String> resolve(AssetStager stager, JsonNode value) {
        if (value == null) {
            return Optional.empty();
        }
        var resolved = stager.resolveString(value);
        if (resolved.isPresent()) {
            return resolved;
        }
        return value.isTextual() ? Optional.of(value.asText()) : Optional.empty();
    }
}
