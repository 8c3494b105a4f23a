package org.cfnrefactor.cdk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Toggles for the CDK identity normalizer. Defaults are the readable-mode defaults.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NormalizerOptions {

    public enum Mode {
        /** Rename ids and drop CDK scaffolding; the result is meant to be read and redeployed as a new stack. */
        READABLE,
        /** Keep ids stable so an existing stack is not replaced. */
        DEPLOYABLE
    }

    public enum CollisionStrategy {
        NUMBERED,
        SHORT_HASH
    }

    @Builder.Default
    private Mode mode = Mode.READABLE;

    /** Strip trailing 8-hex-digit CDK hashes from derived names. */
    @Builder.Default
    private boolean stripHashes = true;

    /** Collapse synthesis suffixes such as {@code ServiceRole} and {@code LogGroup}. */
    @Builder.Default
    private boolean semanticNaming = true;

    /** Remove {@code AWS::CDK::Metadata} resources and the {@code CDKMetadataAvailable} condition. */
    @Builder.Default
    private boolean removeCdkMetadata = true;

    /** Keep {@code aws:cdk:path} when asset metadata is stripped. */
    @Builder.Default
    private boolean keepPathMetadata = true;

    /** Remove {@code aws:asset:*} and {@code aws:cdk:asset*} metadata keys. */
    @Builder.Default
    private boolean stripAssetMetadata = true;

    @Builder.Default
    private CollisionStrategy collisionStrategy = CollisionStrategy.NUMBERED;

    /** Rename logical ids; also enables legacy asset parameter cleanup. */
    @Builder.Default
    private boolean renameLogicalIds = true;

    public static NormalizerOptions readable() {
        return NormalizerOptions.builder().build();
    }

    public static NormalizerOptions deployable() {
        return NormalizerOptions.builder()
            .mode(Mode.DEPLOYABLE)
            .removeCdkMetadata(false)
            .stripAssetMetadata(false)
            .renameLogicalIds(false)
            .build();
    }
}
