package org.cfnrefactor.assets;

import java.nio.file.Path;

import lombok.Builder;

/**
 * One staged asset: which resource it belongs to, where it came from and where it now lives.
 */
@Builder(toBuilder = true)
public record StagedAsset(
    String logicalId,
    Kind kind,
    String source,
    Path stagedPath
) {
    public enum Kind {
        LOCAL_PATH,
        S3_ARCHIVE,
        FILE,
        INLINE_TEXT,
        S3_FILE
    }

    /**
     * @return true when the asset lives in a directory named after its resource
     */
    public boolean isResourceScoped() {
        return kind != Kind.LOCAL_PATH;
    }
}
