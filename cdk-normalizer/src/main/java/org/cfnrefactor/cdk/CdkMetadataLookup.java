package org.cfnrefactor.cdk;

import java.util.Map;
import java.util.Optional;

/**
 * Source of construct information per logical id, typically built from a CDK cloud assembly.
 * The normalizer falls back to naming heuristics for ids the lookup does not know.
 */
@FunctionalInterface
public interface CdkMetadataLookup {

    Optional<CdkConstructMetadata> lookup(String logicalId);

    static CdkMetadataLookup none() {
        return logicalId -> Optional.empty();
    }

    static CdkMetadataLookup of(Map<String, CdkConstructMetadata> entries) {
        Map<String, CdkConstructMetadata> copy = Map.copyOf(entries);
        return logicalId -> Optional.ofNullable(copy.get(logicalId));
    }
}
