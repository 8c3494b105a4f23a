package org.cfnrefactor.assets;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Collaborator that materializes code assets (Lambda code, layers, AppSync resolver code) next to a
 * converted template. All filesystem and network access of a conversion run goes through this interface.
 */
public interface AssetStager {

    /**
     * Copy a local file or directory into the asset directory. Repeated calls for the same source share
     * one staged copy.
     * @param logicalId the resource the asset belongs to
     * @param source the local path to copy
     * @return the staged path
     * @throws AssetStagingException if the copy fails
     */
    Path stageLocalPath(String logicalId, Path source);

    /**
     * Download a zipped code bundle from S3 and extract it under the resource's own directory.
     * @param version optional object version, may be null
     * @return the directory the bundle was extracted into
     * @throws AssetStagingException if the download or extraction fails
     */
    Path stageS3Code(String logicalId, String bucket, String key, String version);

    /**
     * Copy a single file into the resource's own directory.
     * @param fileName name to give the staged file, or null to keep the source name
     * @return the staged file
     */
    Path stageFileAsset(String logicalId, Path source, String fileName);

    /**
     * Write inline text (e.g. a Lambda {@code ZipFile} body) to a file in the resource's own directory.
     * A trailing newline is added when missing.
     * @return the staged file
     */
    Path stageInlineText(String logicalId, String contents, String fileName);

    /**
     * Download a single S3 object into the resource's own directory.
     * @param fileName name to give the staged file, or null to use the last key segment
     * @return the staged file
     */
    Path stageS3File(String logicalId, String bucket, String key, String version, String fileName);

    /**
     * Resolve a template value to a plain string, substituting the account, region and partition pseudo
     * parameters of the target environment.
     * @param value a string, {@code Ref} to a pseudo parameter, or {@code Fn::Sub}
     * @return the resolved string, or empty when any part stays unresolved
     */
    Optional<String> resolveString(JsonNode value);

    /**
     * @return every asset staged so far, in staging order
     */
    List<StagedAsset> getRecords();

    /**
     * Retarget staged assets after logical ids were renamed; per-resource directories move with their
     * resource.
     */
    void applyRenameMap(Map<String, String> renameMap);

    /**
     * Express a staged path the way it should appear in a template ({@code CodeUri}, {@code ContentUri}).
     */
    String formatCodeUri(Path stagedPath);
}
