package org.cfnrefactor.assets.s3;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Fetches one S3 object to a local file.
 */
@FunctionalInterface
public interface S3ObjectDownloader {

    /**
     * @param location bucket, key and optional version of the object
     * @param target file to write; parent directories exist
     * @throws IOException if the object cannot be fetched or written
     */
    void download(S3Location location, Path target) throws IOException;
}
