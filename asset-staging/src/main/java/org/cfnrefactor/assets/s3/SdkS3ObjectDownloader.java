package org.cfnrefactor.assets.s3;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.async.AsyncResponseTransformer;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;

/**
 * S3ObjectDownloader backed by the AWS SDK CRT-based async client.
 */
@Slf4j
public class SdkS3ObjectDownloader implements S3ObjectDownloader, AutoCloseable {

    private static final long S3_MINIMUM_PART_SIZE_BYTES = 8L * 1024 * 1024; // 8MB

    private final S3AsyncClient s3Client;

    public SdkS3ObjectDownloader(String region) {
        this(region, null);
    }

    /**
     * @param endpoint custom S3 endpoint (LocalStack and similar), may be null
     */
    public SdkS3ObjectDownloader(String region, URI endpoint) {
        var clientBuilder = S3AsyncClient.crtBuilder()
            .region(Region.of(region))
            .credentialsProvider(DefaultCredentialsProvider.builder().build())
            .retryConfiguration(r -> r.numRetries(3))
            .minimumPartSizeInBytes(S3_MINIMUM_PART_SIZE_BYTES);
        if (endpoint != null) {
            clientBuilder.endpointOverride(endpoint);
        }
        this.s3Client = clientBuilder.build();
    }

    @Override
    public void download(S3Location location, Path target) throws IOException {
        log.debug("Downloading S3 object: {}", location.toUri());
        var request = GetObjectRequest.builder()
            .bucket(location.bucket())
            .key(location.key());
        if (location.version() != null) {
            request.versionId(location.version());
        }
        ResponseBytes<GetObjectResponse> response;
        try {
            CompletableFuture<ResponseBytes<GetObjectResponse>> future =
                s3Client.getObject(request.build(), AsyncResponseTransformer.toBytes());
            response = future.join();
        } catch (Exception e) {
            throw new IOException("Failed to get S3 object: " + location.toUri(), e);
        }
        Files.write(target, response.asByteArray());
        log.debug("Wrote S3 object to: {}", target);
    }

    @Override
    public void close() {
        s3Client.close();
    }
}
