package com.xksgroup.vodpipeline.service.storage;

import com.xksgroup.vodpipeline.exception.ObjectStoreException;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * S3-compatible object store (AWS S3, Cloudflare R2, MinIO) with retried uploads.
 */
@Slf4j
public class S3ObjectStore implements ObjectStore {

    private final S3Client s3;
    private final S3Presigner presigner;
    private final String bucket;
    private final String publicBaseUrl;
    private final int maxRetryAttempts;
    private final long retryDelayMs;

    public S3ObjectStore(S3Client s3, S3Presigner presigner, String bucket, String publicBaseUrl,
                         int maxRetryAttempts, long retryDelayMs) {
        this.s3 = s3;
        this.presigner = presigner;
        this.bucket = bucket;
        this.publicBaseUrl = publicBaseUrl != null ? publicBaseUrl.replaceAll("/+$", "") : "";
        this.maxRetryAttempts = Math.max(1, maxRetryAttempts);
        this.retryDelayMs = retryDelayMs;
    }

    @Override
    public StoredObject put(Path file, String key, String contentType) throws ObjectStoreException {
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new ObjectStoreException("Cannot read " + file + " for upload", e);
        }
        uploadWithRetry(key, () -> RequestBody.fromFile(file), contentType);
        return new StoredObject(key, size);
    }

    @Override
    public StoredObject put(String content, String key, String contentType) throws ObjectStoreException {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        uploadWithRetry(key, () -> RequestBody.fromBytes(bytes), contentType);
        return new StoredObject(key, bytes.length);
    }

    @Override
    public StoredObject put(InputStream content, long contentLength, String key, String contentType)
            throws ObjectStoreException {
        // A consumed stream cannot be replayed, so this path is a single attempt
        try {
            s3.putObject(request(key, contentType), RequestBody.fromInputStream(content, contentLength));
        } catch (SdkException e) {
            throw new ObjectStoreException("Failed to upload " + key + ": " + e.getMessage(), e);
        }
        return new StoredObject(key, contentLength);
    }

    @Override
    public String presign(String key, Duration ttl) throws ObjectStoreException {
        if (!publicBaseUrl.isEmpty()) {
            return publicBaseUrl + "/" + key;
        }
        try {
            GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
                    .signatureDuration(ttl)
                    .getObjectRequest(GetObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .build())
                    .build();
            return presigner.presignGetObject(presignRequest).url().toString();
        } catch (SdkException | IllegalArgumentException e) {
            throw new ObjectStoreException("Failed to generate presigned URL: " + key, e);
        }
    }

    private void uploadWithRetry(String key, BodySupplier body, String contentType) throws ObjectStoreException {
        SdkException lastException = null;

        for (int attempt = 1; attempt <= maxRetryAttempts; attempt++) {
            try {
                s3.putObject(request(key, contentType), body.get());
                log.debug("Uploaded {} ({})", key, contentType);
                return;
            } catch (SdkException e) {
                lastException = e;
                if (attempt < maxRetryAttempts) {
                    log.warn("Upload attempt {} failed for key: {} - retrying in {}ms", attempt, key, retryDelayMs * attempt);
                    try {
                        Thread.sleep(retryDelayMs * attempt);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new ObjectStoreException("Upload interrupted: " + key, ie);
                    }
                }
            }
        }

        throw new ObjectStoreException("Failed to upload after " + maxRetryAttempts + " attempts: " + key, lastException);
    }

    private PutObjectRequest request(String key, String contentType) {
        return PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .cacheControl(cache(key))
                .build();
    }

    private static String cache(String key) {
        return key.endsWith(".m3u8")
                ? "public, max-age=15, s-maxage=15, must-revalidate"
                : "public, max-age=3600, s-maxage=3600, immutable";
    }

    @FunctionalInterface
    private interface BodySupplier {
        RequestBody get();
    }
}
