package com.labbackup.api.service.storage;

import com.labbackup.api.exception.StorageUnavailableException;
import com.labbackup.api.util.ChecksumUtils;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * S3-compatible storage gateway. Each storage backend id maps to a bucket through
 * {@code storage.s3.buckets} ("1=bucket-a,2=bucket-b"); unmapped ids use the default bucket.
 * <p>
 * The SDK's own retries are disabled; transient failures surface as
 * {@link StorageUnavailableException} and are retried by the "storage" retry instance.
 */
@Slf4j
@Service
public class S3StorageGateway implements StorageGateway {

    @Value("${storage.s3.endpoint:}")
    private String endpoint;

    @Value("${storage.s3.access-key:}")
    private String accessKey;

    @Value("${storage.s3.secret-key:}")
    private String secretKey;

    @Value("${storage.s3.bucket:lab-backups}")
    private String defaultBucket;

    @Value("${storage.s3.buckets:}")
    private String bucketMappings;

    @Value("${storage.s3.region:eu-central-1}")
    private String region;

    @Value("${storage.s3.capacity-bytes:0}")
    private long capacityBytes;

    private final Map<Long, String> buckets = new HashMap<>();
    private S3Client s3Client;
    private boolean configured = false;

    @PostConstruct
    public void init() {
        buckets.putAll(parseBucketMappings(bucketMappings));

        if (endpoint == null || endpoint.isBlank() ||
            accessKey == null || accessKey.isBlank() ||
            secretKey == null || secretKey.isBlank()) {
            log.warn("S3 storage not configured - backup uploads will fail");
            return;
        }

        try {
            AwsBasicCredentials credentials = AwsBasicCredentials.create(accessKey, secretKey);

            this.s3Client = S3Client.builder()
                    .endpointOverride(URI.create(endpoint))
                    .credentialsProvider(StaticCredentialsProvider.create(credentials))
                    .region(Region.of(region))
                    .forcePathStyle(true)
                    .overrideConfiguration(c -> c.retryPolicy(RetryPolicy.none()))
                    .build();

            this.configured = true;
            log.info("S3 storage gateway initialized with endpoint: {} ({} mapped buckets)", endpoint, buckets.size());
        } catch (Exception e) {
            log.error("Failed to initialize S3 client: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void cleanup() {
        if (s3Client != null) {
            try {
                s3Client.close();
                log.debug("S3 client closed");
            } catch (Exception e) {
                log.warn("Error closing S3 client: {}", e.getMessage());
            }
        }
    }

    public boolean isConfigured() {
        return configured;
    }

    public String bucketFor(Long backendId) {
        return buckets.getOrDefault(backendId, defaultBucket);
    }

    @Override
    @Retry(name = "storage")
    public StoredObject put(Long backendId, String path, ArtifactSource content, long contentLength,
                            Map<String, String> metadata) {
        checkConfigured();
        MessageDigest digest = ChecksumUtils.sha256();
        try (InputStream in = new DigestInputStream(content.open(), digest)) {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucketFor(backendId))
                    .key(path)
                    .contentType("application/octet-stream")
                    .metadata(metadata != null ? metadata : Map.of())
                    .build();

            s3Client.putObject(request, RequestBody.fromInputStream(in, contentLength));
            String checksum = ChecksumUtils.hex(digest);
            log.debug("Uploaded {} bytes to {}/{}", contentLength, bucketFor(backendId), path);
            return StoredObject.builder()
                    .checksum(checksum)
                    .sizeBytes(contentLength)
                    .build();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read artifact for " + path, e);
        } catch (SdkException e) {
            throw translate(backendId, "upload " + path, e);
        }
    }

    @Override
    @Retry(name = "storage")
    public InputStream get(Long backendId, String path) {
        checkConfigured();
        try {
            GetObjectRequest request = GetObjectRequest.builder()
                    .bucket(bucketFor(backendId))
                    .key(path)
                    .build();

            return s3Client.getObject(request);
        } catch (NoSuchKeyException e) {
            throw new IllegalStateException("Artifact not found in storage: " + path);
        } catch (SdkException e) {
            throw translate(backendId, "download " + path, e);
        }
    }

    /**
     * S3 deletes are idempotent, so a missing key also counts as removed.
     */
    @Override
    @Retry(name = "storage")
    public boolean delete(Long backendId, String path) {
        checkConfigured();
        try {
            DeleteObjectRequest request = DeleteObjectRequest.builder()
                    .bucket(bucketFor(backendId))
                    .key(path)
                    .build();

            s3Client.deleteObject(request);
            log.debug("Deleted {}/{}", bucketFor(backendId), path);
            return true;
        } catch (NoSuchKeyException e) {
            return true;
        } catch (SdkException e) {
            throw translate(backendId, "delete " + path, e);
        }
    }

    @Override
    @Retry(name = "storage")
    public List<String> list(Long backendId, String prefix) {
        checkConfigured();
        try {
            ListObjectsV2Request request = ListObjectsV2Request.builder()
                    .bucket(bucketFor(backendId))
                    .prefix(prefix)
                    .build();

            return s3Client.listObjectsV2Paginator(request).contents().stream()
                    .map(S3Object::key)
                    .collect(Collectors.toList());
        } catch (SdkException e) {
            throw translate(backendId, "list " + prefix, e);
        }
    }

    @Override
    @Retry(name = "storage")
    public StorageUsage usage(Long backendId) {
        checkConfigured();
        try {
            ListObjectsV2Request request = ListObjectsV2Request.builder()
                    .bucket(bucketFor(backendId))
                    .build();

            long used = s3Client.listObjectsV2Paginator(request).contents().stream()
                    .mapToLong(S3Object::size)
                    .sum();
            return StorageUsage.builder()
                    .usedBytes(used)
                    .capacityBytes(capacityBytes)
                    .build();
        } catch (SdkException e) {
            throw translate(backendId, "measure usage", e);
        }
    }

    /**
     * Network errors, throttling and 5xx responses are transient; anything else is a
     * configuration or request problem and is not retried.
     */
    private RuntimeException translate(Long backendId, String operation, SdkException e) {
        boolean transientFailure = e instanceof SdkClientException
                || (e instanceof S3Exception && isRetryableStatus(((S3Exception) e).statusCode()));
        if (transientFailure) {
            log.warn("Storage backend {} unavailable during {}: {}", backendId, operation, e.getMessage());
            return new StorageUnavailableException(backendId,
                    "Storage backend " + backendId + " unavailable during " + operation, e);
        }
        log.error("Storage operation failed on backend {}: {}", backendId, operation, e);
        return new IllegalStateException("Storage operation failed: " + operation + " - " + e.getMessage(), e);
    }

    private static boolean isRetryableStatus(int statusCode) {
        return statusCode >= 500 || statusCode == 429;
    }

    static Map<Long, String> parseBucketMappings(String mappings) {
        Map<Long, String> parsed = new HashMap<>();
        if (mappings == null || mappings.isBlank()) {
            return parsed;
        }
        for (String entry : mappings.split(",")) {
            String[] parts = entry.trim().split("=", 2);
            if (parts.length != 2 || parts[1].isBlank()) {
                throw new IllegalStateException("Invalid storage.s3.buckets entry: '" + entry + "' (expected id=bucket)");
            }
            try {
                parsed.put(Long.parseLong(parts[0].trim()), parts[1].trim());
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Invalid backend id in storage.s3.buckets: '" + parts[0] + "'", e);
            }
        }
        return parsed;
    }

    private void checkConfigured() {
        if (!configured) {
            throw new IllegalStateException("S3 storage is not configured. Please set S3_ENDPOINT, S3_ACCESS_KEY, and S3_SECRET_KEY environment variables.");
        }
    }
}
