package com.oekaki.relay.service;

import com.oekaki.relay.config.AppProperties;
import com.oekaki.relay.exception.StoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.util.Optional;

/** Stores each drawing's latest rendering as {@code <artifactId>.bin}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class BlobStorageService {

    private final AppProperties props;
    private final S3Client s3;

    public String getBucketName() {
        String raw = props.getS3().getBucket();
        if (raw == null || raw.isBlank()) {
            throw new IllegalStateException("S3 bucket name not configured");
        }
        return raw.trim().replaceFirst("^s3://", "").replaceAll("/+$", "");
    }

    public static String keyFor(String artifactId) {
        return artifactId + ".bin";
    }

    public String putPayload(String artifactId, byte[] body) {
        String key = keyFor(artifactId);
        try {
            s3.putObject(
                    PutObjectRequest.builder()
                            .bucket(getBucketName())
                            .key(key)
                            .contentType(MediaType.APPLICATION_OCTET_STREAM_VALUE)
                            .build(),
                    RequestBody.fromBytes(body));
        } catch (SdkException e) {
            throw new StoreException("Failed to write blob " + key, e);
        }
        log.debug("Stored {} bytes at {}", body.length, key);
        return key;
    }

    /** Stored rendering, or empty if no blob was ever written for this id. */
    public Optional<byte[]> getPayload(String artifactId) {
        String key = keyFor(artifactId);
        try {
            ResponseBytes<GetObjectResponse> bytes = s3.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(getBucketName())
                    .key(key)
                    .build());
            return Optional.of(bytes.asByteArray());
        } catch (NoSuchKeyException e) {
            return Optional.empty();
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return Optional.empty();
            }
            throw new StoreException("Failed to read blob " + key, e);
        } catch (SdkException e) {
            throw new StoreException("Failed to read blob " + key, e);
        }
    }
}
