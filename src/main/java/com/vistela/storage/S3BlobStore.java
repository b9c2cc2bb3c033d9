package com.vistela.storage;

import com.vistela.config.StorageProps;
import com.vistela.exception.BlobStoreException;
import com.vistela.exception.ConfigurationException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

@Service
@Slf4j
public class S3BlobStore implements BlobStore {

    private final StorageProps props;
    private final S3ClientFactory clientFactory;

    private volatile S3Client s3Client;

    public S3BlobStore(StorageProps props, S3ClientFactory clientFactory) {
        this.props = props;
        this.clientFactory = clientFactory;
    }

    @Override
    public String upload(Resource source, String name, String folder) throws IOException {
        try {
            props.requireComplete();
        } catch (ConfigurationException e) {
            log.error("Storage configuration error: {}", e.getMessage());
            throw e;
        }
        if (source.isOpen()) {
            throw new IllegalArgumentException("Upload source must be re-readable, got an open stream: " + source);
        }

        String objectKey = StorageKeys.join(folder, name);
        String contentType = MediaTypeFactory.getMediaType(name)
                .orElse(MediaType.APPLICATION_OCTET_STREAM)
                .toString();
        long contentLength = source.contentLength();

        PutObjectRequest putObjectRequest = PutObjectRequest.builder()
                .bucket(props.bucket())
                .key(objectKey)
                .contentType(contentType)
                .contentLength(contentLength)
                .build();

        log.info("Uploading {} ({} bytes) to bucket {} as {}", name, contentLength, props.bucket(), objectKey);

        // Each attempt, including SDK retries, reads the source from its first byte
        RequestBody body = RequestBody.fromContentProvider(() -> openStream(source), contentLength, contentType);

        try {
            client().putObject(putObjectRequest, body);
        } catch (AwsServiceException e) {
            BlobStoreException.Reason reason = classify(e);
            AwsErrorDetails details = e.awsErrorDetails();
            String errorCode = details != null && details.errorCode() != null ? details.errorCode() : "Unknown";
            log.error("S3 rejected upload of {}: {} {} ({})", objectKey, e.statusCode(), errorCode, reason, e);
            throw new BlobStoreException(reason, objectKey,
                    "Upload of " + objectKey + " failed: " + errorCode + " (HTTP " + e.statusCode() + ")", e);
        } catch (SdkClientException e) {
            log.error("Could not reach object storage while uploading {}", objectKey, e);
            throw new BlobStoreException(BlobStoreException.Reason.TRANSIENT, objectKey,
                    "Upload of " + objectKey + " failed: " + e.getMessage(), e);
        }

        log.info("Uploaded {} to bucket {}", objectKey, props.bucket());
        return objectKey;
    }

    BlobStoreException.Reason classify(AwsServiceException e) {
        int status = e.statusCode();
        String errorCode = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;

        if (status == 403 || "AccessDenied".equals(errorCode)) {
            return BlobStoreException.Reason.ACCESS_DENIED;
        }
        if (status == 404 || "NoSuchBucket".equals(errorCode)) {
            return BlobStoreException.Reason.NOT_FOUND;
        }
        if (e.isThrottlingException() || status >= 500 || props.retry().isRetryableStatus(status)) {
            return BlobStoreException.Reason.TRANSIENT;
        }
        return BlobStoreException.Reason.REJECTED;
    }

    private S3Client client() {
        S3Client client = s3Client;
        if (client == null) {
            synchronized (this) {
                client = s3Client;
                if (client == null) {
                    client = clientFactory.create(props);
                    s3Client = client;
                    log.info("Initialized S3 client for bucket: {} (region {})", props.bucket(), props.region());
                }
            }
        }
        return client;
    }

    private static InputStream openStream(Resource source) {
        try {
            return source.getInputStream();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read upload source " + source, e);
        }
    }

    @PreDestroy
    void close() {
        if (s3Client != null) {
            s3Client.close();
        }
    }
}
