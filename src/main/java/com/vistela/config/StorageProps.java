package com.vistela.config;

import com.vistela.exception.ConfigurationException;
import com.vistela.storage.UploadRetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Object storage settings.
 *
 * @param endpoint optional endpoint override for S3-compatible stores (MinIO, R2)
 */
@ConfigurationProperties(prefix = "vistela.storage")
public record StorageProps(
        String accessKey,
        String secretKey,
        @DefaultValue("us-east-1") String region,
        String bucket,
        String endpoint,
        boolean pathStyleAccess,
        @DefaultValue UploadRetryPolicy retry
) {

    public void requireComplete() {
        List<String> missing = new ArrayList<>();
        if (!StringUtils.hasText(accessKey)) {
            missing.add("vistela.storage.access-key");
        }
        if (!StringUtils.hasText(secretKey)) {
            missing.add("vistela.storage.secret-key");
        }
        if (!StringUtils.hasText(bucket)) {
            missing.add("vistela.storage.bucket");
        }
        if (!missing.isEmpty()) {
            throw new ConfigurationException(missing);
        }
    }
}
