package com.vistela.storage;

import com.vistela.config.StorageProps;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;

/**
 * Builds the S3 client from validated storage settings.
 */
public class S3ClientFactory {

    private final SdkHttpClient httpClient;

    public S3ClientFactory() {
        this(null);
    }

    /**
     * @param httpClient transport to use instead of the SDK default, or {@code null}
     */
    public S3ClientFactory(SdkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public S3Client create(StorageProps props) {
        AwsBasicCredentials credentials = AwsBasicCredentials.create(props.accessKey(), props.secretKey());

        S3ClientBuilder builder = S3Client.builder()
                .credentialsProvider(StaticCredentialsProvider.create(credentials))
                .region(Region.of(props.region()))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(props.pathStyleAccess())
                        .build())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .retryPolicy(props.retry().toSdkRetryPolicy())
                        .build());

        // MinIO and R2 need an explicit endpoint
        if (StringUtils.hasText(props.endpoint())) {
            builder.endpointOverride(URI.create(props.endpoint()));
        }
        if (httpClient != null) {
            builder.httpClient(httpClient);
        }
        return builder.build();
    }
}
