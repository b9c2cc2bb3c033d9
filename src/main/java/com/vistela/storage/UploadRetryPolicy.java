package com.vistela.storage;

import org.springframework.boot.context.properties.bind.DefaultValue;
import software.amazon.awssdk.core.retry.RetryMode;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.core.retry.backoff.BackoffStrategy;
import software.amazon.awssdk.core.retry.backoff.FullJitterBackoffStrategy;
import software.amazon.awssdk.core.retry.conditions.OrRetryCondition;
import software.amazon.awssdk.core.retry.conditions.RetryCondition;
import software.amazon.awssdk.core.retry.conditions.RetryOnExceptionsCondition;
import software.amazon.awssdk.core.retry.conditions.RetryOnStatusCodeCondition;
import software.amazon.awssdk.core.retry.conditions.RetryOnThrottlingCondition;

import java.io.IOException;
import java.time.Duration;
import java.util.Set;

/**
 * Retry behaviour applied by the S3 client to uploads.
 * I/O errors and throttling responses are always retried; other responses only when
 * their status code is listed in {@code retryableStatusCodes}.
 *
 * @param maxAttempts total attempts including the first one
 */
public record UploadRetryPolicy(
        @DefaultValue("3") int maxAttempts,
        @DefaultValue("adaptive") RetryMode mode,
        @DefaultValue("100ms") Duration baseDelay,
        @DefaultValue("20s") Duration maxBackoff,
        @DefaultValue({"500", "502", "503", "504"}) Set<Integer> retryableStatusCodes
) {

    public UploadRetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        retryableStatusCodes = Set.copyOf(retryableStatusCodes);
    }

    public static UploadRetryPolicy defaults() {
        return new UploadRetryPolicy(3, RetryMode.ADAPTIVE, Duration.ofMillis(100), Duration.ofSeconds(20),
                Set.of(500, 502, 503, 504));
    }

    public boolean isRetryableStatus(int statusCode) {
        return retryableStatusCodes.contains(statusCode);
    }

    public RetryPolicy toSdkRetryPolicy() {
        BackoffStrategy backoff = FullJitterBackoffStrategy.builder()
                .baseDelay(baseDelay)
                .maxBackoffTime(maxBackoff)
                .build();

        RetryCondition condition = OrRetryCondition.create(
                RetryOnStatusCodeCondition.create(retryableStatusCodes),
                RetryOnExceptionsCondition.create(IOException.class),
                RetryOnThrottlingCondition.create());

        return RetryPolicy.builder(mode)
                .numRetries(maxAttempts - 1)
                .backoffStrategy(backoff)
                .throttlingBackoffStrategy(backoff)
                .retryCondition(condition)
                .build();
    }
}
