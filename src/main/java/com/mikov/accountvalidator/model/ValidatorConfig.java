package com.mikov.accountvalidator.model;

import lombok.Builder;
import lombok.Getter;

/**
 * Immutable validator settings. Every option carries its default here, so a
 * config built from an empty builder is a complete, usable configuration.
 *
 * @author zahari.mikov
 */
@Getter
@Builder(toBuilder = true)
public class ValidatorConfig {

    @Builder.Default
    private final long timeoutMs = 8000;
    @Builder.Default
    private final long presenceTimeoutMarginMs = 3000;
    @Builder.Default
    private final boolean parallelProbes = true;
    @Builder.Default
    private final boolean presenceCheckEnabled = true;

    @Builder.Default
    private final boolean retryOnFailure = true;
    @Builder.Default
    private final int maxRetries = 2;
    @Builder.Default
    private final long retryDelayMs = 1000;

    @Builder.Default
    private final boolean cacheEnabled = true;
    @Builder.Default
    private final long cacheTtlMs = 3_600_000;
    @Builder.Default
    private final int cacheMaxSize = 1000;

    @Builder.Default
    private final boolean rateLimitEnabled = true;
    @Builder.Default
    private final int rateLimitMaxRequests = 10;
    @Builder.Default
    private final long rateLimitWindowMs = 60_000;

    @Builder.Default
    private final boolean classifierEnabled = true;
    @Builder.Default
    private final boolean analyticsEnabled = true;

    @Builder.Default
    private final int batchSize = 5;
    @Builder.Default
    private final long batchDelayMs = 2000;

    @Builder.Default
    private final int healthDegradedThreshold = 5;
    @Builder.Default
    private final int healthCriticalThreshold = 10;

    @Builder.Default
    private final String jidSuffix = "@s.whatsapp.net";

    public static ValidatorConfig getDefault() {
        return ValidatorConfig.builder().build();
    }

    /**
     * Rejects settings the pipeline cannot run with.
     *
     * @return this config, for chaining
     * @throws IllegalArgumentException if any setting is out of range
     */
    public ValidatorConfig validate() {
        require(timeoutMs > 0, "timeoutMs must be positive");
        require(presenceTimeoutMarginMs >= 0, "presenceTimeoutMarginMs must not be negative");
        require(maxRetries >= 0, "maxRetries must not be negative");
        require(retryDelayMs >= 0, "retryDelayMs must not be negative");
        if (cacheEnabled) {
            require(cacheTtlMs > 0, "cacheTtlMs must be positive");
            require(cacheMaxSize > 0, "cacheMaxSize must be positive");
        }
        if (rateLimitEnabled) {
            require(rateLimitMaxRequests > 0, "rateLimitMaxRequests must be positive");
            require(rateLimitWindowMs > 0, "rateLimitWindowMs must be positive");
        }
        require(batchSize > 0, "batchSize must be positive");
        require(batchDelayMs >= 0, "batchDelayMs must not be negative");
        require(healthDegradedThreshold > 0, "healthDegradedThreshold must be positive");
        require(healthCriticalThreshold >= healthDegradedThreshold,
                "healthCriticalThreshold must not be below healthDegradedThreshold");
        require(jidSuffix != null && !jidSuffix.isBlank(), "jidSuffix is required");
        return this;
    }

    private static void require(final boolean condition, final String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
