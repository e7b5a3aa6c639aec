package com.mikov.accountvalidator.config;

import com.mikov.accountvalidator.model.ValidatorConfig;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds the {@code validator.*} properties. Anything left unset keeps the
 * {@link ValidatorConfig} default.
 *
 * @author zahari.mikov
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "validator")
public class ValidatorProperties {

    private static final ValidatorConfig DEFAULTS = ValidatorConfig.getDefault();

    private String jidSuffix = DEFAULTS.getJidSuffix();
    private final Probe probe = new Probe();
    private final Retry retry = new Retry();
    private final Cache cache = new Cache();
    private final RateLimit rateLimit = new RateLimit();
    private final Classifier classifier = new Classifier();
    private final Analytics analytics = new Analytics();
    private final Batch batch = new Batch();
    private final Health health = new Health();
    private final Gateway gateway = new Gateway();
    private final Plugins plugins = new Plugins();

    public ValidatorConfig toConfig() {
        return ValidatorConfig.builder()
                .timeoutMs(probe.getTimeoutMs())
                .presenceTimeoutMarginMs(probe.getPresenceTimeoutMarginMs())
                .parallelProbes(probe.isParallel())
                .presenceCheckEnabled(probe.isPresenceCheck())
                .retryOnFailure(retry.isEnabled())
                .maxRetries(retry.getMaxRetries())
                .retryDelayMs(retry.getDelayMs())
                .cacheEnabled(cache.isEnabled())
                .cacheTtlMs(cache.getTtlMs())
                .cacheMaxSize(cache.getMaxSize())
                .rateLimitEnabled(rateLimit.isEnabled())
                .rateLimitMaxRequests(rateLimit.getMaxRequests())
                .rateLimitWindowMs(rateLimit.getWindowMs())
                .classifierEnabled(classifier.isEnabled())
                .analyticsEnabled(analytics.isEnabled())
                .batchSize(batch.getSize())
                .batchDelayMs(batch.getDelayMs())
                .healthDegradedThreshold(health.getDegradedThreshold())
                .healthCriticalThreshold(health.getCriticalThreshold())
                .jidSuffix(jidSuffix)
                .build();
    }

    @Getter
    @Setter
    public static class Probe {
        private long timeoutMs = DEFAULTS.getTimeoutMs();
        private long presenceTimeoutMarginMs = DEFAULTS.getPresenceTimeoutMarginMs();
        private boolean parallel = DEFAULTS.isParallelProbes();
        private boolean presenceCheck = DEFAULTS.isPresenceCheckEnabled();
    }

    @Getter
    @Setter
    public static class Retry {
        private boolean enabled = DEFAULTS.isRetryOnFailure();
        private int maxRetries = DEFAULTS.getMaxRetries();
        private long delayMs = DEFAULTS.getRetryDelayMs();
    }

    @Getter
    @Setter
    public static class Cache {
        private boolean enabled = DEFAULTS.isCacheEnabled();
        private long ttlMs = DEFAULTS.getCacheTtlMs();
        private int maxSize = DEFAULTS.getCacheMaxSize();
    }

    @Getter
    @Setter
    public static class RateLimit {
        private boolean enabled = DEFAULTS.isRateLimitEnabled();
        private int maxRequests = DEFAULTS.getRateLimitMaxRequests();
        private long windowMs = DEFAULTS.getRateLimitWindowMs();
    }

    @Getter
    @Setter
    public static class Classifier {
        private boolean enabled = DEFAULTS.isClassifierEnabled();
    }

    @Getter
    @Setter
    public static class Analytics {
        private boolean enabled = DEFAULTS.isAnalyticsEnabled();
    }

    @Getter
    @Setter
    public static class Batch {
        private int size = DEFAULTS.getBatchSize();
        private long delayMs = DEFAULTS.getBatchDelayMs();
    }

    @Getter
    @Setter
    public static class Health {
        private int degradedThreshold = DEFAULTS.getHealthDegradedThreshold();
        private int criticalThreshold = DEFAULTS.getHealthCriticalThreshold();
    }

    @Getter
    @Setter
    public static class Gateway {
        private String baseUrl = "http://localhost:3000";
    }

    @Getter
    @Setter
    public static class Plugins {
        private boolean auditLog;
    }
}
