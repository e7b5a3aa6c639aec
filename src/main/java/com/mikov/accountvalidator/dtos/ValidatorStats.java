package com.mikov.accountvalidator.dtos;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mikov.accountvalidator.analytics.AnalyticsReport;
import com.mikov.accountvalidator.cache.CacheStats;
import com.mikov.accountvalidator.classifier.AccuracyEstimate;
import com.mikov.accountvalidator.health.HealthStatus;
import com.mikov.accountvalidator.ratelimit.RateLimitStatus;
import lombok.Builder;
import lombok.Data;

/**
 * Operational snapshot. Sections for disabled components are omitted.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidatorStats {
    private final HealthStatus health;
    private final CacheStats cache;
    private final RateLimitStatus rateLimit;
    private final AnalyticsReport analytics;
    private final AccuracyEstimate classifierAccuracy;
}
