package com.mikov.accountvalidator.analytics;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class AnalyticsMetrics {
    private final long totalValidations;
    private final long successfulValidations;
    private final long failedValidations;
    private final long bannedAccounts;
    private final long activeAccounts;
    private final Map<String, Long> banTypes;
    private final double avgResponseTimeMs;
    private final Map<String, Long> detectionStats;
}
