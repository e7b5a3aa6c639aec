package com.mikov.accountvalidator.classifier;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Features extracted from the error evidence of one validation.
 */
@Data
@Builder
public class FeatureSet {
    private final String errorText;
    private final List<String> errorCodes;
    private final int errorCount;
    private final double successRate;
    private final List<String> failurePatterns;
    private final TimingPattern timing;
    private final Double averageErrorIntervalMs;
}
