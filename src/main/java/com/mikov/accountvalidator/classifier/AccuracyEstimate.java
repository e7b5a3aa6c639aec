package com.mikov.accountvalidator.classifier;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AccuracyEstimate {
    private final int sampleSize;
    private final double estimatedAccuracy;
}
