package com.mikov.accountvalidator.analytics;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class AnalyticsReport {
    private final AnalyticsMetrics summary;
    private final TrendReport trends;
    private final List<String> recommendations;
}
