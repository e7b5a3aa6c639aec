package com.mikov.accountvalidator.analytics;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrendReport {
    private final String status;
    private final Double recentBanRate;
    private final Double avgResponseTimeMs;
    private final String trend;

    public static TrendReport insufficientData() {
        return TrendReport.builder().status("insufficient_data").build();
    }

    public boolean hasData() {
        return recentBanRate != null;
    }
}
