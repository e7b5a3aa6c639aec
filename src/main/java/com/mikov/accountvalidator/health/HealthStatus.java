package com.mikov.accountvalidator.health;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class HealthStatus {
    private final HealthState status;
    private final long lastCheck;
    private final int consecutiveFailures;
    private final long totalChecks;
}
