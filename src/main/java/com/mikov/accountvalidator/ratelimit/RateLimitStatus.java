package com.mikov.accountvalidator.ratelimit;

import lombok.Builder;
import lombok.Data;

/**
 * Snapshot of the rate limiter window.
 */
@Data
@Builder
public class RateLimitStatus {
    private final int activeRequests;
    private final int maxRequests;
    private final int remaining;
    private final Long resetAt;
}
