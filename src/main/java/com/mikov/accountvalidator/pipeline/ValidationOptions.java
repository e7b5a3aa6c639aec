package com.mikov.accountvalidator.pipeline;

import lombok.Builder;
import lombok.Getter;

/**
 * Per-call options. Unset batch values fall back to the validator config.
 */
@Getter
@Builder
public class ValidationOptions {

    private static final ValidationOptions DEFAULTS = ValidationOptions.builder().build();

    private final boolean forceRefresh;
    private final Integer batchSize;
    private final Long delayBetweenBatchesMs;

    public static ValidationOptions defaults() {
        return DEFAULTS;
    }
}
