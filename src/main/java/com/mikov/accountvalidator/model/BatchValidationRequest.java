package com.mikov.accountvalidator.model;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Request body for batch validation and CSV export.
 *
 * @author zahari.mikov
 */
@Getter
@Setter
@NoArgsConstructor
public class BatchValidationRequest {
    private List<String> numbers;
    private Integer batchSize;
    private Long delayBetweenBatchesMs;
    private boolean forceRefresh;

    public BatchValidationRequest(final List<String> numbers) {
        this.numbers = numbers;
    }
}
