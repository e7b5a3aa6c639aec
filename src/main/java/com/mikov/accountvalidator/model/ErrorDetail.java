package com.mikov.accountvalidator.model;

import lombok.Builder;
import lombok.Data;

/**
 * One piece of error evidence captured while validating an account.
 *
 * @author zahari.mikov
 */
@Data
@Builder
public class ErrorDetail {
    private final String stage;
    private final String errorMessage;
    private final String errorCode;
    private final long timestampMs;
}
