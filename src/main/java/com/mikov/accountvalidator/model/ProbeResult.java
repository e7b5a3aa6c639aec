package com.mikov.accountvalidator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProbeResult {
    private final String probeName;
    private final ProbeStatus status;
    private final long durationMs;
    private final String errorMessage;
}
