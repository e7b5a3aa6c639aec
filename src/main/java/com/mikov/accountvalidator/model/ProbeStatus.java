package com.mikov.accountvalidator.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ProbeStatus {
    SUCCESS("success"),
    FAILED("failed"),
    TIMEOUT("timeout");

    @JsonValue
    private final String value;
}
