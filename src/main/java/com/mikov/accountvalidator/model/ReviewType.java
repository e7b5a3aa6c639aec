package com.mikov.accountvalidator.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ReviewType {
    NONE("none"),
    SELF_APPEAL("self_appeal"),
    SUPPORT_REQUIRED("support_required");

    @JsonValue
    private final String value;
}
