package com.mikov.accountvalidator.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Classification of why an account is unreachable.
 *
 * @author zahari.mikov
 */
@Getter
@RequiredArgsConstructor
public enum BanType {
    NONE("none"),
    SPAM("spam"),
    VIOLATION("violation"),
    PERMANENT("permanent");

    @JsonValue
    private final String value;
}
