package com.mikov.accountvalidator.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Age class of an account, derived from the time its status text was set.
 */
@Getter
@RequiredArgsConstructor
public enum AccountAge {
    NEW("new"),
    MEDIUM("medium"),
    OLD("old"),
    UNKNOWN("unknown");

    private static final long NEW_MAX_DAYS = 30;
    private static final long MEDIUM_MAX_DAYS = 180;

    @JsonValue
    private final String value;

    public static AccountAge fromAgeInDays(final double ageInDays) {
        if (ageInDays < NEW_MAX_DAYS) {
            return NEW;
        }
        return ageInDays < MEDIUM_MAX_DAYS ? MEDIUM : OLD;
    }
}
