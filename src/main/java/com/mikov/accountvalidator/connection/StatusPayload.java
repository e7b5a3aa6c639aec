package com.mikov.accountvalidator.connection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

/**
 * Status (about) text of an account and when it was set, in epoch seconds.
 */
@Getter
public class StatusPayload {
    private final String status;
    private final Long setAt;

    @JsonCreator
    public StatusPayload(@JsonProperty("status") final String status, @JsonProperty("setAt") final Long setAt) {
        this.status = status;
        this.setAt = setAt;
    }
}
