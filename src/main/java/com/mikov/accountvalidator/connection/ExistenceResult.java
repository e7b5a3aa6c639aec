package com.mikov.accountvalidator.connection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

@Getter
public class ExistenceResult {
    private final String jid;
    private final boolean exists;

    @JsonCreator
    public ExistenceResult(@JsonProperty("jid") final String jid, @JsonProperty("exists") final boolean exists) {
        this.jid = jid;
        this.exists = exists;
    }
}
