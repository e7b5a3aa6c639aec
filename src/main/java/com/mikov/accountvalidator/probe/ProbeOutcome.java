package com.mikov.accountvalidator.probe;

import com.mikov.accountvalidator.model.ErrorDetail;
import com.mikov.accountvalidator.model.ProbeResult;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything one probe produced, gathered on its own task and merged into the
 * validation result after all probes have finished.
 */
@Getter
class ProbeOutcome {
    private final ProbeType type;
    private final List<ErrorDetail> errors = new ArrayList<>();
    private final List<String> fallbacks = new ArrayList<>();
    private boolean successful;
    private Object payload;
    private ProbeResult probeResult;

    ProbeOutcome(final ProbeType type) {
        this.type = type;
    }

    void succeed(final Object payload) {
        this.successful = true;
        this.payload = payload;
    }

    void addError(final ErrorDetail error) {
        errors.add(error);
    }

    void addFallback(final String fallback) {
        fallbacks.add(fallback);
    }

    void setProbeResult(final ProbeResult probeResult) {
        this.probeResult = probeResult;
    }
}
