package com.mikov.accountvalidator.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Probe counters and error evidence gathered during one validation.
 *
 * @author zahari.mikov
 */
@Data
public class Diagnostics {
    private Long responseTimeMs;
    private int probesExecuted;
    private int probesSuccessful;
    private List<ErrorDetail> errorDetails = new ArrayList<>();
    private List<String> fallbacksUsed = new ArrayList<>();
    private List<ProbeResult> probeResults = new ArrayList<>();

    public void incrementExecuted() {
        probesExecuted++;
    }

    public void incrementSuccessful() {
        probesSuccessful++;
    }

    /**
     * Share of executed probes that succeeded, 0 when nothing ran.
     */
    public double successRate() {
        return probesExecuted > 0 ? (double) probesSuccessful / probesExecuted : 0.0;
    }

    Diagnostics copy() {
        final var copy = new Diagnostics();
        copy.responseTimeMs = responseTimeMs;
        copy.probesExecuted = probesExecuted;
        copy.probesSuccessful = probesSuccessful;
        copy.errorDetails = new ArrayList<>(errorDetails);
        copy.fallbacksUsed = new ArrayList<>(fallbacksUsed);
        copy.probeResults = new ArrayList<>(probeResults);
        return copy;
    }
}
