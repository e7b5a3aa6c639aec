package com.mikov.accountvalidator.probe;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Counts for the probe stage alone, registration excluded.
 */
@Getter
@RequiredArgsConstructor
public class ProbeStageSummary {
    private final int executed;
    private final int successful;

    public boolean allFailed() {
        return executed > 0 && successful == 0;
    }
}
