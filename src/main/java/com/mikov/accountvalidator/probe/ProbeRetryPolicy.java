package com.mikov.accountvalidator.probe;

import org.springframework.retry.RetryContext;
import org.springframework.retry.policy.SimpleRetryPolicy;

/**
 * Retries a probe up to a fixed number of attempts unless the last failure was fatal.
 */
public class ProbeRetryPolicy extends SimpleRetryPolicy {

    public ProbeRetryPolicy(final int maxAttempts) {
        super(maxAttempts);
    }

    @Override
    public boolean canRetry(final RetryContext context) {
        final var lastFailure = context.getLastThrowable();
        if (lastFailure instanceof ProbeFailureException failure && failure.isFatal()) {
            return false;
        }
        return context.getRetryCount() < getMaxAttempts();
    }
}
