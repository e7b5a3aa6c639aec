package com.mikov.accountvalidator.probe;

import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

/**
 * Back-off that waits {@code baseDelayMs * n} before the n-th retry.
 */
public class LinearBackOffPolicy implements BackOffPolicy {

    private final long baseDelayMs;
    private final Sleeper sleeper;

    public LinearBackOffPolicy(final long baseDelayMs, final Sleeper sleeper) {
        this.baseDelayMs = baseDelayMs;
        this.sleeper = sleeper;
    }

    @Override
    public BackOffContext start(final RetryContext context) {
        return new LinearBackOffContext();
    }

    @Override
    public void backOff(final BackOffContext backOffContext) throws BackOffInterruptedException {
        final var context = (LinearBackOffContext) backOffContext;
        context.attempt++;
        try {
            sleeper.sleep(baseDelayMs * context.attempt);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Interrupted before retry " + context.attempt, e);
        }
    }

    private static final class LinearBackOffContext implements BackOffContext {
        private int attempt;
    }
}
