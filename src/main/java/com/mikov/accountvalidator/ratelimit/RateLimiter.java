package com.mikov.accountvalidator.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.Sleeper;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window limiter: at most {@code maxRequests} admissions in any trailing
 * window of {@code windowMs}. Callers over budget wait until the oldest admission
 * leaves the window.
 *
 * @author zahari.mikov
 */
public class RateLimiter {
    private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

    private final int maxRequests;
    private final long windowMs;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Deque<Long> requests = new ArrayDeque<>();

    public RateLimiter(final int maxRequests, final long windowMs, final Clock clock, final Sleeper sleeper) {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be positive");
        }
        this.maxRequests = maxRequests;
        this.windowMs = windowMs;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until a slot is free, then records the admission.
     *
     * @throws InterruptedException if interrupted while waiting for a slot
     */
    public void acquire() throws InterruptedException {
        while (true) {
            final long waitMs;
            synchronized (this) {
                final var now = clock.millis();
                prune(now);

                if (requests.size() < maxRequests) {
                    requests.addLast(now);
                    return;
                }
                waitMs = windowMs - (now - requests.peekFirst());
            }

            logger.debug("Rate limit of {} requests per {}ms reached, waiting {}ms", maxRequests, windowMs, waitMs);
            // the lock is released while waiting; the whole check runs again on wake-up
            sleeper.sleep(Math.max(waitMs, 1));
        }
    }

    public synchronized void reset() {
        requests.clear();
    }

    public synchronized RateLimitStatus status() {
        prune(clock.millis());
        final var active = requests.size();
        return RateLimitStatus.builder()
                .activeRequests(active)
                .maxRequests(maxRequests)
                .remaining(Math.max(0, maxRequests - active))
                .resetAt(active > 0 ? requests.peekFirst() + windowMs : null)
                .build();
    }

    private void prune(final long now) {
        while (!requests.isEmpty() && now - requests.peekFirst() >= windowMs) {
            requests.pollFirst();
        }
    }
}
