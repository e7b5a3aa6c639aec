package com.mikov.accountvalidator.health;

import com.mikov.accountvalidator.events.ValidationEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Tracks consecutive validation failures. Degraded and critical events fire on
 * every failure at or above their thresholds; one success resets to healthy.
 *
 * @author zahari.mikov
 */
public class HealthMonitor {
    private static final Logger logger = LoggerFactory.getLogger(HealthMonitor.class);

    private final int degradedThreshold;
    private final int criticalThreshold;
    private final ValidationEventPublisher publisher;
    private final Clock clock;

    private HealthState state = HealthState.HEALTHY;
    private long lastCheck;
    private int consecutiveFailures;
    private long totalChecks;

    public HealthMonitor(final int degradedThreshold, final int criticalThreshold,
                         final ValidationEventPublisher publisher, final Clock clock) {
        this.degradedThreshold = degradedThreshold;
        this.criticalThreshold = criticalThreshold;
        this.publisher = publisher;
        this.clock = clock;
        this.lastCheck = clock.millis();
    }

    public void recordSuccess() {
        synchronized (this) {
            totalChecks++;
            consecutiveFailures = 0;
            state = HealthState.HEALTHY;
            lastCheck = clock.millis();
        }
    }

    public void recordFailure() {
        final HealthStatus snapshot;
        final boolean degraded;
        final boolean critical;
        synchronized (this) {
            totalChecks++;
            consecutiveFailures++;
            degraded = consecutiveFailures >= degradedThreshold;
            critical = consecutiveFailures >= criticalThreshold;
            if (critical) {
                state = HealthState.UNHEALTHY;
            } else if (degraded) {
                state = HealthState.DEGRADED;
            }
            lastCheck = clock.millis();
            snapshot = snapshot();
        }

        if (degraded) {
            logger.warn("Validator health degraded after {} consecutive failures", snapshot.getConsecutiveFailures());
            publisher.healthDegraded(snapshot);
        }
        if (critical) {
            logger.error("Validator health critical after {} consecutive failures", snapshot.getConsecutiveFailures());
            publisher.healthCritical(snapshot);
        }
    }

    public synchronized HealthStatus getHealth() {
        return snapshot();
    }

    private HealthStatus snapshot() {
        return HealthStatus.builder()
                .status(state)
                .lastCheck(lastCheck)
                .consecutiveFailures(consecutiveFailures)
                .totalChecks(totalChecks)
                .build();
    }
}
