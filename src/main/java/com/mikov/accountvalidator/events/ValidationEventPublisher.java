package com.mikov.accountvalidator.events;

import com.mikov.accountvalidator.health.HealthStatus;
import com.mikov.accountvalidator.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans lifecycle events out to every registered {@link ValidationListener}.
 * A listener that throws is logged and skipped; the remaining listeners still
 * receive the event and the caller never sees the failure.
 *
 * @author zahari.mikov
 */
public class ValidationEventPublisher {
    private static final Logger logger = LoggerFactory.getLogger(ValidationEventPublisher.class);

    private final List<ValidationListener> listeners = new CopyOnWriteArrayList<>();

    public ValidationEventPublisher(final List<ValidationListener> listeners) {
        this.listeners.addAll(listeners);
    }

    public void addListener(final ValidationListener listener) {
        listeners.add(listener);
    }

    public void removeListener(final ValidationListener listener) {
        listeners.remove(listener);
    }

    /**
     * Publisher that reaches the registered listeners plus one extra listener,
     * without registering it here.
     */
    public ValidationEventPublisher including(final ValidationListener listener) {
        final var combined = new ArrayList<>(listeners);
        combined.add(listener);
        return new ValidationEventPublisher(combined);
    }

    public void validationStarted(final String number) {
        publish("validation_start", listener -> listener.onValidationStart(number));
    }

    public void cacheHit(final String number, final ValidationResult result) {
        publish("cache_hit", listener -> listener.onCacheHit(number, result));
    }

    public void validationCompleted(final String number, final ValidationResult result) {
        publish("validation_complete", listener -> listener.onValidationComplete(number, result));
    }

    public void validationFailed(final String number, final Throwable error) {
        publish("validation_error", listener -> listener.onValidationError(number, error));
    }

    public void batchStarted(final int total) {
        publish("batch_start", listener -> listener.onBatchStart(total));
    }

    public void batchProgress(final int completed, final int total) {
        publish("batch_progress", listener -> listener.onBatchProgress(completed, total));
    }

    public void batchCompleted(final List<ValidationResult> results) {
        publish("batch_complete", listener -> listener.onBatchComplete(results));
    }

    public void healthDegraded(final HealthStatus health) {
        publish("health_degraded", listener -> listener.onHealthDegraded(health));
    }

    public void healthCritical(final HealthStatus health) {
        publish("health_critical", listener -> listener.onHealthCritical(health));
    }

    public void pluginRegistered(final String name, final String version) {
        publish("plugin_registered", listener -> listener.onPluginRegistered(name, version));
    }

    public void pluginFailed(final String plugin, final String hook, final Throwable error) {
        publish("plugin_error", listener -> listener.onPluginError(plugin, hook, error));
    }

    private void publish(final String event, final Consumer<ValidationListener> dispatch) {
        for (final var listener : listeners) {
            try {
                dispatch.accept(listener);
            } catch (final Exception e) {
                logger.warn("Listener {} failed on {}: {}", listener.getClass().getSimpleName(), event, e.getMessage());
            }
        }
    }
}
