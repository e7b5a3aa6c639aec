package com.mikov.accountvalidator.events;

import com.mikov.accountvalidator.health.HealthStatus;
import com.mikov.accountvalidator.model.ValidationResult;

import java.util.List;

/**
 * Receives validation lifecycle notifications. All methods default to no-ops,
 * so implementations override only the events they care about.
 *
 * @author zahari.mikov
 */
public interface ValidationListener {

    default void onValidationStart(final String number) {
    }

    default void onCacheHit(final String number, final ValidationResult result) {
    }

    default void onValidationComplete(final String number, final ValidationResult result) {
    }

    default void onValidationError(final String number, final Throwable error) {
    }

    default void onBatchStart(final int total) {
    }

    /**
     * Called after each chunk of a batch has finished.
     *
     * @param completed Number of accounts validated so far
     * @param total Size of the whole batch
     */
    default void onBatchProgress(final int completed, final int total) {
    }

    default void onBatchComplete(final List<ValidationResult> results) {
    }

    default void onHealthDegraded(final HealthStatus health) {
    }

    default void onHealthCritical(final HealthStatus health) {
    }

    default void onPluginRegistered(final String name, final String version) {
    }

    default void onPluginError(final String plugin, final String hook, final Throwable error) {
    }
}
