package com.mikov.accountvalidator.plugin;

import com.mikov.accountvalidator.model.ValidationResult;
import com.mikov.accountvalidator.model.ValidatorConfig;

/**
 * Extension hook run by the validation pipeline.
 *
 * @author zahari.mikov
 */
public interface ValidationPlugin {

    String getName();

    String getVersion();

    default void onRegister(final ValidatorConfig config) {
    }

    /**
     * Called once a registered account has been classified and its review
     * options derived, before the result is finalized and cached.
     *
     * @param result The result being built; plugins may add recommendations
     */
    default void onPostValidation(final ValidationResult result) {
    }
}
