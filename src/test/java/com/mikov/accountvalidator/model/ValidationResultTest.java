package com.mikov.accountvalidator.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationResultTest {

    @Test
    void copyIsDeep() {
        final var original = ValidationResult.create("1", "1@s.whatsapp.net", 42);
        original.getBan().addDetectionMethod("registration_verified");
        original.getDiagnostics().getFallbacksUsed().add("status_retry_1");
        original.getRecommendations().add("Maintain natural usage patterns");

        final var copy = original.copy();
        copy.getBan().addDetectionMethod("changed");
        copy.getDiagnostics().getFallbacksUsed().clear();
        copy.getRecommendations().clear();
        copy.getAccount().setHasStatus(true);

        assertThat(original.getBan().getDetectionMethods()).containsExactly("registration_verified");
        assertThat(original.getDiagnostics().getFallbacksUsed()).containsExactly("status_retry_1");
        assertThat(original.getRecommendations()).hasSize(1);
        assertThat(original.getAccount().isHasStatus()).isFalse();
    }

    @Test
    void copyEqualsOriginal() {
        final var original = ValidationResult.create("1", "1@s.whatsapp.net", 42);
        original.setRegistered(true);
        original.setSummary("Active and verified");

        assertThat(original.copy()).isEqualTo(original);
    }

    @Test
    void accountAgeBuckets() {
        assertThat(AccountAge.fromAgeInDays(29.9)).isEqualTo(AccountAge.NEW);
        assertThat(AccountAge.fromAgeInDays(30)).isEqualTo(AccountAge.MEDIUM);
        assertThat(AccountAge.fromAgeInDays(179)).isEqualTo(AccountAge.MEDIUM);
        assertThat(AccountAge.fromAgeInDays(180)).isEqualTo(AccountAge.OLD);
    }
}
