package com.mikov.accountvalidator.export;

import com.mikov.accountvalidator.model.AccountAge;
import com.mikov.accountvalidator.model.BanType;
import com.mikov.accountvalidator.model.ReviewType;
import com.mikov.accountvalidator.model.ValidationResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReportFormatterTest {

    private final ReportFormatter formatter = new ReportFormatter();

    @Test
    void simpleReportForActiveAccount() {
        final var result = ValidationResult.create("15550100000", "15550100000@s.whatsapp.net", 0);
        result.setRegistered(true);
        result.setActive(true);
        result.getRecommendations().add("Account is functioning normally");

        final var report = formatter.formatSimple(result);

        assertThat(report).startsWith("WhatsApp Account Validation\n\nNumber: +15550100000\nStatus: Active\nRegistered: Yes");
        assertThat(report).contains("No restrictions detected");
        assertThat(report).endsWith("Recommendations:\n1. Account is functioning normally");
    }

    @Test
    void simpleReportForBannedAccount() {
        final var result = spamBanned();

        final var report = formatter.formatSimple(result);

        assertThat(report).contains("Ban Type: spam", "Review Available: Yes", "Review Time: 24-48 hours");
        assertThat(report).doesNotContain("No restrictions detected");
    }

    @Test
    void detailedReportIncludesDiagnostics() {
        final var result = spamBanned();
        result.getAccount().setAge(AccountAge.MEDIUM);
        result.getDiagnostics().setResponseTimeMs(1234L);
        result.getDiagnostics().setProbesExecuted(5);
        result.getDiagnostics().setProbesSuccessful(4);
        result.getDiagnostics().getFallbacksUsed().add("status_retry_1");

        final var report = formatter.formatDetailed(result);

        assertThat(report).contains(
                "[Account Information]",
                "Age: medium",
                "Detection Methods: ml_pattern_detection",
                "ML Confidence: 42.0%",
                "[Review Information]",
                "Type: self_appeal",
                "Response Time: 1234ms",
                "Success Rate: 80.0%",
                "Fallbacks Used: 1",
                "Summary: Spam restrictions detected");
    }

    @Test
    void detailedReportHandlesNoExecutedProbes() {
        final var result = ValidationResult.create("1", "1@s.whatsapp.net", 0);

        assertThat(formatter.formatDetailed(result)).contains("Success Rate: 0.0%").doesNotContain("Age:");
    }

    private static ValidationResult spamBanned() {
        final var result = ValidationResult.create("15550100000", "15550100000@s.whatsapp.net", 0);
        result.setRegistered(true);
        result.setActive(true);
        result.getBan().setBanned(true);
        result.getBan().setType(BanType.SPAM);
        result.getBan().addDetectionMethod("ml_pattern_detection");
        result.getBan().setMlConfidence(0.42);
        result.getReview().setAvailable(true);
        result.getReview().setType(ReviewType.SELF_APPEAL);
        result.getReview().setEstimatedTime("24-48 hours");
        result.setSummary("Spam restrictions detected");
        return result;
    }
}
