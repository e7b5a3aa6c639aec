package com.mikov.accountvalidator.export;

import com.mikov.accountvalidator.model.AccountAge;
import com.mikov.accountvalidator.model.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Plain-text validation reports.
 *
 * @author zahari.mikov
 */
public class ReportFormatter {

    private static final String RULE = "=".repeat(60);

    public String formatSimple(final ValidationResult result) {
        final var lines = new ArrayList<String>();
        lines.add("WhatsApp Account Validation");
        lines.add("");
        lines.add("Number: +" + result.getNumber());
        lines.add("Status: " + (result.isActive() ? "Active" : "Inactive"));
        lines.add("Registered: " + yesNo(result.isRegistered()));
        lines.add("");

        if (result.getBan().isBanned()) {
            lines.add("Ban Type: " + result.getBan().getType().getValue());
            lines.add("Review Available: " + yesNo(result.getReview().isAvailable()));
            if (result.getReview().getEstimatedTime() != null) {
                lines.add("Review Time: " + result.getReview().getEstimatedTime());
            }
        } else {
            lines.add("No restrictions detected");
        }

        if (!result.getRecommendations().isEmpty()) {
            lines.add("");
            lines.add("Recommendations:");
            appendNumbered(lines, result.getRecommendations());
        }
        return String.join("\n", lines);
    }

    public String formatDetailed(final ValidationResult result) {
        final var lines = new ArrayList<String>();
        final var ban = result.getBan();
        final var diagnostics = result.getDiagnostics();

        lines.add(RULE);
        lines.add("WhatsApp Account Validation Report");
        lines.add(RULE);
        lines.add("");

        lines.add("[Account Information]");
        lines.add("Number: +" + result.getNumber());
        lines.add("Status: " + (result.isActive() ? "Active" : "Inactive"));
        lines.add("Registered: " + yesNo(result.isRegistered()));
        lines.add("Type: " + (result.getAccount().isBusinessAccount() ? "Business" : "Personal"));
        if (result.getAccount().getAge() != AccountAge.UNKNOWN) {
            lines.add("Age: " + result.getAccount().getAge().getValue());
        }
        lines.add("");

        lines.add("[Ban Analysis]");
        lines.add("Banned: " + yesNo(ban.isBanned()));
        if (ban.isBanned()) {
            lines.add("Type: " + ban.getType().getValue());
            lines.add("Detection Methods: " + String.join(", ", ban.getDetectionMethods()));
            if (ban.getMlConfidence() != null) {
                lines.add(String.format(Locale.ROOT, "ML Confidence: %.1f%%", ban.getMlConfidence() * 100));
            }

            lines.add("");
            lines.add("[Review Information]");
            lines.add("Available: " + yesNo(result.getReview().isAvailable()));
            lines.add("Type: " + result.getReview().getType().getValue());
            if (result.getReview().getEstimatedTime() != null) {
                lines.add("Estimated Time: " + result.getReview().getEstimatedTime());
            }
        }
        lines.add("");

        lines.add("[Diagnostics]");
        lines.add("Response Time: " + diagnostics.getResponseTimeMs() + "ms");
        lines.add("Probes Executed: " + diagnostics.getProbesExecuted());
        lines.add("Probes Successful: " + diagnostics.getProbesSuccessful());
        lines.add(String.format(Locale.ROOT, "Success Rate: %.1f%%", diagnostics.successRate() * 100));
        if (!diagnostics.getFallbacksUsed().isEmpty()) {
            lines.add("Fallbacks Used: " + diagnostics.getFallbacksUsed().size());
        }
        lines.add("");

        if (!result.getRecommendations().isEmpty()) {
            lines.add("[Recommendations]");
            appendNumbered(lines, result.getRecommendations());
            lines.add("");
        }

        lines.add(RULE);
        lines.add("Summary: " + result.getSummary());
        lines.add(RULE);
        return String.join("\n", lines);
    }

    private static void appendNumbered(final List<String> lines, final List<String> items) {
        for (var i = 0; i < items.size(); i++) {
            lines.add((i + 1) + ". " + items.get(i));
        }
    }

    private static String yesNo(final boolean value) {
        return value ? "Yes" : "No";
    }
}
