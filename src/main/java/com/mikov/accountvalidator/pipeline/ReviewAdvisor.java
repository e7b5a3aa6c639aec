package com.mikov.accountvalidator.pipeline;

import com.mikov.accountvalidator.model.BanType;
import com.mikov.accountvalidator.model.ReviewType;
import com.mikov.accountvalidator.model.ValidationResult;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Derives review options and recommendations from the ban verdict.
 *
 * @author zahari.mikov
 */
public class ReviewAdvisor {

    static final List<String> NORMAL_OPERATION = List.of(
            "Account is functioning normally",
            "Maintain natural usage patterns");

    private static final Map<BanType, ReviewOption> REVIEW_OPTIONS = new EnumMap<>(BanType.class);

    static {
        REVIEW_OPTIONS.put(BanType.SPAM, new ReviewOption(true, ReviewType.SELF_APPEAL, "24-48 hours", List.of(
                "Submit self-appeal through WhatsApp app",
                "Avoid bulk messaging for one week",
                "Review WhatsApp business policies")));
        REVIEW_OPTIONS.put(BanType.VIOLATION, new ReviewOption(true, ReviewType.SUPPORT_REQUIRED, "3-7 days", List.of(
                "Contact WhatsApp support directly",
                "Prepare identity verification",
                "Review terms of service violations")));
        REVIEW_OPTIONS.put(BanType.PERMANENT, new ReviewOption(false, ReviewType.NONE, null, List.of(
                "Ban is permanent - Consider new number",
                "Ensure compliance before new account")));
    }

    public void apply(final ValidationResult result) {
        if (!result.getBan().isBanned()) {
            result.getRecommendations().addAll(NORMAL_OPERATION);
            return;
        }

        final var option = REVIEW_OPTIONS.get(result.getBan().getType());
        if (option == null) {
            return;
        }

        final var review = result.getReview();
        review.setAvailable(option.available());
        review.setType(option.type());
        review.setEstimatedTime(option.estimatedTime());
        result.getRecommendations().addAll(option.steps());
    }

    private record ReviewOption(boolean available, ReviewType type, String estimatedTime, List<String> steps) {
    }
}
