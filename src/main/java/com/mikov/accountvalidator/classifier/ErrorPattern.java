package com.mikov.accountvalidator.classifier;

import com.mikov.accountvalidator.model.BanType;
import lombok.Getter;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Static keyword table for each ban kind. Keywords are matched against
 * lowercase error text and against extracted error codes.
 *
 * @author zahari.mikov
 */
@Getter
public enum ErrorPattern {
    SPAM(BanType.SPAM, 1.0, 0.85,
            List.of("spam", "rate limit", "too many", "blocked temporarily", "429", "rate_limit")),
    VIOLATION(BanType.VIOLATION, 1.2, 0.90,
            List.of("violation", "terms", "policy", "forbidden", "403", "401", "unauthorized")),
    PERMANENT(BanType.PERMANENT, 1.5, 0.95,
            List.of("permanently", "terminated", "deleted", "404", "banned from using", "account_deleted"));

    private final BanType banType;
    private final double weight;
    private final double confidence;
    private final List<String> keywords;

    ErrorPattern(final BanType banType, final double weight, final double confidence, final List<String> keywords) {
        this.banType = banType;
        this.weight = weight;
        this.confidence = confidence;
        this.keywords = keywords;
    }

    public int countKeywordMatches(final String errorText) {
        var matches = 0;
        for (final var keyword : keywords) {
            if (errorText.contains(keyword)) {
                matches++;
            }
        }
        return matches;
    }

    public boolean matchesCode(final String code) {
        return code != null && keywords.contains(code.toLowerCase(Locale.ROOT));
    }

    /**
     * First pattern, in table order, with at least one keyword in the text.
     */
    public static Optional<ErrorPattern> firstMatch(final String errorText) {
        for (final var pattern : values()) {
            if (pattern.countKeywordMatches(errorText) > 0) {
                return Optional.of(pattern);
            }
        }
        return Optional.empty();
    }
}
