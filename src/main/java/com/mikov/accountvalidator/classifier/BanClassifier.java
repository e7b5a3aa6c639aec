package com.mikov.accountvalidator.classifier;

import com.mikov.accountvalidator.model.ErrorDetail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Pattern-based ban classifier. Extracts features from accumulated error
 * evidence and scores each {@link ErrorPattern} with weighted keyword and
 * error-code matches.
 *
 * @author zahari.mikov
 */
public class BanClassifier {
    private static final Logger logger = LoggerFactory.getLogger(BanClassifier.class);

    private static final double CODE_MATCH_MULTIPLIER = 1.5;
    private static final double LOW_SUCCESS_RATE = 0.3;
    private static final double LOW_SUCCESS_RATE_PENALTY = 0.5;
    private static final int FAILURE_PATTERN_THRESHOLD = 2;
    private static final double FAILURE_PATTERN_BONUS = 0.3;
    private static final double NORMALIZATION_DIVISOR = 5.0;
    private static final double MIN_SCORE = 0.3;
    private static final int SEQUENTIAL_FAILURE_COUNT = 3;
    private static final long RAPID_INTERVAL_MS = 1000;

    private static final int MAX_HISTORY = 1000;
    private static final int MIN_ACCURACY_SAMPLES = 10;
    private static final int ACCURACY_SAMPLE_WINDOW = 100;
    // no ground truth is available, so the estimate is a fixed placeholder
    private static final double PLACEHOLDER_ACCURACY = 0.87;

    private final Clock clock;
    private final Deque<HistoryEntry> history = new ArrayDeque<>();

    public BanClassifier(final Clock clock) {
        this.clock = clock;
    }

    public Prediction analyze(final List<ErrorDetail> errorDetails, final double successRate) {
        final var features = extractFeatures(errorDetails, successRate);
        final var prediction = predict(features);
        logger.debug("Classified {} errors as {} (score {})", features.getErrorCount(),
                prediction.getType(), prediction.getScore());

        updateHistory(new HistoryEntry(features, prediction, clock.millis()));
        return prediction;
    }

    /**
     * Placeholder accuracy estimate; {@code null} until enough analyses have run.
     */
    public synchronized AccuracyEstimate getAccuracy() {
        if (history.size() < MIN_ACCURACY_SAMPLES) {
            return null;
        }
        return AccuracyEstimate.builder()
                .sampleSize(Math.min(history.size(), ACCURACY_SAMPLE_WINDOW))
                .estimatedAccuracy(PLACEHOLDER_ACCURACY)
                .build();
    }

    public synchronized int getHistorySize() {
        return history.size();
    }

    FeatureSet extractFeatures(final List<ErrorDetail> errorDetails, final double successRate) {
        final var errorText = errorDetails.stream()
                .map(e -> e.getErrorMessage() == null ? "" : e.getErrorMessage().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));

        final var errorCodes = errorDetails.stream()
                .map(ErrorDetail::getErrorCode)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        final var builder = FeatureSet.builder()
                .errorText(errorText)
                .errorCodes(new ArrayList<>(errorCodes))
                .errorCount(errorDetails.size())
                .successRate(successRate)
                .failurePatterns(identifyFailurePatterns(errorDetails));
        analyzeTiming(errorDetails, builder);
        return builder.build();
    }

    private Prediction predict(final FeatureSet features) {
        Prediction best = null;
        var bestScore = 0.0;

        for (final var pattern : ErrorPattern.values()) {
            var raw = 0.0;
            var matchCount = 0;

            final var keywordMatches = pattern.countKeywordMatches(features.getErrorText());
            raw += keywordMatches * pattern.getWeight();
            matchCount += keywordMatches;

            // a code that is also found as a keyword in the text counts twice
            for (final var code : features.getErrorCodes()) {
                if (pattern.matchesCode(code)) {
                    raw += pattern.getWeight() * CODE_MATCH_MULTIPLIER;
                    matchCount++;
                }
            }

            if (features.getSuccessRate() < LOW_SUCCESS_RATE) {
                raw += LOW_SUCCESS_RATE_PENALTY;
            }

            final var failurePatternCount = features.getFailurePatterns().size();
            if (failurePatternCount > FAILURE_PATTERN_THRESHOLD) {
                raw += FAILURE_PATTERN_BONUS * failurePatternCount;
            }

            final var normalized = Math.min(raw / NORMALIZATION_DIVISOR, 1.0);
            // strictly greater: on a tie the pattern earlier in the table wins
            if (normalized > bestScore) {
                bestScore = normalized;
                best = Prediction.builder()
                        .type(pattern.getBanType())
                        .confidence(normalized)
                        .score(normalized)
                        .baseConfidence(matchCount > 0 ? pattern.getConfidence() : 0.0)
                        .matchCount(matchCount)
                        .build();
            }
        }

        if (best == null || bestScore < MIN_SCORE) {
            return Prediction.none();
        }
        return best;
    }

    private List<String> identifyFailurePatterns(final List<ErrorDetail> errorDetails) {
        final var patterns = new ArrayList<String>();
        if (errorDetails.size() >= SEQUENTIAL_FAILURE_COUNT) {
            patterns.add("sequential_failures");
        }

        final var codeCounts = new LinkedHashMap<String, Integer>();
        for (final var error : errorDetails) {
            if (error.getErrorCode() != null) {
                codeCounts.merge(error.getErrorCode(), 1, Integer::sum);
            }
        }
        codeCounts.forEach((code, count) -> {
            if (count >= 2) {
                patterns.add("repeated_" + code);
            }
        });
        return patterns;
    }

    private void analyzeTiming(final List<ErrorDetail> errorDetails, final FeatureSet.FeatureSetBuilder builder) {
        final var times = errorDetails.stream()
                .map(ErrorDetail::getTimestampMs)
                .filter(t -> t > 0)
                .collect(Collectors.toList());

        if (times.size() < 2) {
            builder.timing(TimingPattern.INSUFFICIENT_DATA);
            return;
        }

        var intervalSum = 0L;
        for (var i = 1; i < times.size(); i++) {
            intervalSum += times.get(i) - times.get(i - 1);
        }
        final var average = (double) intervalSum / (times.size() - 1);
        builder.timing(average < RAPID_INTERVAL_MS ? TimingPattern.RAPID : TimingPattern.DELAYED)
                .averageErrorIntervalMs(average);
    }

    private synchronized void updateHistory(final HistoryEntry entry) {
        history.addLast(entry);
        if (history.size() > MAX_HISTORY) {
            history.removeFirst();
        }
    }

    private static final class HistoryEntry {
        private final FeatureSet features;
        private final Prediction prediction;
        private final long timestamp;

        private HistoryEntry(final FeatureSet features, final Prediction prediction, final long timestamp) {
            this.features = features;
            this.prediction = prediction;
            this.timestamp = timestamp;
        }
    }
}
