package com.mikov.accountvalidator.analytics;

import com.mikov.accountvalidator.model.ValidationResult;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Running counters over completed validations, with a short history used for
 * trend detection.
 *
 * @author zahari.mikov
 */
public class AnalyticsEngine {

    private static final int MAX_HISTORY = 1000;
    private static final int MIN_TREND_SAMPLES = 10;
    private static final int TREND_WINDOW = 50;
    private static final double HIGH_BAN_RATE_TREND = 0.3;
    private static final double HIGH_BAN_RATE = 0.5;
    private static final double SLOW_RESPONSE_MS = 10_000;
    private static final double HIGH_FAILURE_RATE = 0.3;

    private final Clock clock;
    private final Deque<HistoryEntry> history = new ArrayDeque<>();
    private final Map<String, Long> banTypes = new LinkedHashMap<>();
    private final Map<String, Long> detectionStats = new LinkedHashMap<>();
    private long totalValidations;
    private long successfulValidations;
    private long failedValidations;
    private long bannedAccounts;
    private long activeAccounts;
    private double avgResponseTimeMs;

    public AnalyticsEngine(final Clock clock) {
        this.clock = clock;
    }

    public synchronized void record(final ValidationResult result) {
        totalValidations++;

        final var ban = result.getBan();
        if (result.isRegistered()) {
            successfulValidations++;
            if (ban.isBanned()) {
                bannedAccounts++;
                banTypes.merge(ban.getType().getValue(), 1L, Long::sum);
            } else {
                activeAccounts++;
            }
        } else {
            failedValidations++;
        }

        final var responseTime = result.getDiagnostics().getResponseTimeMs() != null
                ? result.getDiagnostics().getResponseTimeMs() : 0L;
        avgResponseTimeMs = ((avgResponseTimeMs * (totalValidations - 1)) + responseTime) / totalValidations;

        for (final var method : ban.getDetectionMethods()) {
            detectionStats.merge(method, 1L, Long::sum);
        }

        history.addLast(new HistoryEntry(clock.millis(), ban.isBanned(), responseTime));
        if (history.size() > MAX_HISTORY) {
            history.removeFirst();
        }
    }

    public synchronized AnalyticsReport getReport() {
        final var trends = analyzeTrends();
        return AnalyticsReport.builder()
                .summary(AnalyticsMetrics.builder()
                        .totalValidations(totalValidations)
                        .successfulValidations(successfulValidations)
                        .failedValidations(failedValidations)
                        .bannedAccounts(bannedAccounts)
                        .activeAccounts(activeAccounts)
                        .banTypes(new LinkedHashMap<>(banTypes))
                        .avgResponseTimeMs(avgResponseTimeMs)
                        .detectionStats(new LinkedHashMap<>(detectionStats))
                        .build())
                .trends(trends)
                .recommendations(recommendations(trends))
                .build();
    }

    public synchronized void reset() {
        history.clear();
        banTypes.clear();
        detectionStats.clear();
        totalValidations = 0;
        successfulValidations = 0;
        failedValidations = 0;
        bannedAccounts = 0;
        activeAccounts = 0;
        avgResponseTimeMs = 0;
    }

    private TrendReport analyzeTrends() {
        if (history.size() < MIN_TREND_SAMPLES) {
            return TrendReport.insufficientData();
        }

        final var recent = new ArrayList<>(history).subList(Math.max(0, history.size() - TREND_WINDOW), history.size());
        final var banned = recent.stream().filter(HistoryEntry::banned).count();
        final var banRate = (double) banned / recent.size();
        final var avgResponse = recent.stream().mapToLong(HistoryEntry::responseTimeMs).average().orElse(0);

        return TrendReport.builder()
                .status("ok")
                .recentBanRate(banRate)
                .avgResponseTimeMs(avgResponse)
                .trend(banRate > HIGH_BAN_RATE_TREND ? "high_ban_rate" : "normal")
                .build();
    }

    private List<String> recommendations(final TrendReport trends) {
        final var recommendations = new ArrayList<String>();
        if (trends.hasData() && trends.getRecentBanRate() > HIGH_BAN_RATE) {
            recommendations.add("High ban rate detected - Consider reviewing account selection criteria");
        }
        if (trends.hasData() && trends.getAvgResponseTimeMs() > SLOW_RESPONSE_MS) {
            recommendations.add("Slow response times - Consider optimizing network or reducing timeout values");
        }
        if (totalValidations > 0 && (double) failedValidations / totalValidations > HIGH_FAILURE_RATE) {
            recommendations.add("High failure rate - Check connection stability");
        }
        return recommendations;
    }

    private record HistoryEntry(long timestamp, boolean banned, long responseTimeMs) {
    }
}
