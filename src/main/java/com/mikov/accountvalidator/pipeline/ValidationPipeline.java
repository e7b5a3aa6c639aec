package com.mikov.accountvalidator.pipeline;

import com.mikov.accountvalidator.analytics.AnalyticsEngine;
import com.mikov.accountvalidator.analytics.AnalyticsReport;
import com.mikov.accountvalidator.cache.CacheStats;
import com.mikov.accountvalidator.cache.ResultCache;
import com.mikov.accountvalidator.classifier.BanClassifier;
import com.mikov.accountvalidator.classifier.ErrorPattern;
import com.mikov.accountvalidator.events.ValidationEventPublisher;
import com.mikov.accountvalidator.events.ValidationListener;
import com.mikov.accountvalidator.health.HealthMonitor;
import com.mikov.accountvalidator.health.HealthStatus;
import com.mikov.accountvalidator.model.BanType;
import com.mikov.accountvalidator.model.ErrorDetail;
import com.mikov.accountvalidator.model.ValidationResult;
import com.mikov.accountvalidator.model.ValidatorConfig;
import com.mikov.accountvalidator.plugin.PluginRegistry;
import com.mikov.accountvalidator.probe.ProbeErrorCode;
import com.mikov.accountvalidator.probe.ProbeOrchestrator;
import com.mikov.accountvalidator.probe.ProbeStageSummary;
import com.mikov.accountvalidator.ratelimit.RateLimitStatus;
import com.mikov.accountvalidator.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.Sleeper;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Top-level sequencer for account validation: rate limit, cache lookup,
 * registration, probes, classification, review derivation, plugins,
 * finalization and cache store.
 * <p>
 * {@link #validate(String)} never throws. Any fault escaping a stage is turned
 * into a result with summary "Critical validation error".
 *
 * @author zahari.mikov
 */
public class ValidationPipeline {
    private static final Logger logger = LoggerFactory.getLogger(ValidationPipeline.class);

    static final String CACHE_KEY_PREFIX = "validate:";
    static final String NOT_REGISTERED_SUMMARY = "Not registered or permanently banned";
    static final String CRITICAL_SUMMARY = "Critical validation error";

    private static final Map<BanType, String> SUMMARIES = new EnumMap<>(BanType.class);

    static {
        SUMMARIES.put(BanType.NONE, "Active and verified");
        SUMMARIES.put(BanType.SPAM, "Spam restrictions detected");
        SUMMARIES.put(BanType.VIOLATION, "Policy violation detected");
        SUMMARIES.put(BanType.PERMANENT, "Permanent ban confirmed");
    }

    private final ValidatorConfig config;
    private final ProbeOrchestrator orchestrator;
    private final BanClassifier classifier;
    private final ReviewAdvisor reviewAdvisor;
    private final PluginRegistry pluginRegistry;
    private final ValidationEventPublisher publisher;
    private final HealthMonitor healthMonitor;
    private final AnalyticsEngine analytics;
    private final ExecutorService executor;
    private final Clock clock;
    private final Sleeper sleeper;
    private final RateLimiter rateLimiter;
    private final ResultCache<ValidationResult> cache;

    public ValidationPipeline(final ValidatorConfig config,
                              final ProbeOrchestrator orchestrator,
                              final BanClassifier classifier,
                              final ReviewAdvisor reviewAdvisor,
                              final PluginRegistry pluginRegistry,
                              final ValidationEventPublisher publisher,
                              final HealthMonitor healthMonitor,
                              final AnalyticsEngine analytics,
                              final ExecutorService executor,
                              final Clock clock,
                              final Sleeper sleeper) {
        this.config = config;
        this.orchestrator = orchestrator;
        this.classifier = classifier;
        this.reviewAdvisor = reviewAdvisor;
        this.pluginRegistry = pluginRegistry;
        this.publisher = publisher;
        this.healthMonitor = healthMonitor;
        this.analytics = analytics;
        this.executor = executor;
        this.clock = clock;
        this.sleeper = sleeper;

        this.rateLimiter = config.isRateLimitEnabled()
                ? new RateLimiter(config.getRateLimitMaxRequests(), config.getRateLimitWindowMs(), clock, sleeper)
                : null;
        this.cache = config.isCacheEnabled()
                ? new ResultCache<>(config.getCacheTtlMs(), config.getCacheMaxSize(), clock)
                : null;

        logger.info("Validation pipeline ready (rate limit: {}, cache: {}, classifier: {}, parallel probes: {})",
                config.isRateLimitEnabled(), config.isCacheEnabled(), config.isClassifierEnabled(),
                config.isParallelProbes());
    }

    public ValidationResult validate(final String number) {
        return validate(number, ValidationOptions.defaults());
    }

    public ValidationResult validate(final String number, final ValidationOptions options) {
        return validate(number, options, publisher);
    }

    private ValidationResult validate(final String number, final ValidationOptions options,
                                      final ValidationEventPublisher events) {
        final var jid = normalizeJid(number);

        try {
            if (rateLimiter != null) {
                rateLimiter.acquire();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(number, ValidationResult.create(number, jid, clock.millis()), e, events);
        }

        final var cacheKey = CACHE_KEY_PREFIX + jid;
        if (cache != null && !options.isForceRefresh()) {
            final var cached = cache.get(cacheKey);
            if (cached.isPresent()) {
                logger.debug("Cache hit for {}", number);
                final var hit = cached.get().copy();
                events.cacheHit(number, hit);
                return hit;
            }
        }

        events.validationStarted(number);
        final var startedAt = clock.millis();
        final var result = ValidationResult.create(number, jid, startedAt);

        try {
            executePipeline(jid, result, startedAt);

            if (cache != null) {
                cache.set(cacheKey, result.copy());
            }
            if (analytics != null && config.isAnalyticsEnabled()) {
                analytics.record(result);
            }
            healthMonitor.recordSuccess();

            logger.info("Validated {}: {} ({}ms)", number, result.getSummary(),
                    result.getDiagnostics().getResponseTimeMs());
            events.validationCompleted(number, result);
            return result;
        } catch (final RuntimeException e) {
            return fail(number, result, e, events);
        }
    }

    public List<ValidationResult> validateBatch(final List<String> numbers) {
        return validateBatch(numbers, ValidationOptions.defaults());
    }

    public List<ValidationResult> validateBatch(final List<String> numbers, final ValidationOptions options) {
        return runBatch(numbers, options, publisher);
    }

    /**
     * Batch validation with a listener that receives the batch events, and the
     * events of every account in it, in addition to the registered listeners.
     */
    public List<ValidationResult> validateBatch(final List<String> numbers, final ValidationOptions options,
                                                final ValidationListener listener) {
        return runBatch(numbers, options, publisher.including(listener));
    }

    private List<ValidationResult> runBatch(final List<String> numbers, final ValidationOptions options,
                                            final ValidationEventPublisher events) {
        final var batchSize = options.getBatchSize() != null ? options.getBatchSize() : config.getBatchSize();
        final var delayMs = options.getDelayBetweenBatchesMs() != null
                ? options.getDelayBetweenBatchesMs() : config.getBatchDelayMs();
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }

        final var total = numbers.size();
        final var results = new ArrayList<ValidationResult>(total);
        logger.info("Starting batch of {} numbers in chunks of {}", total, batchSize);
        events.batchStarted(total);

        for (var start = 0; start < total; start += batchSize) {
            final var chunk = numbers.subList(start, Math.min(start + batchSize, total));

            final var futures = chunk.stream()
                    .map(number -> CompletableFuture.supplyAsync(() -> validate(number, options, events), executor))
                    .collect(Collectors.toList());
            // join in submission order so results line up with the input
            for (final var future : futures) {
                results.add(future.join());
            }

            events.batchProgress(results.size(), total);

            if (results.size() < total && delayMs > 0) {
                try {
                    sleeper.sleep(delayMs);
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn("Batch interrupted after {} of {} numbers", results.size(), total);
                    break;
                }
            }
        }

        events.batchCompleted(results);
        return results;
    }

    private void executePipeline(final String jid, final ValidationResult result, final long startedAt) {
        orchestrator.checkRegistration(jid, result);

        if (!result.isRegistered()) {
            result.getBan().setBanned(true);
            result.getBan().setType(BanType.PERMANENT);
            finalizeResult(result, startedAt);
            return;
        }

        final var probeSummary = orchestrator.executeProbes(jid, result);

        if (config.isClassifierEnabled()) {
            classify(result);
        } else {
            analyzePatterns(result, probeSummary);
        }

        reviewAdvisor.apply(result);
        pluginRegistry.runPostValidation(result);
        finalizeResult(result, startedAt);
    }

    private void classify(final ValidationResult result) {
        final var diagnostics = result.getDiagnostics();
        final var prediction = classifier.analyze(diagnostics.getErrorDetails(), diagnostics.successRate());

        if (prediction.getType() != BanType.NONE) {
            final var ban = result.getBan();
            ban.setBanned(true);
            ban.setType(prediction.getType());
            ban.setMlConfidence(prediction.getConfidence());
            ban.addDetectionMethod("ml_pattern_detection");
        }
    }

    /**
     * Heuristic used when the classifier is disabled: first keyword match wins,
     * then a registered account with no successful probe is treated as a violation.
     */
    private void analyzePatterns(final ValidationResult result, final ProbeStageSummary probeSummary) {
        final var ban = result.getBan();
        final var errorText = result.getDiagnostics().getErrorDetails().stream()
                .map(ErrorDetail::getErrorMessage)
                .filter(message -> message != null)
                .map(message -> message.toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));

        ErrorPattern.firstMatch(errorText).ifPresent(pattern -> {
            ban.setBanned(true);
            ban.setType(pattern.getBanType());
            ban.addDetectionMethod("pattern_match_" + pattern.getBanType().getValue());
        });

        if (probeSummary.allFailed() && result.isRegistered() && ban.getType() == BanType.NONE) {
            ban.setBanned(true);
            ban.setType(BanType.VIOLATION);
            ban.addDetectionMethod("zero_successful_probes");
        }
    }

    private void finalizeResult(final ValidationResult result, final long startedAt) {
        result.getDiagnostics().setResponseTimeMs(clock.millis() - startedAt);
        result.setSummary(result.isRegistered()
                ? SUMMARIES.get(result.getBan().getType())
                : NOT_REGISTERED_SUMMARY);
    }

    private ValidationResult fail(final String number, final ValidationResult result, final Exception error,
                                  final ValidationEventPublisher events) {
        logger.error("Critical error validating {}: {}", number, error.getMessage(), error);
        healthMonitor.recordFailure();
        events.validationFailed(number, error);

        result.setSummary(CRITICAL_SUMMARY);
        result.addError(ErrorDetail.builder()
                .stage("critical")
                .errorMessage(error.getMessage() != null ? error.getMessage() : error.toString())
                .errorCode(ProbeErrorCode.FATAL.getCode())
                .timestampMs(clock.millis())
                .build());
        return result;
    }

    String normalizeJid(final String number) {
        final var digits = number == null ? "" : number.replaceAll("\\D", "");
        return digits + config.getJidSuffix();
    }

    public Optional<CacheStats> getCacheStats() {
        return Optional.ofNullable(cache).map(ResultCache::stats);
    }

    public Optional<RateLimitStatus> getRateLimitStatus() {
        return Optional.ofNullable(rateLimiter).map(RateLimiter::status);
    }

    public Optional<AnalyticsReport> getAnalyticsReport() {
        return config.isAnalyticsEnabled() ? Optional.ofNullable(analytics).map(AnalyticsEngine::getReport)
                : Optional.empty();
    }

    public HealthStatus getHealth() {
        return healthMonitor.getHealth();
    }

    public void clearCache() {
        if (cache != null) {
            cache.clear();
            logger.info("Result cache cleared");
        }
    }

    public void resetAnalytics() {
        if (analytics != null) {
            analytics.reset();
        }
    }
}
