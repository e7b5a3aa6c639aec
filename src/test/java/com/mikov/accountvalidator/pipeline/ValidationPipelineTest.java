package com.mikov.accountvalidator.pipeline;

import com.mikov.accountvalidator.analytics.AnalyticsEngine;
import com.mikov.accountvalidator.classifier.BanClassifier;
import com.mikov.accountvalidator.connection.AccountConnection;
import com.mikov.accountvalidator.connection.ExistenceResult;
import com.mikov.accountvalidator.connection.StatusPayload;
import com.mikov.accountvalidator.events.ValidationEventPublisher;
import com.mikov.accountvalidator.events.ValidationListener;
import com.mikov.accountvalidator.health.HealthMonitor;
import com.mikov.accountvalidator.model.BanType;
import com.mikov.accountvalidator.model.ErrorDetail;
import com.mikov.accountvalidator.model.ReviewType;
import com.mikov.accountvalidator.model.ValidationResult;
import com.mikov.accountvalidator.model.ValidatorConfig;
import com.mikov.accountvalidator.plugin.PluginRegistry;
import com.mikov.accountvalidator.plugin.ValidationPlugin;
import com.mikov.accountvalidator.probe.ProbeOrchestrator;
import com.mikov.accountvalidator.support.ManualClock;
import com.mikov.accountvalidator.support.RecordingSleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ValidationPipelineTest {

    private static final String NUMBER = "+1 (555) 010-0000";
    private static final String JID = "15550100000@s.whatsapp.net";

    private AccountConnection connection;
    private ExecutorService executor;
    private ManualClock clock;
    private RecordingSleeper sleeper;
    private RecordingListener listener;
    private ValidationEventPublisher publisher;
    private HealthMonitor healthMonitor;
    private AnalyticsEngine analytics;

    @BeforeEach
    void setUp() {
        connection = mock(AccountConnection.class);
        executor = Executors.newCachedThreadPool();
        clock = new ManualClock(1_700_000_000_000L);
        sleeper = new RecordingSleeper(clock);
        listener = new RecordingListener();
        publisher = new ValidationEventPublisher(List.of(listener));
        healthMonitor = new HealthMonitor(5, 10, publisher, clock);
        analytics = new AnalyticsEngine(clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    // ========== END-TO-END SCENARIOS ==========

    @Test
    @DisplayName("Should report an unregistered account as permanently banned")
    void shouldReportUnregisteredAccount() {
        when(connection.checkExistence(JID)).thenReturn(List.of(new ExistenceResult(JID, false)));

        final var result = pipeline(baseConfig()).validate(NUMBER);

        assertThat(result.getSummary()).isEqualTo("Not registered or permanently banned");
        assertThat(result.isRegistered()).isFalse();
        assertThat(result.getBan().isBanned()).isTrue();
        assertThat(result.getBan().getType()).isEqualTo(BanType.PERMANENT);
        assertThat(result.getReview().isAvailable()).isFalse();
        assertThat(result.getDiagnostics().getProbesExecuted()).isZero();
        assertThat(result.getDiagnostics().getResponseTimeMs()).isNotNull();
        verify(connection, never()).fetchStatus(anyString());
    }

    @Test
    @DisplayName("Should report a healthy account as active and verified")
    void shouldReportActiveAccount() {
        stubRegistered();
        stubAllProbesSucceeding();

        final var result = pipeline(baseConfig()).validate(NUMBER);

        assertThat(result.getNumber()).isEqualTo(NUMBER);
        assertThat(result.getJid()).isEqualTo(JID);
        assertThat(result.getSummary()).isEqualTo("Active and verified");
        assertThat(result.getBan().isBanned()).isFalse();
        assertThat(result.getBan().getType()).isEqualTo(BanType.NONE);
        assertThat(result.getRecommendations())
                .contains("Account is functioning normally", "Maintain natural usage patterns");
        assertThat(result.getDiagnostics().getProbesExecuted()).isEqualTo(5);
        assertThat(result.getDiagnostics().getProbesSuccessful()).isEqualTo(5);
        assertThat(listener.events).containsExactly("start:" + NUMBER, "complete:" + NUMBER);
    }

    @Test
    @DisplayName("Should classify termination evidence as a permanent ban")
    void shouldClassifyPermanentBan() {
        stubRegistered();
        when(connection.fetchStatus(JID)).thenThrow(new IllegalStateException("account permanently deleted"));
        when(connection.fetchProfilePicture(JID, "image")).thenThrow(new IllegalStateException("account permanently deleted"));
        when(connection.fetchBusinessProfile(JID)).thenThrow(new IllegalStateException("account permanently deleted"));
        when(connection.subscribePresence(JID)).thenThrow(new IllegalStateException("account permanently deleted"));

        final var result = pipeline(baseConfig()).validate(NUMBER);

        assertThat(result.getSummary()).isEqualTo("Permanent ban confirmed");
        assertThat(result.getBan().isBanned()).isTrue();
        assertThat(result.getBan().getType()).isEqualTo(BanType.PERMANENT);
        assertThat(result.getBan().getDetectionMethods()).contains("ml_pattern_detection");
        assertThat(result.getBan().getMlConfidence()).isCloseTo(0.7, within(1e-9));
        assertThat(result.getReview().isAvailable()).isFalse();
        assertThat(result.getRecommendations()).contains("Ban is permanent - Consider new number");
    }

    // ========== CLASSIFIER FALLBACK ==========

    @Test
    @DisplayName("Should fall back to keyword matching when the classifier is disabled")
    void shouldFallBackToKeywordMatching() {
        stubRegistered();
        stubAllProbesSucceeding();
        when(connection.fetchStatus(JID)).thenThrow(new IllegalStateException("429 rate limit exceeded"));

        final var result = pipeline(baseConfig().toBuilder().classifierEnabled(false).build()).validate(NUMBER);

        assertThat(result.getBan().getType()).isEqualTo(BanType.SPAM);
        assertThat(result.getBan().getDetectionMethods()).contains("pattern_match_spam");
        assertThat(result.getSummary()).isEqualTo("Spam restrictions detected");
        assertThat(result.getReview().getType()).isEqualTo(ReviewType.SELF_APPEAL);
        assertThat(result.getReview().getEstimatedTime()).isEqualTo("24-48 hours");
    }

    @Test
    @DisplayName("Should treat a registered account with no successful probe as a violation")
    void shouldTreatZeroSuccessfulProbesAsViolation() {
        stubRegistered();
        when(connection.fetchStatus(anyString())).thenThrow(new IllegalStateException("500 upstream error"));
        when(connection.fetchProfilePicture(anyString(), anyString())).thenThrow(new IllegalStateException("500 upstream error"));
        when(connection.fetchBusinessProfile(anyString())).thenThrow(new IllegalStateException("500 upstream error"));
        when(connection.subscribePresence(anyString())).thenThrow(new IllegalStateException("500 upstream error"));

        final var result = pipeline(baseConfig().toBuilder().classifierEnabled(false).build()).validate(NUMBER);

        assertThat(result.getBan().getType()).isEqualTo(BanType.VIOLATION);
        assertThat(result.getBan().getDetectionMethods()).contains("zero_successful_probes");
        assertThat(result.getSummary()).isEqualTo("Policy violation detected");
        assertThat(result.getReview().getType()).isEqualTo(ReviewType.SUPPORT_REQUIRED);
    }

    // ========== CACHING ==========

    @Test
    @DisplayName("Should serve a repeated validation from the cache")
    void shouldServeRepeatedValidationFromCache() {
        stubRegistered();
        stubAllProbesSucceeding();
        final var pipeline = pipeline(baseConfig());

        final var first = pipeline.validate(NUMBER);
        final var second = pipeline.validate(NUMBER);

        assertThat(second).isEqualTo(first).isNotSameAs(first);
        assertThat(second.getDiagnostics().getProbesExecuted()).isEqualTo(first.getDiagnostics().getProbesExecuted());
        verify(connection, times(1)).checkExistence(JID);
        assertThat(pipeline.getCacheStats()).hasValueSatisfying(stats -> assertThat(stats.getHits()).isEqualTo(1));
        assertThat(listener.events).contains("cache_hit:" + NUMBER);
    }

    @Test
    @DisplayName("Should not let callers change the cached snapshot")
    void shouldIsolateCachedSnapshot() {
        stubRegistered();
        stubAllProbesSucceeding();
        final var pipeline = pipeline(baseConfig());

        pipeline.validate(NUMBER).getRecommendations().add("tampered");

        assertThat(pipeline.validate(NUMBER).getRecommendations()).doesNotContain("tampered");
    }

    @Test
    @DisplayName("Should bypass the cache on a forced refresh")
    void shouldBypassCacheOnForcedRefresh() {
        stubRegistered();
        stubAllProbesSucceeding();
        final var pipeline = pipeline(baseConfig());

        pipeline.validate(NUMBER);
        pipeline.validate(NUMBER, ValidationOptions.builder().forceRefresh(true).build());

        verify(connection, times(2)).checkExistence(JID);
    }

    @Test
    @DisplayName("Should share cache entries between differently formatted numbers")
    void shouldNormalizeNumbers() {
        stubRegistered();
        final var pipeline = pipeline(baseConfig());

        pipeline.validate(NUMBER);
        pipeline.validate("15550100000");

        verify(connection, times(1)).checkExistence(JID);
        assertThat(pipeline.normalizeJid("+44 20-7946")).isEqualTo("44207946@s.whatsapp.net");
    }

    @Test
    @DisplayName("Should wait for the rate limiter before validating")
    void shouldApplyRateLimit() {
        stubRegistered();
        final var config = baseConfig().toBuilder()
                .rateLimitEnabled(true)
                .rateLimitMaxRequests(1)
                .rateLimitWindowMs(60_000)
                .build();
        final var pipeline = pipeline(config);

        pipeline.validate(NUMBER);
        pipeline.validate(NUMBER);

        assertThat(sleeper.getSleeps()).containsExactly(60_000L);
        assertThat(pipeline.getRateLimitStatus()).isPresent();
    }

    // ========== FAULTS ==========

    @Test
    @DisplayName("Should turn an unexpected fault into a critical result")
    void shouldReportCriticalError() {
        final var orchestrator = mock(ProbeOrchestrator.class);
        doThrow(new IllegalStateException("connection closed"))
                .when(orchestrator).checkRegistration(anyString(), any(ValidationResult.class));
        final var pipeline = pipeline(baseConfig(), orchestrator, new PluginRegistry(baseConfig(), publisher));

        final var result = pipeline.validate(NUMBER);

        assertThat(result.getSummary()).isEqualTo("Critical validation error");
        assertThat(result.getDiagnostics().getErrorDetails())
                .extracting(ErrorDetail::getStage, ErrorDetail::getErrorMessage, ErrorDetail::getErrorCode)
                .containsExactly(tuple("critical", "connection closed", "FATAL"));
        assertThat(pipeline.getHealth().getConsecutiveFailures()).isEqualTo(1);
        assertThat(listener.events).contains("error:" + NUMBER);
        assertThat(pipeline.getCacheStats()).hasValueSatisfying(stats -> assertThat(stats.getSize()).isZero());
    }

    @Test
    @DisplayName("Should keep validating when a plugin fails")
    void shouldIsolatePluginFailure() {
        stubRegistered();
        stubAllProbesSucceeding();
        final var registry = new PluginRegistry(baseConfig(), publisher);
        registry.register(new ValidationPlugin() {
            @Override
            public String getName() {
                return "broken";
            }

            @Override
            public String getVersion() {
                return "0.1.0";
            }

            @Override
            public void onPostValidation(final ValidationResult result) {
                throw new IllegalStateException("plugin bug");
            }
        });

        final var result = pipeline(baseConfig(), orchestrator(baseConfig()), registry).validate(NUMBER);

        assertThat(result.getSummary()).isEqualTo("Active and verified");
        assertThat(listener.events).contains("plugin_error:broken:post_validation");
    }

    @Test
    @DisplayName("Should let plugins add to the result before it is finalized")
    void shouldRunPluginsBeforeFinalization() {
        stubRegistered();
        stubAllProbesSucceeding();
        final var registry = new PluginRegistry(baseConfig(), publisher);
        registry.register(new ValidationPlugin() {
            @Override
            public String getName() {
                return "notes";
            }

            @Override
            public String getVersion() {
                return "1.0.0";
            }

            @Override
            public void onPostValidation(final ValidationResult result) {
                result.getRecommendations().add("Checked by notes plugin");
            }
        });

        final var result = pipeline(baseConfig(), orchestrator(baseConfig()), registry).validate(NUMBER);

        assertThat(result.getRecommendations()).endsWith("Checked by notes plugin");
    }

    @Test
    @DisplayName("Should keep validating when a listener fails")
    void shouldIsolateListenerFailure() {
        stubRegistered();
        publisher.addListener(new ValidationListener() {
            @Override
            public void onValidationStart(final String number) {
                throw new IllegalStateException("listener bug");
            }
        });

        final var result = pipeline(baseConfig()).validate(NUMBER);

        assertThat(result.getSummary()).isEqualTo("Active and verified");
        assertThat(listener.events).contains("complete:" + NUMBER);
    }

    // ========== BATCHES ==========

    @Test
    @DisplayName("Should return batch results in input order with a delay between chunks")
    void shouldValidateBatchInOrder() {
        when(connection.checkExistence(anyString())).thenAnswer(invocation -> {
            final String jid = invocation.getArgument(0);
            if (jid.startsWith("1")) {
                Thread.sleep(100);
            }
            return List.of(new ExistenceResult(jid, !jid.startsWith("3")));
        });
        final var batchListener = new RecordingListener();
        final var options = ValidationOptions.builder().batchSize(2).delayBetweenBatchesMs(500L).build();

        final var results = pipeline(baseConfig())
                .validateBatch(List.of("111", "222", "333"), options, batchListener);

        assertThat(results).extracting(ValidationResult::getNumber).containsExactly("111", "222", "333");
        assertThat(results).extracting(ValidationResult::isRegistered).containsExactly(true, true, false);
        assertThat(sleeper.getSleeps()).containsExactly(500L);
        assertThat(batchListener.events).contains("batch_start:3", "progress:2/3", "progress:3/3", "batch_complete:3");
        assertThat(listener.events).contains("batch_start:3", "batch_complete:3");
    }

    @Test
    @DisplayName("Should use configured batch settings when options leave them unset")
    void shouldUseConfiguredBatchSettings() {
        stubRegistered();
        final var config = baseConfig().toBuilder().batchSize(1).batchDelayMs(250).build();

        final var results = pipeline(config).validateBatch(List.of("1", "2", "3"));

        assertThat(results).hasSize(3);
        assertThat(sleeper.getSleeps()).containsExactly(250L, 250L);
    }

    @Test
    @DisplayName("Should record analytics for completed validations")
    void shouldRecordAnalytics() {
        stubRegistered();
        final var pipeline = pipeline(baseConfig());

        pipeline.validate(NUMBER);

        assertThat(pipeline.getAnalyticsReport()).hasValueSatisfying(report ->
                assertThat(report.getSummary().getTotalValidations()).isEqualTo(1));

        pipeline.resetAnalytics();
        assertThat(pipeline.getAnalyticsReport()).hasValueSatisfying(report ->
                assertThat(report.getSummary().getTotalValidations()).isZero());
    }

    private void stubRegistered() {
        when(connection.checkExistence(anyString()))
                .thenAnswer(invocation -> List.of(new ExistenceResult(invocation.getArgument(0), true)));
    }

    private void stubAllProbesSucceeding() {
        when(connection.fetchStatus(JID)).thenReturn(Optional.of(new StatusPayload("Available", null)));
        when(connection.fetchProfilePicture(JID, "image")).thenReturn(Optional.of("https://pps.example/pic.jpg"));
        when(connection.fetchBusinessProfile(JID)).thenReturn(Optional.of(Map.of("description", "Shop")));
        when(connection.subscribePresence(JID)).thenReturn(Optional.of(Map.of("presence", "available")));
    }

    private static ValidatorConfig baseConfig() {
        return ValidatorConfig.builder()
                .rateLimitEnabled(false)
                .retryOnFailure(false)
                .build();
    }

    private ProbeOrchestrator orchestrator(final ValidatorConfig config) {
        return new ProbeOrchestrator(connection, config, executor, clock, sleeper);
    }

    private ValidationPipeline pipeline(final ValidatorConfig config) {
        return pipeline(config, orchestrator(config), new PluginRegistry(config, publisher));
    }

    private ValidationPipeline pipeline(final ValidatorConfig config, final ProbeOrchestrator orchestrator,
                                        final PluginRegistry registry) {
        return new ValidationPipeline(config, orchestrator, new BanClassifier(clock), new ReviewAdvisor(),
                registry, publisher, healthMonitor, analytics, executor, clock, sleeper);
    }

    private static final class RecordingListener implements ValidationListener {
        private final List<String> events = new CopyOnWriteArrayList<>();

        @Override
        public void onValidationStart(final String number) {
            events.add("start:" + number);
        }

        @Override
        public void onCacheHit(final String number, final ValidationResult result) {
            events.add("cache_hit:" + number);
        }

        @Override
        public void onValidationComplete(final String number, final ValidationResult result) {
            events.add("complete:" + number);
        }

        @Override
        public void onValidationError(final String number, final Throwable error) {
            events.add("error:" + number);
        }

        @Override
        public void onBatchStart(final int total) {
            events.add("batch_start:" + total);
        }

        @Override
        public void onBatchProgress(final int completed, final int total) {
            events.add("progress:" + completed + "/" + total);
        }

        @Override
        public void onBatchComplete(final List<ValidationResult> results) {
            events.add("batch_complete:" + results.size());
        }

        @Override
        public void onPluginError(final String plugin, final String hook, final Throwable error) {
            events.add("plugin_error:" + plugin + ":" + hook);
        }
    }
}
