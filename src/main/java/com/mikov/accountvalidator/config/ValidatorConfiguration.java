package com.mikov.accountvalidator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mikov.accountvalidator.analytics.AnalyticsEngine;
import com.mikov.accountvalidator.classifier.BanClassifier;
import com.mikov.accountvalidator.connection.AccountConnection;
import com.mikov.accountvalidator.connection.GatewayAccountConnection;
import com.mikov.accountvalidator.events.ValidationEventPublisher;
import com.mikov.accountvalidator.events.ValidationListener;
import com.mikov.accountvalidator.export.ReportFormatter;
import com.mikov.accountvalidator.export.ResultExporter;
import com.mikov.accountvalidator.health.HealthMonitor;
import com.mikov.accountvalidator.model.ValidatorConfig;
import com.mikov.accountvalidator.pipeline.ReviewAdvisor;
import com.mikov.accountvalidator.pipeline.ValidationPipeline;
import com.mikov.accountvalidator.plugin.AuditLogPlugin;
import com.mikov.accountvalidator.plugin.PluginRegistry;
import com.mikov.accountvalidator.plugin.ValidationPlugin;
import com.mikov.accountvalidator.probe.ProbeOrchestrator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(ValidatorProperties.class)
public class ValidatorConfiguration {

    @Bean
    public ValidatorConfig validatorConfig(final ValidatorProperties properties) {
        return properties.toConfig().validate();
    }

    @Bean
    public Clock validatorClock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper validatorSleeper() {
        return new ThreadWaitSleeper();
    }

    /**
     * Unbounded pool: an account task blocks on its probe tasks, which block on
     * remote calls, so a fixed-size pool could deadlock.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService validatorExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("validator-"));
    }

    @Bean
    @ConditionalOnMissingBean
    public AccountConnection accountConnection(final RestClient.Builder restClientBuilder,
                                               final ValidatorProperties properties) {
        return new GatewayAccountConnection(restClientBuilder, properties.getGateway().getBaseUrl());
    }

    @Bean
    public ValidationEventPublisher validationEventPublisher(final ObjectProvider<ValidationListener> listeners) {
        return new ValidationEventPublisher(listeners.orderedStream().toList());
    }

    @Bean
    public HealthMonitor healthMonitor(final ValidatorConfig config, final ValidationEventPublisher publisher,
                                       final Clock clock) {
        return new HealthMonitor(config.getHealthDegradedThreshold(), config.getHealthCriticalThreshold(),
                publisher, clock);
    }

    @Bean
    public BanClassifier banClassifier(final Clock clock) {
        return new BanClassifier(clock);
    }

    @Bean
    public AnalyticsEngine analyticsEngine(final Clock clock) {
        return new AnalyticsEngine(clock);
    }

    @Bean
    public ProbeOrchestrator probeOrchestrator(final AccountConnection connection, final ValidatorConfig config,
                                               final ExecutorService executor, final Clock clock,
                                               final Sleeper sleeper) {
        return new ProbeOrchestrator(connection, config, executor, clock, sleeper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "validator.plugins", name = "audit-log", havingValue = "true")
    public AuditLogPlugin auditLogPlugin(final ObjectMapper objectMapper) {
        return new AuditLogPlugin(objectMapper);
    }

    @Bean
    public PluginRegistry pluginRegistry(final ValidatorConfig config, final ValidationEventPublisher publisher,
                                         final ObjectProvider<ValidationPlugin> plugins) {
        final var registry = new PluginRegistry(config, publisher);
        plugins.orderedStream().forEach(registry::register);
        return registry;
    }

    @Bean
    public ValidationPipeline validationPipeline(final ValidatorConfig config,
                                                 final ProbeOrchestrator orchestrator,
                                                 final BanClassifier classifier,
                                                 final PluginRegistry pluginRegistry,
                                                 final ValidationEventPublisher publisher,
                                                 final HealthMonitor healthMonitor,
                                                 final AnalyticsEngine analytics,
                                                 final ExecutorService executor,
                                                 final Clock clock,
                                                 final Sleeper sleeper) {
        return new ValidationPipeline(config, orchestrator, classifier, new ReviewAdvisor(), pluginRegistry,
                publisher, healthMonitor, analytics, executor, clock, sleeper);
    }

    @Bean
    public ResultExporter resultExporter(final ObjectMapper objectMapper) {
        return new ResultExporter(objectMapper);
    }

    @Bean
    public ReportFormatter reportFormatter() {
        return new ReportFormatter();
    }
}
