package com.mikov.accountvalidator.probe;

import com.mikov.accountvalidator.connection.AccountConnection;
import com.mikov.accountvalidator.connection.StatusPayload;
import com.mikov.accountvalidator.model.AccountAge;
import com.mikov.accountvalidator.model.ErrorDetail;
import com.mikov.accountvalidator.model.ProbeResult;
import com.mikov.accountvalidator.model.ProbeStatus;
import com.mikov.accountvalidator.model.ValidationResult;
import com.mikov.accountvalidator.model.ValidatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the remote probes for one account: the registration check first, then
 * the status, profile picture, business profile and presence probes, either in
 * parallel or one at a time. Each call races its own timeout and is retried with
 * a linear back-off when the failure is not fatal. Probe failures are recorded
 * as error evidence on the result and never thrown.
 *
 * @author zahari.mikov
 */
public class ProbeOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(ProbeOrchestrator.class);

    private static final String TIMEOUT_MESSAGE = "Operation timeout";
    private static final String PICTURE_SIZE = "image";
    private static final double MILLIS_PER_DAY = TimeUnit.DAYS.toMillis(1);

    private final AccountConnection connection;
    private final ValidatorConfig config;
    private final ExecutorService executor;
    private final Clock clock;
    private final RetryTemplate retryTemplate;

    public ProbeOrchestrator(final AccountConnection connection, final ValidatorConfig config,
                             final ExecutorService executor, final Clock clock, final Sleeper sleeper) {
        this.connection = connection;
        this.config = config;
        this.executor = executor;
        this.clock = clock;

        final var maxAttempts = config.isRetryOnFailure() ? config.getMaxRetries() + 1 : 1;
        this.retryTemplate = new RetryTemplate();
        this.retryTemplate.setRetryPolicy(new ProbeRetryPolicy(maxAttempts));
        this.retryTemplate.setBackOffPolicy(new LinearBackOffPolicy(config.getRetryDelayMs(), sleeper));
    }

    /**
     * Registration stage. Marks the account registered and active on a positive
     * existence answer; a failed lookup is recorded as evidence and leaves it unregistered.
     */
    public void checkRegistration(final String jid, final ValidationResult result) {
        try {
            final var check = callWithTimeout(() -> connection.checkExistence(jid), config.getTimeoutMs());
            final var registered = check != null && !check.isEmpty() && check.get(0).isExists();

            result.setRegistered(registered);
            result.setActive(registered);

            if (registered) {
                result.getBan().addDetectionMethod("registration_verified");
                result.getDiagnostics().incrementExecuted();
                result.getDiagnostics().incrementSuccessful();
            } else {
                result.getBan().addDetectionMethod("registration_not_found");
            }
        } catch (final ProbeFailureException e) {
            logger.warn("Registration check failed for {}: {}", jid, e.getMessage());
            result.addError(toErrorDetail("registration", e));
            result.getBan().addDetectionMethod("registration_check_failed");
        }
    }

    /**
     * Probe stage. Runs every probe to completion (no probe cancels another) and
     * merges their outcomes into the result.
     *
     * @return executed and successful counts for this stage alone
     */
    public ProbeStageSummary executeProbes(final String jid, final ValidationResult result) {
        final var probes = buildProbeList(jid);
        final var outcomes = new ArrayList<ProbeOutcome>(probes.size());

        if (config.isParallelProbes()) {
            final var futures = new ArrayList<CompletableFuture<ProbeOutcome>>();
            for (final var probe : probes) {
                futures.add(CompletableFuture.supplyAsync(() -> runProbe(probe), executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            for (final var future : futures) {
                outcomes.add(future.join());
            }
        } else {
            for (final var probe : probes) {
                outcomes.add(runProbe(probe));
            }
        }

        return merge(outcomes, result);
    }

    List<Probe> buildProbeList(final String jid) {
        final var timeout = config.getTimeoutMs();
        final var probes = new ArrayList<Probe>();
        probes.add(new Probe(ProbeType.STATUS, () -> connection.fetchStatus(jid), timeout));
        probes.add(new Probe(ProbeType.PROFILE_PICTURE, () -> connection.fetchProfilePicture(jid, PICTURE_SIZE), timeout));
        probes.add(new Probe(ProbeType.BUSINESS_PROFILE, () -> connection.fetchBusinessProfile(jid), timeout));

        if (config.isPresenceCheckEnabled()) {
            // presence subscriptions answer slower than plain lookups
            probes.add(new Probe(ProbeType.PRESENCE, () -> connection.subscribePresence(jid),
                    timeout + config.getPresenceTimeoutMarginMs()));
        }

        probes.sort(Comparator.comparingInt(probe -> probe.getType().getPriority()));
        return probes;
    }

    private ProbeOutcome runProbe(final Probe probe) {
        final var outcome = new ProbeOutcome(probe.getType());
        final var probeName = probe.getType().getProbeName();
        final var startedAt = clock.millis();

        retryTemplate.execute(context -> {
            final var attempt = context.getRetryCount();
            if (attempt > 0) {
                outcome.addFallback(probeName + "_retry_" + attempt);
                logger.debug("Retrying probe {} (attempt {})", probeName, attempt);
            }

            try {
                final var payload = callWithTimeout(probe.getCall(), probe.getTimeoutMs());
                outcome.succeed(payload);
                if (attempt == 0) {
                    outcome.setProbeResult(ProbeResult.builder()
                            .probeName(probeName)
                            .status(ProbeStatus.SUCCESS)
                            .durationMs(clock.millis() - startedAt)
                            .build());
                }
                return null;
            } catch (final ProbeFailureException e) {
                if (attempt == 0) {
                    outcome.addError(toErrorDetail(probeName, e));
                    outcome.setProbeResult(ProbeResult.builder()
                            .probeName(probeName)
                            .status(e.isTimedOut() ? ProbeStatus.TIMEOUT : ProbeStatus.FAILED)
                            .durationMs(clock.millis() - startedAt)
                            .errorMessage(e.getMessage())
                            .build());
                }
                throw e;
            }
        }, context -> {
            // only a failure after at least one retry is recorded a second time
            if (context.getRetryCount() > 1 && context.getLastThrowable() instanceof ProbeFailureException e) {
                outcome.addError(toErrorDetail(probeName + "_final_retry", e));
            }
            logger.debug("Probe {} failed after {} attempt(s)", probeName, context.getRetryCount());
            return null;
        });

        return outcome;
    }

    private ProbeStageSummary merge(final List<ProbeOutcome> outcomes, final ValidationResult result) {
        final var diagnostics = result.getDiagnostics();
        final var errors = new ArrayList<ErrorDetail>();
        var successful = 0;

        for (final var outcome : outcomes) {
            diagnostics.incrementExecuted();
            if (outcome.isSuccessful()) {
                applyPayload(outcome.getType(), outcome.getPayload(), result);
                diagnostics.incrementSuccessful();
                successful++;
            }
            if (outcome.getProbeResult() != null) {
                diagnostics.getProbeResults().add(outcome.getProbeResult());
            }
            diagnostics.getFallbacksUsed().addAll(outcome.getFallbacks());
            errors.addAll(outcome.getErrors());
        }

        // evidence is kept in the order it occurred
        errors.sort(Comparator.comparingLong(ErrorDetail::getTimestampMs));
        errors.forEach(result::addError);

        return new ProbeStageSummary(outcomes.size(), successful);
    }

    private void applyPayload(final ProbeType type, final Object payload, final ValidationResult result) {
        final var account = result.getAccount();
        final var ban = result.getBan();

        switch (type) {
            case STATUS -> {
                final var status = unwrap(payload, StatusPayload.class);
                if (status != null && status.getStatus() != null && !status.getStatus().isEmpty()) {
                    account.setHasStatus(true);
                    account.setStatusText(status.getStatus());
                    ban.addDetectionMethod("status_accessible");

                    if (status.getSetAt() != null) {
                        final var ageInDays = (clock.millis() - status.getSetAt() * 1000) / MILLIS_PER_DAY;
                        account.setAge(AccountAge.fromAgeInDays(ageInDays));
                    }
                }
            }
            case PROFILE_PICTURE -> {
                final var url = unwrap(payload, String.class);
                if (url != null && !url.isBlank()) {
                    account.setHasProfilePicture(true);
                    ban.addDetectionMethod("profile_picture_accessible");
                }
            }
            case BUSINESS_PROFILE -> {
                if (unwrap(payload, Map.class) != null) {
                    account.setBusinessAccount(true);
                    ban.addDetectionMethod("business_account_verified");
                }
            }
            case PRESENCE -> {
                if (unwrap(payload, Map.class) != null) {
                    account.setPresenceAvailable(true);
                    ban.addDetectionMethod("presence_available");
                }
            }
        }
    }

    private static <T> T unwrap(final Object payload, final Class<T> type) {
        final var value = payload instanceof Optional<?> optional ? optional.orElse(null) : payload;
        return type.isInstance(value) ? type.cast(value) : null;
    }

    private <T> T callWithTimeout(final Callable<T> call, final long timeoutMs) {
        final var future = executor.submit(call);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            // the remote call itself may keep running; its answer is discarded
            future.cancel(true);
            throw new ProbeFailureException(TIMEOUT_MESSAGE, true, e);
        } catch (final ExecutionException e) {
            final var cause = e.getCause() != null ? e.getCause() : e;
            final var message = cause.getMessage() != null ? cause.getMessage() : cause.toString();
            throw new ProbeFailureException(message, false, cause);
        } catch (final InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProbeFailureException("Probe interrupted", false, e);
        }
    }

    private ErrorDetail toErrorDetail(final String stage, final ProbeFailureException e) {
        return ErrorDetail.builder()
                .stage(stage)
                .errorMessage(e.getMessage())
                .errorCode(e.getErrorCode().getCode())
                .timestampMs(clock.millis())
                .build();
    }

    static final class Probe {
        private final ProbeType type;
        private final Callable<?> call;
        private final long timeoutMs;

        Probe(final ProbeType type, final Callable<?> call, final long timeoutMs) {
            this.type = type;
            this.call = call;
            this.timeoutMs = timeoutMs;
        }

        ProbeType getType() {
            return type;
        }

        Callable<?> getCall() {
            return call;
        }

        long getTimeoutMs() {
            return timeoutMs;
        }
    }
}
