package com.mikov.accountvalidator.controller;

import com.mikov.accountvalidator.classifier.BanClassifier;
import com.mikov.accountvalidator.dtos.ValidatorStats;
import com.mikov.accountvalidator.export.ReportFormatter;
import com.mikov.accountvalidator.export.ResultExporter;
import com.mikov.accountvalidator.model.BatchValidationRequest;
import com.mikov.accountvalidator.pipeline.ValidationOptions;
import com.mikov.accountvalidator.pipeline.ValidationPipeline;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * REST controller for account validation
 *
 * @author zahari.mikov
 */
@RestController
@RequestMapping("/accountvalidator")
public class AccountValidatorController {

    private static final Logger logger = LoggerFactory.getLogger(AccountValidatorController.class);
    private static final long RESPONSE_TIMEOUT_MS = TimeUnit.MINUTES.toMillis(15);
    static final int MAX_NUMBERS_PER_BATCH = 1000;

    private final ValidationPipeline pipeline;
    private final BanClassifier classifier;
    private final ResultExporter exporter;
    private final ReportFormatter formatter;
    private final ExecutorService executor;

    public AccountValidatorController(final ValidationPipeline pipeline, final BanClassifier classifier,
                                      final ResultExporter exporter, final ReportFormatter formatter,
                                      final ExecutorService executor) {
        this.pipeline = pipeline;
        this.classifier = classifier;
        this.exporter = exporter;
        this.formatter = formatter;
        this.executor = executor;
    }

    @GetMapping("/validate/{number}")
    public DeferredResult<ResponseEntity<?>> validate(
            @PathVariable final String number,
            @RequestParam(defaultValue = "false") final boolean refresh) {
        final var options = ValidationOptions.builder().forceRefresh(refresh).build();
        return defer(() -> pipeline.validate(number, options), ResponseEntity::ok, number);
    }

    @PostMapping(value = "/validate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public DeferredResult<ResponseEntity<?>> validateBatch(@RequestBody final BatchValidationRequest request) {
        final var rejection = checkBatch(request);
        if (rejection != null) {
            return completed(rejection);
        }

        logger.info("Received request to validate {} numbers", request.getNumbers().size());
        return defer(() -> pipeline.validateBatch(request.getNumbers(), toOptions(request)),
                ResponseEntity::ok, "batch");
    }

    @PostMapping(value = "/export/csv", consumes = MediaType.APPLICATION_JSON_VALUE)
    public DeferredResult<ResponseEntity<?>> exportCsv(@RequestBody final BatchValidationRequest request) {
        final var rejection = checkBatch(request);
        if (rejection != null) {
            return completed(rejection);
        }

        return defer(() -> exporter.toCsv(pipeline.validateBatch(request.getNumbers(), toOptions(request))),
                csv -> ResponseEntity.ok()
                        .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"validation.csv\"")
                        .contentType(new MediaType("text", "csv"))
                        .body(csv),
                "export");
    }

    @GetMapping("/export/json/{number}")
    public DeferredResult<ResponseEntity<?>> exportJson(@PathVariable final String number) {
        return defer(() -> exporter.toJson(pipeline.validate(number)),
                json -> ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(json),
                number);
    }

    @GetMapping("/report/{number}")
    public DeferredResult<ResponseEntity<?>> report(
            @PathVariable final String number,
            @RequestParam(defaultValue = "false") final boolean detailed) {
        return defer(() -> {
            final var result = pipeline.validate(number);
            return detailed ? formatter.formatDetailed(result) : formatter.formatSimple(result);
        }, text -> ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(text), number);
    }

    @GetMapping("/stats")
    public ResponseEntity<ValidatorStats> stats() {
        return ResponseEntity.ok(ValidatorStats.builder()
                .health(pipeline.getHealth())
                .cache(pipeline.getCacheStats().orElse(null))
                .rateLimit(pipeline.getRateLimitStatus().orElse(null))
                .analytics(pipeline.getAnalyticsReport().orElse(null))
                .classifierAccuracy(classifier.getAccuracy())
                .build());
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        pipeline.clearCache();
        return ResponseEntity.noContent().build();
    }

    private <T> DeferredResult<ResponseEntity<?>> defer(final Supplier<T> work,
                                                        final Function<T, ResponseEntity<?>> toResponse,
                                                        final String subject) {
        final var deferredResult = new DeferredResult<ResponseEntity<?>>(RESPONSE_TIMEOUT_MS);
        deferredResult.onTimeout(() -> deferredResult.setErrorResult(ResponseEntity.status(503)
                .body(new ErrorResponse("Validation timed out", subject))));

        CompletableFuture.supplyAsync(work, executor)
                .thenAccept(value -> deferredResult.setResult(toResponse.apply(value)))
                .exceptionally(ex -> {
                    final var cause = ex.getCause() != null ? ex.getCause() : ex;
                    logger.error("Error validating {}: {}", subject, cause.getMessage());
                    final var status = cause instanceof IllegalArgumentException ? 400 : 500;
                    deferredResult.setErrorResult(ResponseEntity.status(status)
                            .body(new ErrorResponse("Error validating " + subject, cause.getMessage())));
                    return null;
                });
        return deferredResult;
    }

    private static DeferredResult<ResponseEntity<?>> completed(final ResponseEntity<?> response) {
        final var deferredResult = new DeferredResult<ResponseEntity<?>>(RESPONSE_TIMEOUT_MS);
        deferredResult.setResult(response);
        return deferredResult;
    }

    private static ResponseEntity<?> checkBatch(final BatchValidationRequest request) {
        if (request == null || request.getNumbers() == null || request.getNumbers().isEmpty()) {
            logger.warn("Received empty batch validation request");
            return ResponseEntity.badRequest().body(new ErrorResponse("At least one number is required."));
        }
        if (request.getNumbers().size() > MAX_NUMBERS_PER_BATCH) {
            logger.warn("Batch of {} numbers exceeds the limit", request.getNumbers().size());
            return ResponseEntity.badRequest().body(new ErrorResponse(
                    "Batch size exceeds maximum allowed (" + MAX_NUMBERS_PER_BATCH + " numbers)"));
        }
        return null;
    }

    private static ValidationOptions toOptions(final BatchValidationRequest request) {
        return ValidationOptions.builder()
                .forceRefresh(request.isForceRefresh())
                .batchSize(request.getBatchSize())
                .delayBetweenBatchesMs(request.getDelayBetweenBatchesMs())
                .build();
    }

    @Getter
    public static final class ErrorResponse {
        private final String error;
        private final String details;

        public ErrorResponse(final String error) {
            this(error, null);
        }

        public ErrorResponse(final String error, final String details) {
            this.error = error;
            this.details = details;
        }
    }
}
