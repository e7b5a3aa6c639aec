package com.mikov.accountvalidator.controller;

import com.mikov.accountvalidator.events.ValidationListener;
import com.mikov.accountvalidator.model.StreamValidationRequest;
import com.mikov.accountvalidator.model.ValidationResult;
import com.mikov.accountvalidator.pipeline.ValidationOptions;
import com.mikov.accountvalidator.pipeline.ValidationPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Controller;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Controller for WebSocket-based account validation. Progress goes to the
 * session's status topic, each finished account to its result topic.
 */
@Controller
public class WebSocketValidationController {
    private static final Logger logger = LoggerFactory.getLogger(WebSocketValidationController.class);

    static final String STATUS_TOPIC = "/topic/validation-status/";
    static final String RESULT_TOPIC = "/topic/validation-result/";

    private final SimpMessagingTemplate messagingTemplate;
    private final ValidationPipeline pipeline;
    private final ExecutorService executor;
    private final Clock clock;

    public WebSocketValidationController(final SimpMessagingTemplate messagingTemplate,
                                         final ValidationPipeline pipeline,
                                         final ExecutorService executor,
                                         final Clock clock) {
        this.messagingTemplate = messagingTemplate;
        this.pipeline = pipeline;
        this.executor = executor;
        this.clock = clock;
    }

    @MessageMapping("/validate")
    public void validateNumbers(@Payload final StreamValidationRequest request) {
        final var sessionId = request.getSessionId();
        final var numbers = request.getNumbers() != null ? request.getNumbers() : List.<String>of();
        logger.info("Received validation request for {} numbers, session: {}", numbers.size(), sessionId);

        CompletableFuture.runAsync(() -> process(sessionId, numbers), executor);
    }

    void process(final String sessionId, final List<String> numbers) {
        // listener callbacks arrive on executor threads
        final var stats = new ConcurrentHashMap<String, Integer>();
        stats.put("active", 0);
        stats.put("banned", 0);
        stats.put("unregistered", 0);

        try {
            pipeline.validateBatch(numbers, ValidationOptions.defaults(), new ValidationListener() {
                @Override
                public void onBatchStart(final int total) {
                    sendStatusUpdate(sessionId, "STARTED", 0, total, stats);
                }

                @Override
                public void onCacheHit(final String number, final ValidationResult result) {
                    updateStats(stats, result);
                    sendResult(sessionId, result);
                }

                @Override
                public void onValidationComplete(final String number, final ValidationResult result) {
                    updateStats(stats, result);
                    sendResult(sessionId, result);
                }

                @Override
                public void onBatchProgress(final int completed, final int total) {
                    sendStatusUpdate(sessionId, "PROGRESS", completed, total, stats);
                }

                @Override
                public void onBatchComplete(final List<ValidationResult> results) {
                    sendStatusUpdate(sessionId, "COMPLETED", results.size(), numbers.size(), stats);
                }
            });
            logger.info("All validation tasks completed for session {}", sessionId);
        } catch (final Exception e) {
            logger.error("Error in validation for session {}: {}", sessionId, e.getMessage(), e);
            sendStatusUpdate(sessionId, "ERROR", 0, numbers.size(),
                    Map.of("error", e.getMessage() != null ? e.getMessage() : e.toString()));
        }
    }

    private void updateStats(final Map<String, Integer> stats, final ValidationResult result) {
        final String key;
        if (!result.isRegistered()) {
            key = "unregistered";
        } else if (result.getBan().isBanned()) {
            key = "banned";
        } else {
            key = "active";
        }
        stats.merge(key, 1, Integer::sum);
    }

    private void sendResult(final String sessionId, final ValidationResult result) {
        messagingTemplate.convertAndSend(RESULT_TOPIC + sessionId, result);
    }

    private void sendStatusUpdate(final String sessionId, final String status, final int processed,
                                  final int total, final Map<String, ?> stats) {
        final var update = new HashMap<String, Object>();
        update.put("status", status);
        update.put("processed", processed);
        update.put("total", total);
        update.put("stats", new HashMap<>(stats));
        update.put("timestamp", clock.millis());
        messagingTemplate.convertAndSend(STATUS_TOPIC + sessionId, update);
    }
}
