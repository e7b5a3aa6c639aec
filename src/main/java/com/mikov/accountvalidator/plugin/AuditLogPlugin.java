package com.mikov.accountvalidator.plugin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mikov.accountvalidator.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.LinkedHashMap;

/**
 * Writes one JSON audit line per validated account to the application log.
 */
@Slf4j
public class AuditLogPlugin implements ValidationPlugin {

    private final ObjectMapper objectMapper;

    public AuditLogPlugin(final ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "audit-log";
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public void onPostValidation(final ValidationResult result) {
        final var entry = new LinkedHashMap<String, Object>();
        entry.put("timestamp", Instant.ofEpochMilli(result.getTimestamp()).toString());
        entry.put("number", result.getNumber());
        entry.put("banned", result.getBan().isBanned());
        entry.put("type", result.getBan().getType());
        entry.put("probesSuccessful", result.getDiagnostics().getProbesSuccessful());

        try {
            log.info("[AUDIT] {}", objectMapper.writeValueAsString(entry));
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize audit entry for " + result.getNumber(), e);
        }
    }
}
