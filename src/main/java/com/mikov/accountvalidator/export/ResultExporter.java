package com.mikov.accountvalidator.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mikov.accountvalidator.model.ValidationResult;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Exports validation results as JSON or CSV.
 */
public class ResultExporter {

    private static final String CSV_HEADER = "Number,Registered,Banned,Ban Type,Review Available,Summary";

    private final ObjectMapper objectMapper;

    public ResultExporter(final ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(final ValidationResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize result for " + result.getNumber(), e);
        }
    }

    public String toCsv(final List<ValidationResult> results) {
        final var rows = results.stream().map(this::toCsvRow);
        return Stream.concat(Stream.of(CSV_HEADER), rows).collect(Collectors.joining("\n"));
    }

    private String toCsvRow(final ValidationResult result) {
        return String.join(",",
                escape(result.getNumber()),
                String.valueOf(result.isRegistered()),
                String.valueOf(result.getBan().isBanned()),
                result.getBan().getType().getValue(),
                String.valueOf(result.getReview().isAvailable()),
                escape(result.getSummary()));
    }

    private static String escape(final String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
