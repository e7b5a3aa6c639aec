package com.mikov.accountvalidator.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of validating one account. Created fresh per validation and filled in
 * stage by stage by the pipeline that owns it; not modified after it is returned.
 *
 * @author zahari.mikov
 */
@Data
public class ValidationResult {

    private String number;
    private String jid;
    private long timestamp;
    private boolean registered;
    private boolean active;
    private BanInfo ban = new BanInfo();
    private ReviewInfo review = new ReviewInfo();
    private AccountInfo account = new AccountInfo();
    private Diagnostics diagnostics = new Diagnostics();
    private List<String> recommendations = new ArrayList<>();
    private String summary = "";

    public static ValidationResult create(final String number, final String jid, final long timestamp) {
        final var result = new ValidationResult();
        result.number = number;
        result.jid = jid;
        result.timestamp = timestamp;
        return result;
    }

    public void addError(final ErrorDetail errorDetail) {
        diagnostics.getErrorDetails().add(errorDetail);
    }

    /**
     * Deep copy, so a cached snapshot cannot be changed through the instance handed to a caller.
     */
    public ValidationResult copy() {
        final var copy = new ValidationResult();
        copy.number = number;
        copy.jid = jid;
        copy.timestamp = timestamp;
        copy.registered = registered;
        copy.active = active;
        copy.ban = ban.copy();
        copy.review = review.copy();
        copy.account = account.copy();
        copy.diagnostics = diagnostics.copy();
        copy.recommendations = new ArrayList<>(recommendations);
        copy.summary = summary;
        return copy;
    }
}
