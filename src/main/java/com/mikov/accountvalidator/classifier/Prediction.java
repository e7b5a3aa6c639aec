package com.mikov.accountvalidator.classifier;

import com.mikov.accountvalidator.model.BanType;
import lombok.Builder;
import lombok.Data;

/**
 * Classifier verdict. For a non-NONE type, {@code confidence} is the normalized
 * score of the winning pattern and {@code baseConfidence} the pattern's static
 * confidence.
 */
@Data
@Builder
public class Prediction {
    static final double NO_SIGNAL_CONFIDENCE = 0.5;

    private final BanType type;
    private final double confidence;
    private final double score;
    private final double baseConfidence;
    private final int matchCount;

    /**
     * "No signal" verdict. The non-zero confidence does not mean "confidently not banned".
     */
    public static Prediction none() {
        return Prediction.builder()
                .type(BanType.NONE)
                .confidence(NO_SIGNAL_CONFIDENCE)
                .build();
    }
}
