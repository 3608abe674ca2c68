package com.haulage.tickets.dto;

import com.haulage.tickets.entity.SourceTier;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One proposed value for one field of one ticket, tagged with where it came
 * from and how confident that source is. Immutable.
 */
@Value
public class CandidateValue {

    String fieldName;
    String value;
    SourceTier tier;
    double confidence;

    /**
     * When the candidate was produced. Null sorts as oldest.
     */
    LocalDateTime producedAt;

    @Builder
    public CandidateValue(String fieldName, String value, SourceTier tier,
                          double confidence, LocalDateTime producedAt) {
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
        this.tier = Objects.requireNonNull(tier, "tier");
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("Confidence must be within [0.0, 1.0]: " + confidence);
        }
        this.value = value;
        this.confidence = confidence;
        this.producedAt = producedAt;
    }

    public static CandidateValue manual(String fieldName, String value, LocalDateTime correctedAt) {
        return new CandidateValue(fieldName, value, SourceTier.MANUAL, 1.0, correctedAt);
    }

    public static CandidateValue metadata(String fieldName, String value, double confidence,
                                          LocalDateTime producedAt) {
        return new CandidateValue(fieldName, value, SourceTier.STRUCTURED_METADATA, confidence, producedAt);
    }

    /**
     * OCR candidate; the tier follows from the confidence score.
     */
    public static CandidateValue extracted(String fieldName, String value, double confidence,
                                           LocalDateTime producedAt) {
        return new CandidateValue(fieldName, value, SourceTier.forExtractionConfidence(confidence),
                confidence, producedAt);
    }

    public static CandidateValue systemDefault(String fieldName, String value) {
        return new CandidateValue(fieldName, value, SourceTier.SYSTEM_DEFAULT, 0.5, null);
    }

    /**
     * Null and blank values never take part in resolution.
     */
    public boolean isPresent() {
        return value != null && !value.isBlank();
    }
}
