package com.haulage.tickets.entity;

/**
 * Origin of a candidate field value, declared from highest to lowest precedence.
 * <p>
 * The declaration order is the precedence order: a {@code MANUAL} correction is
 * never superseded by any automated source, however recent or confident.
 */
public enum SourceTier {

    /**
     * A prior human correction entered through the review workflow.
     */
    MANUAL,

    /**
     * Parsed from the source file's own name or folder path.
     */
    STRUCTURED_METADATA,

    /**
     * OCR extraction with confidence of at least 0.9.
     */
    EXTRACTED_HIGH_CONFIDENCE,

    /**
     * OCR extraction with confidence in [0.7, 0.9).
     */
    EXTRACTED_MEDIUM_CONFIDENCE,

    /**
     * OCR extraction with confidence below 0.7.
     */
    EXTRACTED_LOW_CONFIDENCE,

    /**
     * Configured fallback value.
     */
    SYSTEM_DEFAULT;

    public static final double HIGH_CONFIDENCE_THRESHOLD = 0.9;
    public static final double MEDIUM_CONFIDENCE_THRESHOLD = 0.7;

    /**
     * Maps an OCR confidence score onto one of the three extracted tiers.
     */
    public static SourceTier forExtractionConfidence(double confidence) {
        if (confidence >= HIGH_CONFIDENCE_THRESHOLD) {
            return EXTRACTED_HIGH_CONFIDENCE;
        }
        if (confidence >= MEDIUM_CONFIDENCE_THRESHOLD) {
            return EXTRACTED_MEDIUM_CONFIDENCE;
        }
        return EXTRACTED_LOW_CONFIDENCE;
    }

    /**
     * Returns true if this tier takes precedence over {@code other}.
     */
    public boolean outranks(SourceTier other) {
        return this.ordinal() < other.ordinal();
    }

    public boolean isExtracted() {
        return this == EXTRACTED_HIGH_CONFIDENCE
                || this == EXTRACTED_MEDIUM_CONFIDENCE
                || this == EXTRACTED_LOW_CONFIDENCE;
    }
}
