package com.haulage.tickets.entity;

/**
 * Reason codes for review queue entries.
 * <p>
 * Each reason carries the severity it is always routed with, so severity
 * assignment is deterministic given the reason.
 */
public enum ReviewReason {

    /**
     * Regulated material without a manifest number.
     */
    MISSING_EVIDENCE(ReviewSeverity.CRITICAL, "Enter the manifest number from the physical ticket"),

    /**
     * Manifest number present but not 8-20 characters of [A-Z0-9-_].
     */
    INVALID_EVIDENCE_FORMAT(ReviewSeverity.WARNING, "Verify the manifest number against the physical ticket"),

    MISSING_TICKET_NUMBER(ReviewSeverity.WARNING, "Enter the ticket number from the physical ticket"),

    MISSING_COUNTERPARTY(ReviewSeverity.WARNING, "Identify the vendor for this ticket"),

    INVALID_DATE(ReviewSeverity.WARNING, "Enter the ticket date from the physical ticket"),

    /**
     * Same ticket number and vendor seen within the duplicate window.
     */
    DUPLICATE_TICKET(ReviewSeverity.WARNING, "Verify if re-scan or legitimate duplicate load"),

    /**
     * Unexpected failure while processing a single page.
     */
    PROCESSING_ERROR(ReviewSeverity.WARNING, "Re-run the page or enter the ticket manually"),

    /**
     * A required field was resolved from a low-confidence extraction or a default.
     */
    INFERRED_FIELD(ReviewSeverity.INFO, "Spot-check the inferred value");

    private final ReviewSeverity severity;
    private final String suggestedAction;

    ReviewReason(ReviewSeverity severity, String suggestedAction) {
        this.severity = severity;
        this.suggestedAction = suggestedAction;
    }

    public ReviewSeverity getSeverity() {
        return severity;
    }

    public String getSuggestedAction() {
        return suggestedAction;
    }
}
