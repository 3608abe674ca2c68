package com.haulage.tickets.dto;

import com.haulage.tickets.entity.ReviewReason;

import java.util.Optional;

/**
 * Outcome of the mandatory-evidence check. Never a rejection: failing results
 * tell the caller which review entry to route.
 */
public enum ComplianceResult {

    /**
     * Ticket is not in a regulated category.
     */
    NOT_REQUIRED(null),

    OK(null),

    MISSING_EVIDENCE(ReviewReason.MISSING_EVIDENCE),

    INVALID_EVIDENCE_FORMAT(ReviewReason.INVALID_EVIDENCE_FORMAT);

    private final ReviewReason reviewReason;

    ComplianceResult(ReviewReason reviewReason) {
        this.reviewReason = reviewReason;
    }

    public Optional<ReviewReason> reviewReason() {
        return Optional.ofNullable(reviewReason);
    }

    public boolean requiresReview() {
        return reviewReason != null;
    }
}
