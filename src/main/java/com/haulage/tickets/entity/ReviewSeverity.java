package com.haulage.tickets.entity;

/**
 * Priority of a review queue entry. Declared from most to least severe.
 */
public enum ReviewSeverity {
    CRITICAL,
    WARNING,
    INFO;

    /**
     * Returns the more severe of the two.
     */
    public ReviewSeverity escalate(ReviewSeverity other) {
        if (other == null) {
            return this;
        }
        return this.ordinal() <= other.ordinal() ? this : other;
    }
}
