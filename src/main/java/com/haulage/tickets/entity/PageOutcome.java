package com.haulage.tickets.entity;

/**
 * The single accounting category of one attempted page.
 * <p>
 * Every page falls into exactly one category, so the per-category counts of a
 * run always add up to the number of pages attempted.
 */
public enum PageOutcome {

    /**
     * New non-duplicate ticket persisted with no blocking review entry.
     */
    CREATED,

    /**
     * Existing ticket for the same source page updated in reprocess mode.
     */
    UPDATED,

    /**
     * Ticket persisted and linked to an earlier original.
     */
    DUPLICATE,

    /**
     * Page routed to the review queue with at least one CRITICAL or WARNING entry.
     */
    REVIEW,

    /**
     * Page could not be processed.
     */
    ERROR
}
