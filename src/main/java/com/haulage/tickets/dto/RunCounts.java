package com.haulage.tickets.dto;

import com.haulage.tickets.entity.PageOutcome;
import lombok.Builder;
import lombok.Value;

/**
 * Counters of a processing run. Used both as an additive delta reported by a
 * finished file and as the final totals written to the ledger.
 */
@Value
@Builder(toBuilder = true)
public class RunCounts {

    public static final RunCounts ZERO = RunCounts.builder().build();

    int files;
    int filesSucceeded;
    int filesFailed;
    int filesSkipped;
    int pages;
    int ticketsCreated;
    int ticketsUpdated;
    int duplicatesFound;
    int reviewQueueCount;
    int reviewEntries;
    int errors;

    /**
     * Delta for one attempted page.
     */
    public static RunCounts forPage(PageOutcome outcome, int reviewEntries) {
        RunCountsBuilder builder = RunCounts.builder().pages(1).reviewEntries(reviewEntries);
        switch (outcome) {
            case CREATED -> builder.ticketsCreated(1);
            case UPDATED -> builder.ticketsUpdated(1);
            case DUPLICATE -> builder.duplicatesFound(1);
            case REVIEW -> builder.reviewQueueCount(1);
            case ERROR -> builder.errors(1);
        }
        return builder.build();
    }

    public RunCounts plus(RunCounts other) {
        return RunCounts.builder()
                .files(files + other.files)
                .filesSucceeded(filesSucceeded + other.filesSucceeded)
                .filesFailed(filesFailed + other.filesFailed)
                .filesSkipped(filesSkipped + other.filesSkipped)
                .pages(pages + other.pages)
                .ticketsCreated(ticketsCreated + other.ticketsCreated)
                .ticketsUpdated(ticketsUpdated + other.ticketsUpdated)
                .duplicatesFound(duplicatesFound + other.duplicatesFound)
                .reviewQueueCount(reviewQueueCount + other.reviewQueueCount)
                .reviewEntries(reviewEntries + other.reviewEntries)
                .errors(errors + other.errors)
                .build();
    }

    /**
     * Sum of the per-page outcome categories. Equals {@link #pages} for a
     * consistent run.
     */
    public int categoryTotal() {
        return ticketsCreated + ticketsUpdated + duplicatesFound + reviewQueueCount + errors;
    }

    public boolean isConsistent() {
        return categoryTotal() == pages;
    }
}
