package com.haulage.tickets.entity;

import com.haulage.tickets.dto.RunCounts;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Ledger record of one batch run. The only entity mutated across the lifetime
 * of a run: created at start, incremented as files finish, finalized at the end.
 */
@Entity
@Table(name = "processing_runs", indexes = {
        @Index(name = "idx_run_id", columnList = "run_id", unique = true),
        @Index(name = "idx_run_status_started", columnList = "status, started_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessingRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_id", nullable = false, unique = true, length = 50)
    private String runId;

    @Column(name = "job_id", length = 50)
    private String jobId;

    @Column(name = "processed_by", length = 100)
    private String processedBy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RunStatus status;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "files_count")
    private int filesCount;

    @Column(name = "files_succeeded")
    private int filesSucceeded;

    @Column(name = "files_failed")
    private int filesFailed;

    @Column(name = "files_skipped")
    private int filesSkipped;

    @Column(name = "pages_count")
    private int pagesCount;

    @Column(name = "tickets_created")
    private int ticketsCreated;

    @Column(name = "tickets_updated")
    private int ticketsUpdated;

    @Column(name = "duplicates_found")
    private int duplicatesFound;

    @Column(name = "review_queue_count")
    private int reviewQueueCount;

    @Column(name = "review_entries_count")
    private int reviewEntriesCount;

    @Column(name = "error_count")
    private int errorCount;

    @Lob
    @Column(name = "config_snapshot")
    private String configSnapshot;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Version
    private Long version;

    public void applyDelta(RunCounts delta) {
        overwrite(toCounts().plus(delta));
    }

    public void overwrite(RunCounts counts) {
        this.filesCount = counts.getFiles();
        this.filesSucceeded = counts.getFilesSucceeded();
        this.filesFailed = counts.getFilesFailed();
        this.filesSkipped = counts.getFilesSkipped();
        this.pagesCount = counts.getPages();
        this.ticketsCreated = counts.getTicketsCreated();
        this.ticketsUpdated = counts.getTicketsUpdated();
        this.duplicatesFound = counts.getDuplicatesFound();
        this.reviewQueueCount = counts.getReviewQueueCount();
        this.reviewEntriesCount = counts.getReviewEntries();
        this.errorCount = counts.getErrors();
    }

    public RunCounts toCounts() {
        return RunCounts.builder()
                .files(filesCount)
                .filesSucceeded(filesSucceeded)
                .filesFailed(filesFailed)
                .filesSkipped(filesSkipped)
                .pages(pagesCount)
                .ticketsCreated(ticketsCreated)
                .ticketsUpdated(ticketsUpdated)
                .duplicatesFound(duplicatesFound)
                .reviewQueueCount(reviewQueueCount)
                .reviewEntries(reviewEntriesCount)
                .errors(errorCount)
                .build();
    }

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
