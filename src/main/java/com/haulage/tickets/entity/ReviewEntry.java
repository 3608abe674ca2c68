package com.haulage.tickets.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A routed exception waiting for human resolution.
 * <p>
 * The pipeline only ever creates entries. Resolution fields are written by the
 * review workflow.
 */
@Entity
@Table(name = "review_queue", indexes = {
        @Index(name = "idx_review_resolved_severity", columnList = "resolved, severity"),
        @Index(name = "idx_review_ticket", columnList = "ticket_id"),
        @Index(name = "idx_review_run_id", columnList = "run_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Ticket the entry refers to; null when no ticket could be created.
     */
    @Column(name = "ticket_id")
    private Long ticketId;

    /**
     * File path plus page number, e.g. {@code batch1/file1.pdf#page2}.
     */
    @Column(name = "page_id", nullable = false, length = 520)
    private String pageId;

    @Column(name = "source_file", nullable = false, length = 500)
    private String sourceFile;

    @Column(name = "page_number", nullable = false)
    private int pageNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, length = 40)
    private ReviewReason reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 20)
    private ReviewSeverity severity;

    /**
     * JSON object describing what was detected.
     */
    @Column(name = "evidence", length = 4000)
    private String evidence;

    @Column(name = "suggested_action", length = 500)
    private String suggestedAction;

    @Column(name = "resolved", nullable = false)
    private boolean resolved;

    @Column(name = "resolved_by", length = 100)
    private String resolvedBy;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @Column(name = "resolution_notes", length = 1000)
    private String resolutionNotes;

    @Column(name = "run_id", length = 50)
    private String runId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }

    public boolean isCritical() {
        return severity == ReviewSeverity.CRITICAL;
    }

    public boolean isOpen() {
        return !resolved;
    }
}
