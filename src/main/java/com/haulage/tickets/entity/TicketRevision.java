package com.haulage.tickets.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Snapshot of a ticket taken before a reprocessing run overwrote it.
 * Restored if that run is rolled back.
 */
@Entity
@Table(name = "ticket_revisions", indexes = {
        @Index(name = "idx_revision_run_id", columnList = "run_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketRevision {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ticket_id", nullable = false)
    private Long ticketId;

    @Column(name = "run_id", nullable = false, length = 50)
    private String runId;

    @Column(name = "source_file", nullable = false, length = 500)
    private String sourceFile;

    @Lob
    @Column(name = "snapshot", nullable = false)
    private String snapshot;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
