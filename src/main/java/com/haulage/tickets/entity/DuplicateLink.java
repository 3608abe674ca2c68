package com.haulage.tickets.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Links a newly processed ticket to the earlier original it duplicates.
 */
@Entity
@Table(name = "duplicate_links", indexes = {
        @Index(name = "idx_duplicate_ticket", columnList = "ticket_id", unique = true),
        @Index(name = "idx_duplicate_original", columnList = "original_ticket_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DuplicateLink {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ticket_id", nullable = false)
    private Long ticketId;

    @Column(name = "original_ticket_id", nullable = false)
    private Long originalTicketId;

    @Column(name = "ticket_number", nullable = false, length = 100)
    private String ticketNumber;

    @Column(name = "vendor", nullable = false, length = 100)
    private String vendor;

    @Column(name = "days_apart")
    private long daysApart;

    @Column(name = "run_id", length = 50)
    private String runId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
