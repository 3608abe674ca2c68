package com.haulage.tickets.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * A single-page haul ticket extracted from a scanned source file.
 * <p>
 * {@link #fields} holds exactly one resolved value per field name. The identity
 * columns (ticket number, vendor, date, manifest...) are derived from those
 * fields and kept as columns so duplicate lookups stay indexed.
 */
@Entity
@Table(name = "tickets", indexes = {
        @Index(name = "idx_ticket_number_vendor_date", columnList = "ticket_number, vendor, ticket_date"),
        @Index(name = "idx_ticket_source_page", columnList = "source_file, page_number"),
        @Index(name = "idx_ticket_run_id", columnList = "run_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Ticket {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ticket_number", nullable = false, length = 100)
    private String ticketNumber;

    /**
     * Counterparty identifier, normalized.
     */
    @Column(name = "vendor", nullable = false, length = 100)
    private String vendor;

    @Column(name = "ticket_date", nullable = false)
    private LocalDate ticketDate;

    @Column(name = "job_code", length = 50)
    private String jobCode;

    @Column(name = "material", length = 100)
    private String material;

    @Column(name = "destination", length = 100)
    private String destination;

    /**
     * Evidence identifier required for regulated material.
     */
    @Column(name = "manifest_number", length = 50)
    private String manifestNumber;

    @Column(name = "quantity", precision = 12, scale = 2)
    private BigDecimal quantity;

    @Column(name = "quantity_unit", length = 20)
    private String quantityUnit;

    @Column(name = "truck_number", length = 50)
    private String truckNumber;

    @Column(name = "regulated", nullable = false)
    private boolean regulated;

    @Column(name = "source_file", nullable = false, length = 500)
    private String sourceFile;

    @Column(name = "page_number", nullable = false)
    private int pageNumber;

    /**
     * Run that created this ticket.
     */
    @Column(name = "run_id", length = 50)
    private String runId;

    /**
     * Run that last updated this ticket in reprocess mode.
     */
    @Column(name = "updated_by_run_id", length = 50)
    private String updatedByRunId;

    @Column(name = "duplicate_of")
    private Long duplicateOf;

    @Column(name = "requires_review", nullable = false)
    private boolean requiresReview;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "ticket_fields", joinColumns = @JoinColumn(name = "ticket_id"))
    @MapKeyColumn(name = "field_name", length = 50)
    @Builder.Default
    private Map<String, TicketField> fields = new HashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * Copies resolved content from another ticket, leaving identity, audit and
     * version columns untouched.
     */
    public void copyContentFrom(Ticket other) {
        this.ticketNumber = other.ticketNumber;
        this.vendor = other.vendor;
        this.ticketDate = other.ticketDate;
        this.jobCode = other.jobCode;
        this.material = other.material;
        this.destination = other.destination;
        this.manifestNumber = other.manifestNumber;
        this.quantity = other.quantity;
        this.quantityUnit = other.quantityUnit;
        this.truckNumber = other.truckNumber;
        this.regulated = other.regulated;
        this.requiresReview = other.requiresReview;
        this.updatedByRunId = other.updatedByRunId;
        if (this.fields == null) {
            this.fields = new HashMap<>();
        }
        this.fields.clear();
        if (other.fields != null) {
            other.fields.forEach((name, field) -> this.fields.put(name, new TicketField(
                    field.getValue(), field.getSourceTier(), field.getConfidence(),
                    field.getResolvedAt(), field.getRejectedAlternatives())));
        }
    }

    public boolean isDuplicate() {
        return duplicateOf != null;
    }

    public boolean hasEvidence() {
        return manifestNumber != null && !manifestNumber.isBlank();
    }
}
