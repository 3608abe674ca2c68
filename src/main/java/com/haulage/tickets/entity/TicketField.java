package com.haulage.tickets.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Persisted form of a resolved field: the chosen value with its provenance.
 * Rejected alternatives are kept as a JSON array for audit.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketField {

    @Column(name = "field_value", length = 500)
    private String value;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_tier", nullable = false, length = 40)
    private SourceTier sourceTier;

    @Column(name = "confidence", nullable = false)
    private double confidence;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @Column(name = "rejected_alternatives", length = 4000)
    private String rejectedAlternatives;

    public boolean isManual() {
        return sourceTier == SourceTier.MANUAL;
    }
}
