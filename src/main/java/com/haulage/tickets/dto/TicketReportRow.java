package com.haulage.tickets.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Flat, read-only row of the reporting view. Exporters format these; this
 * service never writes files itself.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketReportRow {
    private Long ticketId;
    private String ticketNumber;
    private String vendor;
    private LocalDate ticketDate;
    private String jobCode;
    private String material;
    private String destination;
    private String manifestNumber;
    private BigDecimal quantity;
    private String quantityUnit;
    private String truckNumber;
    private boolean regulated;
    private Long duplicateOf;
    private boolean requiresReview;
    private String sourcePage;
    private String runId;
    private List<String> openReviewReasons;
}
