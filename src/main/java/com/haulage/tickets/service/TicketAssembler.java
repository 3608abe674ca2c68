package com.haulage.tickets.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.haulage.tickets.dto.CandidateValue;
import com.haulage.tickets.dto.PageReference;
import com.haulage.tickets.dto.ResolvedField;
import com.haulage.tickets.entity.ReviewReason;
import com.haulage.tickets.entity.SourceTier;
import com.haulage.tickets.entity.Ticket;
import com.haulage.tickets.entity.TicketField;
import com.haulage.tickets.exception.RequiredFieldException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds {@link Ticket} entities from resolved fields and keeps the typed
 * columns in step with the field map.
 */
@Component
@Slf4j
public class TicketAssembler {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("M/d/uuuu"),
            DateTimeFormatter.ofPattern("M/d/uu"),
            DateTimeFormatter.ofPattern("M-d-uuuu"));

    private static final int MAX_REJECTED_KEPT = 20;

    private final RegulatedMaterialPolicy regulatedMaterialPolicy;
    private final ObjectMapper objectMapper;

    public TicketAssembler(RegulatedMaterialPolicy regulatedMaterialPolicy, ObjectMapper objectMapper) {
        this.regulatedMaterialPolicy = regulatedMaterialPolicy;
        this.objectMapper = objectMapper;
    }

    /**
     * Creates an unsaved ticket for the page. Identity columns may be null when
     * the corresponding field did not resolve; see {@link #requireIdentity}.
     */
    public Ticket assemble(Map<String, ResolvedField> resolved, PageReference page, String runId) {
        Ticket ticket = Ticket.builder()
                .sourceFile(page.getSourceFile())
                .pageNumber(page.getPageNumber())
                .runId(runId)
                .build();

        LocalDateTime now = LocalDateTime.now();
        resolved.forEach((name, field) -> ticket.getFields().put(name, toTicketField(field, now)));
        deriveColumns(ticket);
        return ticket;
    }

    /**
     * Re-derives the typed columns and the regulated flag from the field map.
     */
    public void deriveColumns(Ticket ticket) {
        Map<String, TicketField> fields = ticket.getFields();

        ticket.setTicketNumber(upper(value(fields, TicketFields.TICKET_NUMBER)));
        ticket.setVendor(TicketFields.normalizeVendor(value(fields, TicketFields.VENDOR)));
        ticket.setTicketDate(parseDate(value(fields, TicketFields.TICKET_DATE)));
        ticket.setJobCode(value(fields, TicketFields.JOB_CODE));
        ticket.setMaterial(upper(value(fields, TicketFields.MATERIAL)));
        ticket.setDestination(TicketFields.normalizeVendor(value(fields, TicketFields.DESTINATION)));
        ticket.setManifestNumber(upper(value(fields, TicketFields.MANIFEST_NUMBER)));
        ticket.setQuantity(parseQuantity(value(fields, TicketFields.QUANTITY)));
        ticket.setQuantityUnit(upper(value(fields, TicketFields.QUANTITY_UNIT)));
        ticket.setTruckNumber(value(fields, TicketFields.TRUCK_NUMBER));
        ticket.setRegulated(regulatedMaterialPolicy.isRegulated(ticket.getMaterial(), ticket.getDestination()));
    }

    /**
     * @throws RequiredFieldException naming the first required field that is
     *                                missing or unparseable
     */
    public void requireIdentity(Ticket ticket) {
        if (ticket.getTicketNumber() == null) {
            throw new RequiredFieldException(TicketFields.TICKET_NUMBER, ReviewReason.MISSING_TICKET_NUMBER,
                    "Ticket number could not be resolved");
        }
        if (ticket.getVendor() == null) {
            throw new RequiredFieldException(TicketFields.VENDOR, ReviewReason.MISSING_COUNTERPARTY,
                    "Vendor could not be resolved");
        }
        if (ticket.getTicketDate() == null) {
            String raw = value(ticket.getFields(), TicketFields.TICKET_DATE);
            throw new RequiredFieldException(TicketFields.TICKET_DATE, ReviewReason.INVALID_DATE,
                    raw == null ? "Ticket date could not be resolved" : "Ticket date is not a valid date: " + raw);
        }
    }

    /**
     * Required fields whose winning value came from a low-confidence
     * extraction or a configured default.
     */
    public List<String> inferredRequiredFields(Ticket ticket) {
        List<String> inferred = new ArrayList<>();
        for (String name : TicketFields.REQUIRED) {
            TicketField field = ticket.getFields().get(name);
            if (field != null && field.getValue() != null
                    && (field.getSourceTier() == SourceTier.EXTRACTED_LOW_CONFIDENCE
                    || field.getSourceTier() == SourceTier.SYSTEM_DEFAULT)) {
                inferred.add(name);
            }
        }
        inferred.sort(String::compareTo);
        return inferred;
    }

    public TicketField toTicketField(ResolvedField field, LocalDateTime resolvedAt) {
        return TicketField.builder()
                .value(field.getValue())
                .sourceTier(field.getTier())
                .confidence(field.getConfidence())
                .resolvedAt(resolvedAt)
                .rejectedAlternatives(rejectedJson(field.getRejected()))
                .build();
    }

    public static LocalDate parseDate(String value) {
        if (value == null) {
            return null;
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(value.trim(), format);
            } catch (DateTimeParseException e) {
                // next format
            }
        }
        log.debug("Unparseable ticket date '{}'", value);
        return null;
    }

    static BigDecimal parseQuantity(String value) {
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value.replace(",", "").trim());
        } catch (NumberFormatException e) {
            log.debug("Unparseable quantity '{}'", value);
            return null;
        }
    }

    private String rejectedJson(List<CandidateValue> rejected) {
        if (rejected.isEmpty()) {
            return null;
        }
        List<Map<String, Object>> alternatives = new ArrayList<>(rejected.size());
        for (CandidateValue candidate : rejected.subList(0, Math.min(rejected.size(), MAX_REJECTED_KEPT))) {
            Map<String, Object> alternative = new LinkedHashMap<>();
            alternative.put("value", candidate.getValue());
            alternative.put("tier", candidate.getTier().name());
            alternative.put("confidence", candidate.getConfidence());
            alternatives.add(alternative);
        }
        try {
            return objectMapper.writeValueAsString(alternatives);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize rejected alternatives: {}", e.getMessage());
            return null;
        }
    }

    private static String value(Map<String, TicketField> fields, String name) {
        TicketField field = fields.get(name);
        if (field == null || field.getValue() == null || field.getValue().isBlank()) {
            return null;
        }
        return field.getValue().trim();
    }

    private static String upper(String value) {
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }
}
