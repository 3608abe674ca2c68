package com.haulage.tickets.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.haulage.tickets.dto.ComplianceResult;
import com.haulage.tickets.dto.FieldCorrectionRequest;
import com.haulage.tickets.dto.PageReference;
import com.haulage.tickets.entity.DuplicateLink;
import com.haulage.tickets.entity.ReviewEntry;
import com.haulage.tickets.entity.ReviewReason;
import com.haulage.tickets.entity.ReviewSeverity;
import com.haulage.tickets.entity.SourceTier;
import com.haulage.tickets.entity.Ticket;
import com.haulage.tickets.entity.TicketField;
import com.haulage.tickets.exception.ResourceNotFoundException;
import com.haulage.tickets.exception.StateConflictException;
import com.haulage.tickets.repository.ReviewEntryRepository;
import com.haulage.tickets.repository.TicketRepository;
import com.haulage.tickets.repository.TicketStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;

/**
 * Human side of the review queue: listing entries, resolving them and
 * recording manual field corrections.
 * <p>
 * A correction is stored as a {@code MANUAL} field, which no later automated
 * run can override. Resolving or correcting never leaves a regulated ticket
 * without either a manifest number or an open CRITICAL entry. A correction of
 * the ticket number, vendor or date re-runs duplicate detection for the
 * corrected ticket.
 */
@Service
@Slf4j
public class ReviewResolutionService {

    private final ReviewEntryRepository reviewEntryRepository;
    private final TicketRepository ticketRepository;
    private final TicketAssembler assembler;
    private final ComplianceValidator complianceValidator;
    private final ReviewQueueRouter router;
    private final TicketStore ticketStore;
    private final ObjectMapper objectMapper;
    private final DuplicateDetector duplicateDetector;
    private final StripedKeyLock keyLock;

    public ReviewResolutionService(ReviewEntryRepository reviewEntryRepository,
                                   TicketRepository ticketRepository,
                                   TicketAssembler assembler,
                                   ComplianceValidator complianceValidator,
                                   ReviewQueueRouter router,
                                   TicketStore ticketStore,
                                   ObjectMapper objectMapper,
                                   DuplicateDetector duplicateDetector,
                                   StripedKeyLock keyLock) {
        this.reviewEntryRepository = reviewEntryRepository;
        this.ticketRepository = ticketRepository;
        this.assembler = assembler;
        this.complianceValidator = complianceValidator;
        this.router = router;
        this.ticketStore = ticketStore;
        this.objectMapper = objectMapper;
        this.duplicateDetector = duplicateDetector;
        this.keyLock = keyLock;
    }

    @Transactional(readOnly = true)
    public Page<ReviewEntry> listQueue(boolean resolved, ReviewSeverity severity, Pageable pageable) {
        if (severity == null) {
            return reviewEntryRepository.findByResolved(resolved, pageable);
        }
        return reviewEntryRepository.findByResolvedAndSeverity(resolved, severity, pageable);
    }

    /**
     * Closes a review entry.
     *
     * @throws ResourceNotFoundException if the entry does not exist
     * @throws StateConflictException    if it is already resolved, or if it reports
     *                                   missing evidence that is still missing
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public ReviewEntry resolve(Long entryId, String resolvedBy, String notes) {
        ReviewEntry entry = reviewEntryRepository.findById(entryId)
                .orElseThrow(() -> new ResourceNotFoundException("Review entry not found: " + entryId));

        if (entry.isResolved()) {
            throw new StateConflictException("Review entry " + entryId + " is already resolved");
        }

        if (entry.getReason() == ReviewReason.MISSING_EVIDENCE && entry.getTicketId() != null) {
            Ticket ticket = ticketRepository.findById(entry.getTicketId()).orElse(null);
            if (ticket != null && complianceValidator.validate(ticket) == ComplianceResult.MISSING_EVIDENCE) {
                throw new StateConflictException("Ticket " + ticket.getId()
                        + " still has no manifest number; correct the field before resolving");
            }
        }

        entry.setResolved(true);
        entry.setResolvedBy(resolvedBy);
        entry.setResolvedAt(LocalDateTime.now());
        entry.setResolutionNotes(notes);
        ReviewEntry saved = reviewEntryRepository.save(entry);

        if (entry.getTicketId() != null) {
            ticketRepository.findById(entry.getTicketId()).ifPresent(this::refreshReviewFlag);
        }

        log.info("Review entry {} ({} {}) resolved by {}", entryId, entry.getSeverity(), entry.getReason(), resolvedBy);
        return saved;
    }

    /**
     * Records a manual correction of one field and re-derives the ticket's
     * columns from it.
     *
     * @throws IllegalArgumentException if the field is unknown or the value invalid
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public Ticket correctField(Long ticketId, String fieldName, FieldCorrectionRequest request) {
        if (!TicketFields.isKnown(fieldName)) {
            throw new IllegalArgumentException("Unknown field: " + fieldName);
        }
        Ticket ticket = ticketRepository.findById(ticketId)
                .orElseThrow(() -> new ResourceNotFoundException("Ticket not found: " + ticketId));

        String value = request.getValue() == null ? null : request.getValue().trim();
        if (TicketFields.REQUIRED.contains(fieldName) && (value == null || value.isEmpty())) {
            throw new IllegalArgumentException("Required field " + fieldName + " cannot be cleared");
        }
        if (TicketFields.TICKET_DATE.equals(fieldName) && TicketAssembler.parseDate(value) == null) {
            throw new IllegalArgumentException("Not a valid date: " + value);
        }

        String oldNumber = ticket.getTicketNumber();
        String oldVendor = ticket.getVendor();
        LocalDate oldDate = ticket.getTicketDate();

        TicketField previous = ticket.getFields().get(fieldName);
        ticket.getFields().put(fieldName, TicketField.builder()
                .value(value)
                .sourceTier(SourceTier.MANUAL)
                .confidence(1.0)
                .resolvedAt(LocalDateTime.now())
                .rejectedAlternatives(previousAsJson(previous))
                .build());
        assembler.deriveColumns(ticket);

        boolean keyChanged = !Objects.equals(oldNumber, ticket.getTicketNumber())
                || !Objects.equals(oldVendor, ticket.getVendor())
                || !Objects.equals(oldDate, ticket.getTicketDate());
        Ticket saved;
        if (keyChanged && !ticket.isDuplicate()) {
            saved = saveCheckingDuplicates(ticket, fieldName);
        } else {
            saved = ticketRepository.save(ticket);
        }

        log.info("Field {} of ticket {} corrected by {}", fieldName, ticketId, request.getCorrectedBy());

        if (complianceValidator.validate(saved) == ComplianceResult.MISSING_EVIDENCE
                && openEntries(saved.getId()).stream().noneMatch(ReviewEntry::isCritical)) {
            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("material", saved.getMaterial());
            evidence.put("destination", saved.getDestination());
            evidence.put("correctedField", fieldName);
            router.route(ticketStore, null, PageReference.of(saved.getSourceFile(), saved.getPageNumber()),
                    saved.getId(), ReviewReason.MISSING_EVIDENCE, null, evidence);
        }

        if (request.getReviewEntryId() != null) {
            resolve(request.getReviewEntryId(), request.getCorrectedBy(), "Corrected " + fieldName);
        } else {
            refreshReviewFlag(saved);
        }
        return ticketRepository.findById(ticketId).orElse(saved);
    }

    /**
     * Saves a ticket whose identity changed. If another original with the new
     * number and vendor lies within the duplicate window on either side, the
     * corrected ticket becomes its duplicate.
     */
    private Ticket saveCheckingDuplicates(Ticket ticket, String fieldName) {
        Lock lock = keyLock.lockFor(ticket.getTicketNumber(), ticket.getVendor());
        lock.lock();
        try {
            int window = duplicateDetector.getWindowDays();
            LocalDate date = ticket.getTicketDate();
            Ticket original = ticketRepository.findOriginalsInWindow(ticket.getTicketNumber(), ticket.getVendor(),
                            date.minusDays(window), date.plusDays(window), PageRequest.of(0, 2)).stream()
                    .filter(t -> !t.getId().equals(ticket.getId()))
                    .findFirst()
                    .orElse(null);
            if (original == null) {
                return ticketRepository.save(ticket);
            }

            ticket.setDuplicateOf(original.getId());
            ticket.setRequiresReview(true);
            Ticket saved = ticketRepository.save(ticket);
            long daysApart = Math.abs(ChronoUnit.DAYS.between(original.getTicketDate(), saved.getTicketDate()));
            ticketStore.insertDuplicateLink(DuplicateLink.builder()
                    .ticketId(saved.getId())
                    .originalTicketId(original.getId())
                    .ticketNumber(saved.getTicketNumber())
                    .vendor(saved.getVendor())
                    .daysApart(daysApart)
                    .build());

            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("originalTicketId", original.getId());
            evidence.put("originalSource", original.getSourceFile() + "#page" + original.getPageNumber());
            evidence.put("daysApart", daysApart);
            evidence.put("correctedField", fieldName);
            router.route(ticketStore, null, PageReference.of(saved.getSourceFile(), saved.getPageNumber()),
                    saved.getId(), ReviewReason.DUPLICATE_TICKET, null, evidence);

            log.warn("Corrected ticket {} duplicates ticket {} ({} days apart)",
                    saved.getId(), original.getId(), daysApart);
            return saved;
        } finally {
            lock.unlock();
        }
    }

    private List<ReviewEntry> openEntries(Long ticketId) {
        return reviewEntryRepository.findByTicketIdInAndResolvedFalse(List.of(ticketId));
    }

    /**
     * A ticket needs review while it has an open entry above INFO.
     */
    private void refreshReviewFlag(Ticket ticket) {
        boolean needsReview = openEntries(ticket.getId()).stream()
                .anyMatch(e -> e.getSeverity() != ReviewSeverity.INFO);
        if (needsReview != ticket.isRequiresReview()) {
            ticket.setRequiresReview(needsReview);
            ticketRepository.save(ticket);
        }
    }

    private String previousAsJson(TicketField previous) {
        if (previous == null || previous.getValue() == null) {
            return null;
        }
        Map<String, Object> alternative = new LinkedHashMap<>();
        alternative.put("value", previous.getValue());
        alternative.put("tier", previous.getSourceTier().name());
        alternative.put("confidence", previous.getConfidence());
        try {
            return objectMapper.writeValueAsString(List.of(alternative));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize previous field value: {}", e.getMessage());
            return null;
        }
    }
}
