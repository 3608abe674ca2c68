package com.haulage.tickets.service;

import com.haulage.tickets.dto.PageReference;
import com.haulage.tickets.dto.TicketReportRow;
import com.haulage.tickets.entity.ProcessingRun;
import com.haulage.tickets.entity.ReviewEntry;
import com.haulage.tickets.entity.ReviewSeverity;
import com.haulage.tickets.entity.Ticket;
import com.haulage.tickets.repository.ReviewEntryRepository;
import com.haulage.tickets.repository.TicketRepository;
import lombok.Builder;
import lombok.Data;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only reporting view over tickets, the review queue and runs.
 * Produces rows only; formatting them into files is left to exporters.
 */
@Service
@Transactional(readOnly = true)
public class TicketReportService {

    private final TicketRepository ticketRepository;
    private final ReviewEntryRepository reviewEntryRepository;
    private final RunLedger ledger;

    public TicketReportService(TicketRepository ticketRepository,
                               ReviewEntryRepository reviewEntryRepository,
                               RunLedger ledger) {
        this.ticketRepository = ticketRepository;
        this.reviewEntryRepository = reviewEntryRepository;
        this.ledger = ledger;
    }

    /**
     * Ticket rows with the reasons of their open review entries.
     *
     * @param runId restricts the rows to tickets created by this run; null for all
     */
    public Page<TicketReportRow> ticketRows(String runId, Pageable pageable) {
        Page<Ticket> tickets = runId == null
                ? ticketRepository.findAll(pageable)
                : ticketRepository.findByRunId(runId, pageable);

        List<Long> ids = tickets.getContent().stream().map(Ticket::getId).collect(Collectors.toList());
        Map<Long, List<String>> openReasons = ids.isEmpty() ? Map.of() : reviewEntryRepository
                .findByTicketIdInAndResolvedFalse(ids).stream()
                .collect(Collectors.groupingBy(ReviewEntry::getTicketId,
                        Collectors.mapping(e -> e.getReason().name(), Collectors.toList())));

        return tickets.map(ticket -> toRow(ticket, openReasons.getOrDefault(ticket.getId(), List.of())));
    }

    public QueueStats queueStats() {
        Map<ReviewSeverity, Long> bySeverity = new EnumMap<>(ReviewSeverity.class);
        for (ReviewSeverity severity : ReviewSeverity.values()) {
            bySeverity.put(severity, 0L);
        }
        for (Object[] row : reviewEntryRepository.countOpenBySeverity()) {
            bySeverity.put((ReviewSeverity) row[0], (Long) row[1]);
        }
        long open = bySeverity.values().stream().mapToLong(Long::longValue).sum();

        return QueueStats.builder()
                .openEntries(open)
                .openBySeverity(bySeverity)
                .originalTickets(ticketRepository.countByDuplicateOfIsNull())
                .duplicateTickets(ticketRepository.countByDuplicateOfIsNotNull())
                .regulatedWithoutEvidence(ticketRepository.findRegulatedWithoutEvidence().size())
                .build();
    }

    public List<ProcessingRun> recentRuns(int limit) {
        return ledger.recentRuns(limit);
    }

    private static TicketReportRow toRow(Ticket ticket, List<String> openReasons) {
        return TicketReportRow.builder()
                .ticketId(ticket.getId())
                .ticketNumber(ticket.getTicketNumber())
                .vendor(ticket.getVendor())
                .ticketDate(ticket.getTicketDate())
                .jobCode(ticket.getJobCode())
                .material(ticket.getMaterial())
                .destination(ticket.getDestination())
                .manifestNumber(ticket.getManifestNumber())
                .quantity(ticket.getQuantity())
                .quantityUnit(ticket.getQuantityUnit())
                .truckNumber(ticket.getTruckNumber())
                .regulated(ticket.isRegulated())
                .duplicateOf(ticket.getDuplicateOf())
                .requiresReview(ticket.isRequiresReview())
                .sourcePage(PageReference.of(ticket.getSourceFile(), ticket.getPageNumber()).pageId())
                .runId(ticket.getRunId())
                .openReviewReasons(openReasons)
                .build();
    }

    @Data
    @Builder
    public static class QueueStats {
        private long openEntries;
        private Map<ReviewSeverity, Long> openBySeverity;
        private long originalTickets;
        private long duplicateTickets;
        private long regulatedWithoutEvidence;
    }
}
