package com.haulage.tickets.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.haulage.tickets.entity.DuplicateLink;
import com.haulage.tickets.entity.ProcessingRun;
import com.haulage.tickets.entity.ReviewEntry;
import com.haulage.tickets.entity.Ticket;
import com.haulage.tickets.entity.TicketRevision;
import com.haulage.tickets.exception.ResourceNotFoundException;
import com.haulage.tickets.exception.TerminalInfraException;
import com.haulage.tickets.exception.TicketProcessingException;
import com.haulage.tickets.exception.TransientInfraException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link TicketStore} backed by the Spring Data repositories.
 * <p>
 * Each operation runs in its own READ_COMMITTED transaction, opened inside the
 * exception translation so that a backend that refuses connections is
 * reported as terminal rather than leaking Spring's exception types.
 */
@Component
@Slf4j
public class JpaTicketStore implements TicketStore {

    private final TicketRepository ticketRepository;
    private final DuplicateLinkRepository duplicateLinkRepository;
    private final ReviewEntryRepository reviewEntryRepository;
    private final ProcessingRunRepository processingRunRepository;
    private final TicketRevisionRepository revisionRepository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;

    public JpaTicketStore(TicketRepository ticketRepository,
                          DuplicateLinkRepository duplicateLinkRepository,
                          ReviewEntryRepository reviewEntryRepository,
                          ProcessingRunRepository processingRunRepository,
                          TicketRevisionRepository revisionRepository,
                          ObjectMapper objectMapper,
                          PlatformTransactionManager transactionManager) {
        this.ticketRepository = ticketRepository;
        this.duplicateLinkRepository = duplicateLinkRepository;
        this.reviewEntryRepository = reviewEntryRepository;
        this.processingRunRepository = processingRunRepository;
        this.revisionRepository = revisionRepository;
        this.objectMapper = objectMapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
    }

    @Override
    public Ticket create(Ticket ticket) {
        return inTransaction("create ticket", () -> ticketRepository.save(ticket));
    }

    @Override
    public Ticket update(Ticket ticket, String runId) {
        return inTransaction("update ticket", () -> {
            Ticket current = ticketRepository.findById(ticket.getId())
                    .orElseThrow(() -> new ResourceNotFoundException("Ticket not found: " + ticket.getId()));

            revisionRepository.save(TicketRevision.builder()
                    .ticketId(current.getId())
                    .runId(runId)
                    .sourceFile(current.getSourceFile())
                    .snapshot(toSnapshot(current))
                    .build());

            current.copyContentFrom(ticket);
            current.setUpdatedByRunId(runId);
            return ticketRepository.save(current);
        });
    }

    @Override
    public Optional<Ticket> findById(Long id) {
        return inTransaction("find ticket", () -> ticketRepository.findById(id));
    }

    @Override
    public Optional<Ticket> findDuplicateCandidate(String ticketNumber, String vendor,
                                                   LocalDate from, LocalDate to) {
        return inTransaction("find duplicate candidate", () -> ticketRepository
                .findOriginalsInWindow(ticketNumber, vendor, from, to, PageRequest.of(0, 1))
                .stream()
                .findFirst());
    }

    @Override
    public Optional<Ticket> findBySourcePage(String sourceFile, int pageNumber) {
        return inTransaction("find ticket by page", () -> ticketRepository
                .findFirstBySourceFileAndPageNumberAndDuplicateOfIsNullOrderByIdAsc(sourceFile, pageNumber));
    }

    @Override
    public DuplicateLink insertDuplicateLink(DuplicateLink link) {
        return inTransaction("insert duplicate link", () -> duplicateLinkRepository.save(link));
    }

    @Override
    public ReviewEntry insertReviewEntry(ReviewEntry entry) {
        return inTransaction("insert review entry", () -> reviewEntryRepository.save(entry));
    }

    @Override
    public ProcessingRun upsertRunRecord(ProcessingRun run) {
        return inTransaction("upsert run record", () -> processingRunRepository.save(run));
    }

    @Override
    public Optional<ProcessingRun> findRunRecord(String runId) {
        return inTransaction("find run record", () -> processingRunRepository.findByRunId(runId));
    }

    @Override
    public void discardFile(String runId, String sourceFile) {
        inTransaction("discard file", () -> {
            long entries = reviewEntryRepository.deleteByRunIdAndSourceFile(runId, sourceFile);

            List<Ticket> tickets = ticketRepository.findByRunIdAndSourceFile(runId, sourceFile);
            List<Long> ticketIds = tickets.stream().map(Ticket::getId).collect(Collectors.toList());
            long links = ticketIds.isEmpty() ? 0 : duplicateLinkRepository.deleteByTicketIdIn(ticketIds);
            ticketRepository.deleteAll(tickets);

            int restored = restoreRevisions(revisionRepository.findByRunIdAndSourceFileOrderByIdDesc(runId, sourceFile));

            log.debug("Discarded partial writes of {} in run {}: {} tickets, {} links, {} review entries, {} restored",
                    sourceFile, runId, tickets.size(), links, entries, restored);
            return null;
        });
    }

    @Override
    public int rollbackRun(String runId) {
        return inTransaction("roll back run", () -> {
            long entries = reviewEntryRepository.deleteByRunId(runId);
            long links = duplicateLinkRepository.deleteByRunId(runId);

            List<Ticket> tickets = ticketRepository.findByRunId(runId);
            ticketRepository.deleteAll(tickets);

            int restored = restoreRevisions(revisionRepository.findByRunIdOrderByIdDesc(runId));

            log.info("Rolled back run {}: {} tickets, {} links, {} review entries removed, {} tickets restored",
                    runId, tickets.size(), links, entries, restored);
            return (int) (entries + links + tickets.size() + restored);
        });
    }

    /**
     * Restores tickets from revisions, newest first, and drops the revisions.
     */
    private int restoreRevisions(List<TicketRevision> revisions) {
        int restored = 0;
        for (TicketRevision revision : revisions) {
            Optional<Ticket> current = ticketRepository.findById(revision.getTicketId());
            if (current.isPresent()) {
                current.get().copyContentFrom(fromSnapshot(revision.getSnapshot()));
                ticketRepository.save(current.get());
                restored++;
            }
        }
        revisionRepository.deleteAll(revisions);
        return restored;
    }

    private String toSnapshot(Ticket ticket) {
        try {
            return objectMapper.writeValueAsString(ticket);
        } catch (JsonProcessingException e) {
            throw new TicketProcessingException("Failed to snapshot ticket " + ticket.getId(), e);
        }
    }

    private Ticket fromSnapshot(String snapshot) {
        try {
            return objectMapper.readValue(snapshot, Ticket.class);
        } catch (JsonProcessingException e) {
            throw new TicketProcessingException("Failed to read ticket revision", e);
        }
    }

    private <T> T inTransaction(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (CannotCreateTransactionException | DataAccessResourceFailureException e) {
            log.error("Persistence backend unavailable during {}: {}", operation, e.getMessage());
            throw new TerminalInfraException("Persistence backend unavailable during " + operation, e);
        } catch (TransientDataAccessException e) {
            log.warn("Transient persistence failure during {}: {}", operation, e.getMessage());
            throw new TransientInfraException("Transient persistence failure during " + operation, null, e);
        }
    }
}
