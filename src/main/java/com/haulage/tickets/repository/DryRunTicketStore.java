package com.haulage.tickets.repository;

import com.haulage.tickets.entity.DuplicateLink;
import com.haulage.tickets.entity.ProcessingRun;
import com.haulage.tickets.entity.ReviewEntry;
import com.haulage.tickets.entity.Ticket;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Store decorator for dry runs. Ticket, link and review writes are buffered
 * in memory and never reach the delegate; reads see the delegate's data
 * overlaid with the buffered writes of this run. Run records pass through so
 * the dry run is still audited.
 * <p>
 * Buffered tickets receive negative ids so they can never collide with
 * persisted ones.
 */
@Slf4j
public class DryRunTicketStore implements TicketStore {

    private final TicketStore delegate;

    private final AtomicLong idSequence = new AtomicLong();
    private final Map<Long, Ticket> tickets = new ConcurrentHashMap<>();
    private final List<DuplicateLink> links = new CopyOnWriteArrayList<>();
    private final List<ReviewEntry> reviewEntries = new CopyOnWriteArrayList<>();

    public DryRunTicketStore(TicketStore delegate) {
        this.delegate = delegate;
    }

    @Override
    public Ticket create(Ticket ticket) {
        ticket.setId(idSequence.decrementAndGet());
        tickets.put(ticket.getId(), ticket);
        return ticket;
    }

    @Override
    public Ticket update(Ticket ticket, String runId) {
        ticket.setUpdatedByRunId(runId);
        tickets.put(ticket.getId(), ticket);
        return ticket;
    }

    @Override
    public Optional<Ticket> findById(Long id) {
        Ticket buffered = tickets.get(id);
        return buffered != null ? Optional.of(buffered) : delegate.findById(id);
    }

    @Override
    public Optional<Ticket> findDuplicateCandidate(String ticketNumber, String vendor,
                                                   LocalDate from, LocalDate to) {
        List<Ticket> matches = new ArrayList<>();
        delegate.findDuplicateCandidate(ticketNumber, vendor, from, to)
                .map(persisted -> tickets.getOrDefault(persisted.getId(), persisted))
                .ifPresent(matches::add);
        tickets.values().stream()
                .filter(t -> t.getDuplicateOf() == null)
                .filter(t -> ticketNumber.equals(t.getTicketNumber()) && vendor.equals(t.getVendor()))
                .filter(t -> !t.getTicketDate().isBefore(from) && !t.getTicketDate().isAfter(to))
                .forEach(matches::add);

        return matches.stream()
                .min(Comparator.comparing(Ticket::getTicketDate)
                        .thenComparing(t -> t.getId() < 0)
                        .thenComparingLong(t -> Math.abs(t.getId())));
    }

    @Override
    public Optional<Ticket> findBySourcePage(String sourceFile, int pageNumber) {
        Optional<Ticket> buffered = tickets.values().stream()
                .filter(t -> t.getDuplicateOf() == null)
                .filter(t -> sourceFile.equals(t.getSourceFile()) && t.getPageNumber() == pageNumber)
                .findFirst();
        return buffered.isPresent() ? buffered : delegate.findBySourcePage(sourceFile, pageNumber);
    }

    @Override
    public DuplicateLink insertDuplicateLink(DuplicateLink link) {
        links.add(link);
        return link;
    }

    @Override
    public ReviewEntry insertReviewEntry(ReviewEntry entry) {
        entry.setId(idSequence.decrementAndGet());
        reviewEntries.add(entry);
        return entry;
    }

    @Override
    public ProcessingRun upsertRunRecord(ProcessingRun run) {
        return delegate.upsertRunRecord(run);
    }

    @Override
    public Optional<ProcessingRun> findRunRecord(String runId) {
        return delegate.findRunRecord(runId);
    }

    @Override
    public void discardFile(String runId, String sourceFile) {
        List<Long> discarded = tickets.values().stream()
                .filter(t -> sourceFile.equals(t.getSourceFile()))
                .map(Ticket::getId)
                .collect(Collectors.toList());
        discarded.forEach(tickets::remove);
        links.removeIf(link -> discarded.contains(link.getTicketId()));
        reviewEntries.removeIf(entry -> sourceFile.equals(entry.getSourceFile()));
    }

    @Override
    public int rollbackRun(String runId) {
        int buffered = bufferedWrites();
        tickets.clear();
        links.clear();
        reviewEntries.clear();
        log.info("Dry run {} discarded {} buffered writes", runId, buffered);
        return buffered;
    }

    public int bufferedWrites() {
        return tickets.size() + links.size() + reviewEntries.size();
    }

    public List<Ticket> getBufferedTickets() {
        return List.copyOf(tickets.values());
    }

    public List<ReviewEntry> getBufferedReviewEntries() {
        return List.copyOf(reviewEntries);
    }

    public List<DuplicateLink> getBufferedLinks() {
        return List.copyOf(links);
    }
}
