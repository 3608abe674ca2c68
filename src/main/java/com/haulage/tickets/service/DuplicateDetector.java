package com.haulage.tickets.service;

import com.haulage.tickets.entity.Ticket;
import com.haulage.tickets.repository.TicketStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Finds an earlier original transaction sharing the ticket number and vendor
 * within a trailing window of {@code tickets.duplicates.window-days} days.
 * <p>
 * Side-effect free. Callers that insert after a negative answer must hold the
 * {@link StripedKeyLock} for the key across check and insert.
 */
@Component
@Slf4j
public class DuplicateDetector {

    private final TicketStore defaultStore;
    private final int windowDays;

    public DuplicateDetector(TicketStore defaultStore,
                             @Value("${tickets.duplicates.window-days:120}") int windowDays) {
        if (windowDays < 0) {
            throw new IllegalArgumentException("Duplicate window must not be negative: " + windowDays);
        }
        this.defaultStore = defaultStore;
        this.windowDays = windowDays;
    }

    /**
     * @return id of the original ticket, if one exists in the window
     */
    public Optional<Long> check(String ticketNumber, String vendor, LocalDate ticketDate) {
        return findOriginal(defaultStore, ticketNumber, vendor, ticketDate).map(Ticket::getId);
    }

    /**
     * Looks up the original through the given store, which may be a dry-run
     * overlay of the default one.
     */
    public Optional<Ticket> findOriginal(TicketStore store, String ticketNumber, String vendor,
                                         LocalDate ticketDate) {
        if (ticketNumber == null || vendor == null || ticketDate == null) {
            return Optional.empty();
        }
        LocalDate from = ticketDate.minusDays(windowDays);
        Optional<Ticket> original = store.findDuplicateCandidate(ticketNumber, vendor, from, ticketDate);

        original.ifPresent(t -> log.debug("Ticket {} from {} dated {} duplicates ticket {} dated {}",
                ticketNumber, vendor, ticketDate, t.getId(), t.getTicketDate()));
        return original;
    }

    public int getWindowDays() {
        return windowDays;
    }
}
