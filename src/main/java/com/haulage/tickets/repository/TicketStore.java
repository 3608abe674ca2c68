package com.haulage.tickets.repository;

import com.haulage.tickets.entity.DuplicateLink;
import com.haulage.tickets.entity.ProcessingRun;
import com.haulage.tickets.entity.ReviewEntry;
import com.haulage.tickets.entity.Ticket;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Persistence boundary of the processing pipeline.
 * <p>
 * Implementations translate backend failures into the processing exception
 * taxonomy: momentary contention surfaces as
 * {@link com.haulage.tickets.exception.TransientInfraException}, loss of the
 * backend as {@link com.haulage.tickets.exception.TerminalInfraException}.
 */
public interface TicketStore {

    Ticket create(Ticket ticket);

    /**
     * Overwrites the content of an existing ticket on behalf of a reprocessing
     * run, keeping a revision of the previous content so the run can be undone.
     */
    Ticket update(Ticket ticket, String runId);

    Optional<Ticket> findById(Long id);

    /**
     * Earliest original ticket with the same number and vendor dated within
     * [from, to].
     */
    Optional<Ticket> findDuplicateCandidate(String ticketNumber, String vendor, LocalDate from, LocalDate to);

    /**
     * Original ticket previously created from the given page.
     */
    Optional<Ticket> findBySourcePage(String sourceFile, int pageNumber);

    DuplicateLink insertDuplicateLink(DuplicateLink link);

    ReviewEntry insertReviewEntry(ReviewEntry entry);

    ProcessingRun upsertRunRecord(ProcessingRun run);

    Optional<ProcessingRun> findRunRecord(String runId);

    /**
     * Removes everything the given run wrote for one source file, so the file
     * can be attempted again from a clean slate.
     */
    void discardFile(String runId, String sourceFile);

    /**
     * Undoes every ticket, link, review entry and update written by the run.
     *
     * @return number of records removed or restored
     */
    int rollbackRun(String runId);
}
