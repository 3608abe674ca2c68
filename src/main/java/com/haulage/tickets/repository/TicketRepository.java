package com.haulage.tickets.repository;

import com.haulage.tickets.entity.Ticket;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Repository for Ticket entities with the lookups duplicate detection needs.
 */
@Repository
public interface TicketRepository extends JpaRepository<Ticket, Long> {

    /**
     * Originals (never duplicates themselves) sharing the ticket number and vendor
     * within [from, to], earliest first.
     */
    @Query("SELECT t FROM Ticket t WHERE t.ticketNumber = :ticketNumber " +
            "AND t.vendor = :vendor " +
            "AND t.ticketDate >= :from AND t.ticketDate <= :to " +
            "AND t.duplicateOf IS NULL " +
            "ORDER BY t.ticketDate ASC, t.id ASC")
    List<Ticket> findOriginalsInWindow(
            @Param("ticketNumber") String ticketNumber,
            @Param("vendor") String vendor,
            @Param("from") LocalDate from,
            @Param("to") LocalDate to,
            Pageable pageable
    );

    /**
     * Ticket previously created from the same page of the same file.
     */
    Optional<Ticket> findFirstBySourceFileAndPageNumberAndDuplicateOfIsNullOrderByIdAsc(
            String sourceFile, int pageNumber);

    List<Ticket> findByRunId(String runId);

    List<Ticket> findByRunIdAndSourceFile(String runId, String sourceFile);

    Page<Ticket> findByRunId(String runId, Pageable pageable);

    long countByDuplicateOfIsNull();

    long countByDuplicateOfIsNotNull();

    long countByRunId(String runId);

    /**
     * Regulated tickets without a manifest number, for compliance audits.
     */
    @Query("SELECT t FROM Ticket t WHERE t.regulated = true " +
            "AND (t.manifestNumber IS NULL OR TRIM(t.manifestNumber) = '')")
    List<Ticket> findRegulatedWithoutEvidence();
}
