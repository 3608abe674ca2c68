package com.haulage.tickets.repository;

import com.haulage.tickets.entity.ReviewEntry;
import com.haulage.tickets.entity.ReviewReason;
import com.haulage.tickets.entity.ReviewSeverity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for the review queue.
 */
@Repository
public interface ReviewEntryRepository extends JpaRepository<ReviewEntry, Long> {

    Page<ReviewEntry> findByResolved(boolean resolved, Pageable pageable);

    Page<ReviewEntry> findByResolvedAndSeverity(boolean resolved, ReviewSeverity severity, Pageable pageable);

    List<ReviewEntry> findByTicketId(Long ticketId);

    List<ReviewEntry> findByTicketIdInAndResolvedFalse(Collection<Long> ticketIds);

    List<ReviewEntry> findByRunId(String runId);

    List<ReviewEntry> findByRunIdAndReason(String runId, ReviewReason reason);

    long countByResolvedFalseAndSeverity(ReviewSeverity severity);

    long deleteByRunId(String runId);

    long deleteByRunIdAndSourceFile(String runId, String sourceFile);

    /**
     * Open entry counts grouped by severity.
     */
    @Query("SELECT r.severity, COUNT(r) FROM ReviewEntry r WHERE r.resolved = false GROUP BY r.severity")
    List<Object[]> countOpenBySeverity();
}
