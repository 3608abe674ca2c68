package com.haulage.tickets.repository;

import com.haulage.tickets.entity.ProcessingRun;
import com.haulage.tickets.entity.RunStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ProcessingRunRepository extends JpaRepository<ProcessingRun, Long> {

    Optional<ProcessingRun> findByRunId(String runId);

    /**
     * Locks the run row so concurrent counter updates are serialized.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM ProcessingRun r WHERE r.runId = :runId")
    Optional<ProcessingRun> findByRunIdWithLock(@Param("runId") String runId);

    List<ProcessingRun> findAllByOrderByStartedAtDesc(Pageable pageable);

    List<ProcessingRun> findByStatusOrderByStartedAtDesc(RunStatus status);
}
