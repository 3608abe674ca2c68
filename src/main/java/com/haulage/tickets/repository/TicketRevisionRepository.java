package com.haulage.tickets.repository;

import com.haulage.tickets.entity.TicketRevision;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TicketRevisionRepository extends JpaRepository<TicketRevision, Long> {

    List<TicketRevision> findByRunIdOrderByIdDesc(String runId);

    List<TicketRevision> findByRunIdAndSourceFileOrderByIdDesc(String runId, String sourceFile);
}
