package com.haulage.tickets.repository;

import com.haulage.tickets.entity.DuplicateLink;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface DuplicateLinkRepository extends JpaRepository<DuplicateLink, Long> {

    Optional<DuplicateLink> findByTicketId(Long ticketId);

    List<DuplicateLink> findByOriginalTicketId(Long originalTicketId);

    long countByRunId(String runId);

    long deleteByRunId(String runId);

    long deleteByTicketIdIn(Collection<Long> ticketIds);
}
