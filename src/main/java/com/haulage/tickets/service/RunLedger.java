package com.haulage.tickets.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.haulage.tickets.dto.RunCounts;
import com.haulage.tickets.entity.ProcessingRun;
import com.haulage.tickets.entity.RunStatus;
import com.haulage.tickets.exception.ResourceNotFoundException;
import com.haulage.tickets.repository.ProcessingRunRepository;
import com.haulage.tickets.repository.TicketStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable audit record of processing runs.
 * <p>
 * A run record is created when the run starts, receives additive count deltas
 * while files finish and is finalized exactly once. Writes are serialized on
 * this instance; in practice only the orchestrator's aggregator thread calls
 * {@link #update}.
 */
@Service
@Slf4j
public class RunLedger {

    private final TicketStore store;
    private final ProcessingRunRepository runRepository;
    private final ObjectMapper objectMapper;

    @Value("${tickets.processed-by:ticket-resolution-service}")
    private String processedBy = "ticket-resolution-service";

    public RunLedger(TicketStore store, ProcessingRunRepository runRepository, ObjectMapper objectMapper) {
        this.store = store;
        this.runRepository = runRepository;
        this.objectMapper = objectMapper;
    }

    public String start(Map<String, Object> configSnapshot) {
        return start(null, configSnapshot);
    }

    /**
     * Opens a run record in {@code IN_PROGRESS}.
     *
     * @return the new run id
     */
    public synchronized String start(String jobId, Map<String, Object> configSnapshot) {
        String runId = UUID.randomUUID().toString();

        store.upsertRunRecord(ProcessingRun.builder()
                .runId(runId)
                .jobId(jobId)
                .processedBy(processedBy)
                .status(RunStatus.IN_PROGRESS)
                .startedAt(LocalDateTime.now())
                .configSnapshot(toJson(configSnapshot))
                .build());

        log.info("Started run {} for job {}", runId, jobId);
        return runId;
    }

    /**
     * Adds the delta to the run's counters.
     */
    public synchronized ProcessingRun update(String runId, RunCounts delta) {
        ProcessingRun run = load(runId);
        if (run.getStatus().isTerminal()) {
            throw new IllegalStateException("Run " + runId + " is already " + run.getStatus());
        }
        run.applyDelta(delta);
        return store.upsertRunRecord(run);
    }

    /**
     * Finalizes the run with its terminal status and authoritative totals.
     */
    public ProcessingRun finish(String runId, RunStatus status, RunCounts finalCounts) {
        return finish(runId, status, finalCounts, null);
    }

    /**
     * Finalizes the run, recording why it ended early.
     */
    public synchronized ProcessingRun finish(String runId, RunStatus status, RunCounts finalCounts,
                                             String errorMessage) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Cannot finish run with status " + status);
        }
        ProcessingRun run = load(runId);
        if (run.getStatus().isTerminal()) {
            throw new IllegalStateException("Run " + runId + " is already " + run.getStatus());
        }
        run.overwrite(finalCounts);
        run.setStatus(status);
        if (errorMessage != null) {
            run.setErrorMessage(truncate(errorMessage, 1000));
        }
        run.setCompletedAt(LocalDateTime.now());
        ProcessingRun saved = store.upsertRunRecord(run);

        log.info("Run {} finished {}: files={} succeeded={} failed={} skipped={} pages={} created={} " +
                        "updated={} duplicates={} review={} errors={}",
                runId, status, finalCounts.getFiles(), finalCounts.getFilesSucceeded(),
                finalCounts.getFilesFailed(), finalCounts.getFilesSkipped(), finalCounts.getPages(),
                finalCounts.getTicketsCreated(), finalCounts.getTicketsUpdated(),
                finalCounts.getDuplicatesFound(), finalCounts.getReviewQueueCount(), finalCounts.getErrors());
        return saved;
    }

    /**
     * Finalizes the run as {@code FAILED} with an error message, keeping the
     * counters accumulated so far.
     */
    public synchronized ProcessingRun fail(String runId, String message) {
        ProcessingRun run = load(runId);
        run.setStatus(RunStatus.FAILED);
        run.setErrorMessage(truncate(message, 1000));
        run.setCompletedAt(LocalDateTime.now());
        log.error("Run {} failed: {}", runId, message);
        return store.upsertRunRecord(run);
    }

    public Optional<ProcessingRun> find(String runId) {
        return store.findRunRecord(runId);
    }

    public List<ProcessingRun> recentRuns(int limit) {
        return runRepository.findAllByOrderByStartedAtDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    private ProcessingRun load(String runId) {
        return store.findRunRecord(runId)
                .orElseThrow(() -> new ResourceNotFoundException("Run not found: " + runId));
    }

    private String toJson(Map<String, Object> snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize run configuration: {}", e.getMessage());
            return String.valueOf(snapshot);
        }
    }

    private static String truncate(String message, int max) {
        if (message == null || message.length() <= max) {
            return message;
        }
        return message.substring(0, max);
    }
}
