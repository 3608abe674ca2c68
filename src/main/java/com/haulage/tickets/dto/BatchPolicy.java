package com.haulage.tickets.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable retry, rollback and concurrency settings for one run. Built once
 * before the run starts and never changed while it executes.
 */
@Value
@Builder(toBuilder = true)
public class BatchPolicy {

    /**
     * Size of the worker pool.
     */
    @Builder.Default
    int workers = Runtime.getRuntime().availableProcessors();

    /**
     * Retries after the first attempt for transient failures.
     */
    @Builder.Default
    int maxRetries = 2;

    /**
     * Linear back-off unit: the n-th retry waits {@code n * backoffBase}.
     */
    @Builder.Default
    Duration backoffBase = Duration.ofSeconds(1);

    @Builder.Default
    Duration fileTimeout = Duration.ofSeconds(300);

    @Builder.Default
    boolean continueOnError = true;

    @Builder.Default
    boolean rollbackOnCritical = true;

    /**
     * Run the full pipeline without writing tickets or review entries.
     */
    @Builder.Default
    boolean dryRun = false;

    /**
     * Update tickets already created from the same source page instead of
     * flagging them as duplicates.
     */
    @Builder.Default
    boolean reprocess = false;

    @Builder.Default
    String filePattern = "*.pdf";

    public int maxAttempts() {
        return maxRetries + 1;
    }

    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("workers", workers);
        snapshot.put("maxRetries", maxRetries);
        snapshot.put("backoffBaseMs", backoffBase.toMillis());
        snapshot.put("fileTimeoutSeconds", fileTimeout.toSeconds());
        snapshot.put("continueOnError", continueOnError);
        snapshot.put("rollbackOnCritical", rollbackOnCritical);
        snapshot.put("dryRun", dryRun);
        snapshot.put("reprocess", reprocess);
        snapshot.put("filePattern", filePattern);
        return snapshot;
    }
}
