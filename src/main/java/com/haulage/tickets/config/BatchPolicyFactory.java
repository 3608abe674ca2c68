package com.haulage.tickets.config;

import com.haulage.tickets.dto.BatchPolicy;
import com.haulage.tickets.dto.RunRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds the immutable {@link BatchPolicy} for a run from the configured
 * {@code tickets.batch.*} defaults plus per-run overrides.
 */
@Component
public class BatchPolicyFactory {

    @Value("${tickets.batch.workers:0}")
    private int workers;

    @Value("${tickets.batch.max-retries:2}")
    private int maxRetries;

    @Value("${tickets.batch.backoff-base-ms:1000}")
    private long backoffBaseMs;

    @Value("${tickets.batch.file-timeout-seconds:300}")
    private long fileTimeoutSeconds;

    @Value("${tickets.batch.continue-on-error:true}")
    private boolean continueOnError;

    @Value("${tickets.batch.rollback-on-critical:true}")
    private boolean rollbackOnCritical;

    @Value("${tickets.batch.file-pattern:*.pdf}")
    private String filePattern;

    /**
     * Policy from configuration alone. A worker count of 0 means one worker
     * per available processor.
     */
    public BatchPolicy defaults() {
        return validate(BatchPolicy.builder()
                .workers(workers > 0 ? workers : Runtime.getRuntime().availableProcessors())
                .maxRetries(maxRetries)
                .backoffBase(Duration.ofMillis(backoffBaseMs))
                .fileTimeout(Duration.ofSeconds(fileTimeoutSeconds))
                .continueOnError(continueOnError)
                .rollbackOnCritical(rollbackOnCritical)
                .filePattern(filePattern)
                .build());
    }

    public BatchPolicy fromRequest(RunRequest request) {
        BatchPolicy.BatchPolicyBuilder builder = defaults().toBuilder();
        if (request.getWorkers() != null) {
            builder.workers(request.getWorkers());
        }
        if (request.getMaxRetries() != null) {
            builder.maxRetries(request.getMaxRetries());
        }
        if (request.getDryRun() != null) {
            builder.dryRun(request.getDryRun());
        }
        if (request.getReprocess() != null) {
            builder.reprocess(request.getReprocess());
        }
        if (request.getContinueOnError() != null) {
            builder.continueOnError(request.getContinueOnError());
        }
        if (request.getRollbackOnCritical() != null) {
            builder.rollbackOnCritical(request.getRollbackOnCritical());
        }
        if (request.getFilePattern() != null && !request.getFilePattern().isBlank()) {
            builder.filePattern(request.getFilePattern());
        }
        return validate(builder.build());
    }

    /**
     * @throws IllegalArgumentException if a setting is out of range
     */
    public static BatchPolicy validate(BatchPolicy policy) {
        if (policy.getWorkers() < 1) {
            throw new IllegalArgumentException("workers must be at least 1: " + policy.getWorkers());
        }
        if (policy.getMaxRetries() < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + policy.getMaxRetries());
        }
        if (policy.getBackoffBase().isNegative()) {
            throw new IllegalArgumentException("backoff base must not be negative");
        }
        if (policy.getFileTimeout().isZero() || policy.getFileTimeout().isNegative()) {
            throw new IllegalArgumentException("file timeout must be positive");
        }
        return policy;
    }
}
