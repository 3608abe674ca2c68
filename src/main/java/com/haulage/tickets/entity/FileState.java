package com.haulage.tickets.entity;

/**
 * States a single source file moves through inside a run.
 * <p>
 * PENDING -> PROCESSING -> (SUCCEEDED | FAILED_RETRYABLE -> PROCESSING | FAILED_TERMINAL)
 */
public enum FileState {
    PENDING,
    PROCESSING,
    SUCCEEDED,
    FAILED_RETRYABLE,
    FAILED_TERMINAL,

    /**
     * Never dispatched because the run was cancelled or aborted.
     */
    SKIPPED
}
