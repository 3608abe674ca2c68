package com.haulage.tickets.entity;

/**
 * Lifecycle status of a processing run.
 */
public enum RunStatus {

    /**
     * Run started and not yet finalized.
     */
    IN_PROGRESS(-1),

    /**
     * Every file succeeded.
     */
    COMPLETED(0),

    /**
     * Some files failed or were skipped; everything processed so far is kept.
     */
    PARTIAL(2),

    /**
     * No file succeeded, or the run was aborted and rolled back.
     */
    FAILED(3);

    private final int exitCode;

    RunStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    /**
     * Process exit code reported by the command-line runner for this status.
     */
    public int getExitCode() {
        return exitCode;
    }

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
