package com.haulage.tickets.dto;

import com.haulage.tickets.entity.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Summary of a finished batch run, returned to the caller alongside the
 * persisted ledger record.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchRunResult {

    private String runId;
    private String jobId;
    private RunStatus status;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    @Builder.Default
    private RunCounts counts = RunCounts.ZERO;

    @Builder.Default
    private List<FileOutcome> fileOutcomes = new ArrayList<>();

    private boolean cancelled;
    private boolean rolledBack;
    private String abortReason;

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }

    public int getExitCode() {
        return status == null ? RunStatus.FAILED.getExitCode() : status.getExitCode();
    }
}
