package com.haulage.tickets.dto;

import com.haulage.tickets.entity.FileState;
import lombok.Builder;
import lombok.Value;

/**
 * Result a worker reports for one source file.
 */
@Value
@Builder
public class FileOutcome {

    String sourceFile;
    FileState state;
    int attempts;

    /**
     * Delta to apply to the run ledger, including the file itself.
     */
    RunCounts counts;

    String errorMessage;
    long durationMs;

    public boolean isSucceeded() {
        return state == FileState.SUCCEEDED;
    }
}
