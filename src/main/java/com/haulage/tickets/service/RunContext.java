package com.haulage.tickets.service;

import com.haulage.tickets.dto.BatchPolicy;
import com.haulage.tickets.repository.TicketStore;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Everything a worker needs to process files on behalf of one run.
 * Immutable; shared by all workers of the run.
 */
@Value
@Builder
public class RunContext {

    String runId;
    String jobId;
    BatchPolicy policy;

    /**
     * Directory file keys are relative to.
     */
    Path inputRoot;

    /**
     * Store the run writes through. A buffering overlay in dry runs.
     */
    TicketStore store;

    /**
     * Stable key for a source file: its path relative to the input root,
     * with forward slashes.
     */
    public String sourceKey(Path file) {
        Path relative = inputRoot != null && file.startsWith(inputRoot) && !file.equals(inputRoot)
                ? inputRoot.relativize(file)
                : file.getFileName();
        return relative.toString().replace('\\', '/');
    }
}
