package com.haulage.tickets.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for starting a run through the API. Unset fields fall back to
 * the configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunRequest {
    private String inputPath;
    private String jobId;
    private Integer workers;
    private Integer maxRetries;
    private Boolean dryRun;
    private Boolean reprocess;
    private Boolean continueOnError;
    private Boolean rollbackOnCritical;
    private String filePattern;
}
