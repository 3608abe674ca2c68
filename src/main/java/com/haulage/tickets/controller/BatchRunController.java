package com.haulage.tickets.controller;

import com.haulage.tickets.config.BatchPolicyFactory;
import com.haulage.tickets.dto.BatchPolicy;
import com.haulage.tickets.dto.RunRequest;
import com.haulage.tickets.entity.ProcessingRun;
import com.haulage.tickets.exception.ResourceNotFoundException;
import com.haulage.tickets.service.BatchOrchestrator;
import com.haulage.tickets.service.RunLedger;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * REST API for batch runs.
 * <p>
 * Provides endpoints for:
 * - Starting a run in the background
 * - Inspecting run ledger records
 * - Cancelling a run in progress
 */
@RestController
@RequestMapping("/api/v1/runs")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Runs", description = "Batch run control and run ledger")
public class BatchRunController {

    private final BatchOrchestrator orchestrator;
    private final RunLedger ledger;
    private final BatchPolicyFactory policyFactory;

    @Operation(
            summary = "Start a batch run",
            description = "Starts processing the source files under the given input path in the background. Returns the run id immediately; poll the run to follow progress."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Run started"),
            @ApiResponse(responseCode = "400", description = "Invalid input path or policy"),
            @ApiResponse(responseCode = "409", description = "A run is already in progress")
    })
    @PostMapping
    public ResponseEntity<Map<String, Object>> startRun(@RequestBody RunRequest request) {
        if (request.getInputPath() == null || request.getInputPath().isBlank()) {
            throw new IllegalArgumentException("inputPath is required");
        }
        BatchPolicy policy = policyFactory.fromRequest(request);
        String runId = orchestrator.submit(Path.of(request.getInputPath()), request.getJobId(), policy);

        log.info("Run {} started via API for {}", runId, request.getInputPath());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "runId", runId,
                "policy", policy.toSnapshot()));
    }

    @Operation(summary = "List recent runs", description = "Returns the most recent run ledger records, newest first.")
    @ApiResponse(responseCode = "200", description = "Runs retrieved successfully")
    @GetMapping
    public ResponseEntity<List<ProcessingRun>> recentRuns(
            @Parameter(description = "Maximum number of runs") @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(ledger.recentRuns(limit));
    }

    @Operation(summary = "Get run by id", description = "Returns the ledger record of one run, including its counters and status.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Run found",
                    content = @Content(schema = @Schema(implementation = ProcessingRun.class))),
            @ApiResponse(responseCode = "404", description = "Run not found")
    })
    @GetMapping("/{runId}")
    public ResponseEntity<ProcessingRun> getRun(@Parameter(description = "Run id") @PathVariable String runId) {
        return ledger.find(runId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Run not found: " + runId));
    }

    @Operation(
            summary = "Cancel a run",
            description = "Stops dispatching new files. Files in flight finish or time out; the remaining files are counted as skipped and the run ends PARTIAL."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Cancellation requested"),
            @ApiResponse(responseCode = "404", description = "Run not found"),
            @ApiResponse(responseCode = "409", description = "Run already finished or cancelled")
    })
    @PostMapping("/{runId}/cancel")
    public ResponseEntity<Map<String, Object>> cancelRun(@PathVariable String runId) {
        orchestrator.cancel(runId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("runId", runId, "cancelled", true));
    }
}
