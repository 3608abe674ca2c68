package com.haulage.tickets.controller;

import com.haulage.tickets.dto.ReviewResolutionRequest;
import com.haulage.tickets.entity.ReviewEntry;
import com.haulage.tickets.entity.ReviewSeverity;
import com.haulage.tickets.service.ReviewResolutionService;
import com.haulage.tickets.service.TicketReportService;
import com.haulage.tickets.service.TicketReportService.QueueStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/review-queue")
@RequiredArgsConstructor
@Tag(name = "Review Queue", description = "Human review of routed exceptions")
public class ReviewQueueController {

    private final ReviewResolutionService resolutionService;
    private final TicketReportService reportService;

    @Operation(summary = "List review entries", description = "Returns review entries, open ones by default, optionally filtered by severity.")
    @ApiResponse(responseCode = "200", description = "Entries retrieved successfully")
    @GetMapping
    public ResponseEntity<Page<ReviewEntry>> listEntries(
            @Parameter(description = "Return resolved instead of open entries") @RequestParam(defaultValue = "false") boolean resolved,
            @Parameter(description = "Severity filter") @RequestParam(required = false) ReviewSeverity severity,
            @Parameter(description = "Page number (0-indexed)") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(resolutionService.listQueue(resolved, severity,
                PageRequest.of(page, size, Sort.by("createdAt", "id"))));
    }

    @Operation(summary = "Review queue statistics", description = "Open entries by severity plus ticket totals.")
    @ApiResponse(responseCode = "200", description = "Statistics retrieved successfully",
            content = @Content(schema = @Schema(implementation = QueueStats.class)))
    @GetMapping("/stats")
    public ResponseEntity<QueueStats> stats() {
        return ResponseEntity.ok(reportService.queueStats());
    }

    @Operation(summary = "Resolve a review entry", description = "Marks the entry resolved. Missing-evidence entries can only be resolved once the manifest number has been entered.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Entry resolved"),
            @ApiResponse(responseCode = "404", description = "Entry not found"),
            @ApiResponse(responseCode = "409", description = "Entry already resolved or evidence still missing")
    })
    @PostMapping("/{id}/resolve")
    public ResponseEntity<ReviewEntry> resolve(@PathVariable Long id, @RequestBody ReviewResolutionRequest request) {
        return ResponseEntity.ok(resolutionService.resolve(id, request.getResolvedBy(), request.getNotes()));
    }
}
