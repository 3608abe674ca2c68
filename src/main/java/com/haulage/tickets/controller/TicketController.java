package com.haulage.tickets.controller;

import com.haulage.tickets.dto.FieldCorrectionRequest;
import com.haulage.tickets.dto.TicketReportRow;
import com.haulage.tickets.entity.Ticket;
import com.haulage.tickets.exception.ResourceNotFoundException;
import com.haulage.tickets.repository.TicketRepository;
import com.haulage.tickets.service.ReviewResolutionService;
import com.haulage.tickets.service.TicketReportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
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
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Tickets", description = "Tickets, manual corrections and the reporting view")
public class TicketController {

    private final TicketRepository ticketRepository;
    private final ReviewResolutionService resolutionService;
    private final TicketReportService reportService;

    @Operation(summary = "Get ticket by ID", description = "Returns a ticket with every resolved field and its provenance.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Ticket found"),
            @ApiResponse(responseCode = "404", description = "Ticket not found")
    })
    @GetMapping("/tickets/{id}")
    public ResponseEntity<Ticket> getTicket(@Parameter(description = "Ticket ID") @PathVariable Long id) {
        return ticketRepository.findById(id)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Ticket not found: " + id));
    }

    @Operation(
            summary = "Correct a ticket field",
            description = "Stores a manual value for the field. Manual values outrank every automated source, including future reprocessing runs."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Field corrected"),
            @ApiResponse(responseCode = "400", description = "Unknown field or invalid value"),
            @ApiResponse(responseCode = "404", description = "Ticket not found")
    })
    @PutMapping("/tickets/{id}/fields/{field}")
    public ResponseEntity<Ticket> correctField(@PathVariable Long id, @PathVariable String field,
                                               @RequestBody FieldCorrectionRequest request) {
        return ResponseEntity.ok(resolutionService.correctField(id, field, request));
    }

    @Operation(summary = "Ticket report", description = "Flat ticket rows with their open review reasons, optionally limited to one run.")
    @ApiResponse(responseCode = "200", description = "Rows retrieved successfully")
    @GetMapping("/reports/tickets")
    public ResponseEntity<Page<TicketReportRow>> ticketReport(
            @Parameter(description = "Run id filter") @RequestParam(required = false) String runId,
            @Parameter(description = "Page number (0-indexed)") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "50") int size) {
        return ResponseEntity.ok(reportService.ticketRows(runId,
                PageRequest.of(page, size, Sort.by("ticketDate", "id"))));
    }
}
