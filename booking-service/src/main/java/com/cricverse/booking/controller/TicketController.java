package com.cricverse.booking.controller;

import com.cricverse.booking.dto.request.TransferTicketRequest;
import com.cricverse.booking.dto.response.TicketResponse;
import com.cricverse.booking.service.TicketService;
import com.cricverse.common.response.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Ticket", description = "Issued tickets: cancel, transfer, admit")
@RestController
@RequestMapping("/api/v1/tickets")
@RequiredArgsConstructor
public class TicketController {

    private final TicketService ticketService;

    @Operation(summary = "List customer tickets")
    @GetMapping
    public ResponseEntity<ApiResponse<List<TicketResponse>>> getCustomerTickets(
            @Parameter(hidden = true) @RequestHeader("X-Customer-Id") Long customerId) {
        var tickets = ticketService.getCustomerTickets(customerId).stream()
                .map(TicketResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.ok(tickets));
    }

    @Operation(summary = "Get ticket")
    @GetMapping("/{ticketId}")
    public ResponseEntity<ApiResponse<TicketResponse>> getTicket(
            @PathVariable Long ticketId,
            @Parameter(hidden = true) @RequestHeader("X-Customer-Id") Long customerId) {
        return ResponseEntity.ok(ApiResponse.ok(TicketResponse.from(ticketService.getTicket(ticketId, customerId))));
    }

    @Operation(summary = "Cancel ticket", description = "Cancel a valid ticket and put its seat back on sale")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Ticket cancelled"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "Ticket held by another customer"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Ticket not VALID")
    })
    @PostMapping("/{ticketId}/cancel")
    public ResponseEntity<ApiResponse<TicketResponse>> cancelTicket(
            @PathVariable Long ticketId,
            @Parameter(hidden = true) @RequestHeader("X-Customer-Id") Long customerId) {
        return ResponseEntity.ok(ApiResponse.ok(TicketResponse.from(ticketService.cancelTicket(ticketId, customerId))));
    }

    @Operation(summary = "Transfer ticket", description = "Re-issue a valid ticket to another customer")
    @PostMapping("/{ticketId}/transfer")
    public ResponseEntity<ApiResponse<TicketResponse>> transferTicket(
            @PathVariable Long ticketId,
            @Parameter(hidden = true) @RequestHeader("X-Customer-Id") Long customerId,
            @Valid @RequestBody TransferTicketRequest request) {
        var replacement = ticketService.transferTicket(ticketId, customerId, request.recipientCustomerId());
        return ResponseEntity.ok(ApiResponse.ok(TicketResponse.from(replacement)));
    }

    @Operation(summary = "Admit", description = "Gate scan; a ticket admits once")
    @PostMapping("/{ticketId}/admit")
    public ResponseEntity<ApiResponse<TicketResponse>> admit(@PathVariable Long ticketId) {
        return ResponseEntity.ok(ApiResponse.ok(TicketResponse.from(ticketService.admit(ticketId))));
    }
}
