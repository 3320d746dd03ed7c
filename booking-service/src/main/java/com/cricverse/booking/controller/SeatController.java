package com.cricverse.booking.controller;

import com.cricverse.booking.dto.response.SeatAvailabilityResponse;
import com.cricverse.booking.dto.response.SeatMapResponse;
import com.cricverse.booking.service.SeatAvailabilityService;
import com.cricverse.booking.service.SeatInventoryService;
import com.cricverse.common.response.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Seat", description = "Seat availability and inventory")
@RestController
@RequestMapping("/api/v1/events/{eventId}/seats")
@RequiredArgsConstructor
public class SeatController {

    private final SeatAvailabilityService seatAvailabilityService;
    private final SeatInventoryService seatInventoryService;

    @Operation(summary = "Seat map", description = "Every seat of the event with its current state; advisory only")
    @GetMapping
    public ResponseEntity<ApiResponse<SeatMapResponse>> getSeatMap(@PathVariable Long eventId) {
        var rows = seatAvailabilityService.getSeatMap(eventId);
        return ResponseEntity.ok(ApiResponse.ok(SeatMapResponse.of(eventId, rows)));
    }

    @Operation(summary = "Seat availability", description = "Current state of the given seats; advisory only")
    @GetMapping("/availability")
    public ResponseEntity<ApiResponse<SeatAvailabilityResponse>> getAvailability(
            @PathVariable Long eventId,
            @RequestParam("seatIds") List<Long> seatIds) {
        var states = seatAvailabilityService.getAvailability(eventId, seatIds);
        return ResponseEntity.ok(ApiResponse.ok(SeatAvailabilityResponse.of(eventId, states)));
    }

    @Operation(summary = "Open inventory", description = "Put every stadium seat of the event on sale; idempotent")
    @PostMapping("/inventory")
    public ResponseEntity<ApiResponse<SeatInventoryService.InventoryResult>> openInventory(@PathVariable Long eventId) {
        return ResponseEntity.ok(ApiResponse.ok(seatInventoryService.openEvent(eventId)));
    }
}
