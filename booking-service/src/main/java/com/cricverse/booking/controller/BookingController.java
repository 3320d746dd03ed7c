package com.cricverse.booking.controller;

import com.cricverse.booking.dto.request.ConfirmBookingRequest;
import com.cricverse.booking.dto.request.ReserveSeatsRequest;
import com.cricverse.booking.dto.response.BookingResponse;
import com.cricverse.booking.dto.response.CheckoutResponse;
import com.cricverse.booking.dto.response.TicketResponse;
import com.cricverse.booking.service.BookingService;
import com.cricverse.booking.service.CheckoutService;
import com.cricverse.common.response.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Booking", description = "Seat reservation, checkout and cancellation")
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingService bookingService;
    private final CheckoutService checkoutService;

    @Operation(summary = "Reserve seats", description = "Atomically reserve one or more seats of an event for the reservation window")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Seats reserved"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Validation error or seat not on sale"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Customer or event not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Seat no longer available"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Storage temporarily unavailable")
    })
    @PostMapping
    public ResponseEntity<ApiResponse<BookingResponse>> reserveSeats(
            @Parameter(hidden = true) @RequestHeader("X-Customer-Id") Long customerId,
            @Valid @RequestBody ReserveSeatsRequest request) {
        var booking = bookingService.reserveSeats(customerId, request.eventId(), request.seatIds());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(BookingResponse.from(booking)));
    }

    @Operation(summary = "Check out", description = "Charge the booking total and confirm the booking")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Checkout finished; see outcome"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "Booking belongs to another customer"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Booking not PENDING"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Payment provider unavailable")
    })
    @PostMapping("/{bookingId}/checkout")
    public ResponseEntity<ApiResponse<CheckoutResponse>> checkout(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) @RequestHeader("X-Customer-Id") Long customerId) {
        var result = checkoutService.checkout(bookingId, customerId);
        return ResponseEntity.ok(ApiResponse.ok(CheckoutResponse.from(result)));
    }

    @Operation(summary = "Confirm booking", description = "Confirm a booking paid out of band (payment provider callback)")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Booking confirmed, tickets issued"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Booking not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Booking released or seats lost")
    })
    @PostMapping("/{bookingId}/confirm")
    public ResponseEntity<ApiResponse<List<TicketResponse.Issued>>> confirmBooking(
            @PathVariable Long bookingId,
            @Valid @RequestBody ConfirmBookingRequest request) {
        var tickets = bookingService.confirmBooking(bookingId, request.paymentRef()).stream()
                .map(TicketResponse.Issued::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.ok(tickets));
    }

    @Operation(summary = "Cancel booking", description = "Cancel a pending booking and release its seats")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Booking cancelled"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Booking not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Booking already confirmed")
    })
    @PostMapping("/{bookingId}/cancel")
    public ResponseEntity<ApiResponse<BookingResponse>> cancelBooking(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) @RequestHeader("X-Customer-Id") Long customerId) {
        var booking = bookingService.cancelBooking(bookingId, customerId);
        return ResponseEntity.ok(ApiResponse.ok(BookingResponse.from(bookingService.getBooking(booking.getId(), customerId))));
    }

    @Operation(summary = "Get booking", description = "Get booking details by ID")
    @GetMapping("/{bookingId}")
    public ResponseEntity<ApiResponse<BookingResponse>> getBooking(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) @RequestHeader("X-Customer-Id") Long customerId) {
        var booking = bookingService.getBooking(bookingId, customerId);
        return ResponseEntity.ok(ApiResponse.ok(BookingResponse.from(booking)));
    }

    @Operation(summary = "List customer bookings", description = "All bookings of the calling customer, newest first")
    @GetMapping
    public ResponseEntity<ApiResponse<List<BookingResponse>>> getCustomerBookings(
            @Parameter(hidden = true) @RequestHeader("X-Customer-Id") Long customerId) {
        var bookings = bookingService.getCustomerBookings(customerId).stream()
                .map(BookingResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.ok(bookings));
    }
}
