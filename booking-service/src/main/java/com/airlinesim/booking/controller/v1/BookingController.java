package com.airlinesim.booking.controller.v1;

import com.airlinesim.booking.dto.BoardingPass;
import com.airlinesim.booking.dto.BookingConfirmation;
import com.airlinesim.booking.dto.BookingEntry;
import com.airlinesim.booking.dto.BookingRequest;
import com.airlinesim.booking.service.BookingWorkflowService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/bookings")
@RequiredArgsConstructor
@Slf4j
public class BookingController {

    private final BookingWorkflowService bookingWorkflowService;

    @PostMapping
    public ResponseEntity<BookingConfirmation> create(@Valid @RequestBody BookingRequest request) {
        log.info("POST /v1/bookings - flight={}, date={}, user={}, passengers={}",
                request.getFlightNumber(), request.getFlightDate(), request.getUserId(), request.getPassengers().size());
        return ResponseEntity.ok(bookingWorkflowService.createBooking(request));
    }

    @GetMapping("/{confirmationNumber}")
    public ResponseEntity<BookingEntry> findByConfirmationNumber(@PathVariable String confirmationNumber) {
        log.debug("GET /v1/bookings/{}", confirmationNumber);
        return ResponseEntity.ok(bookingWorkflowService.getBooking(confirmationNumber));
    }

    @GetMapping("/user/{userId}")
    public ResponseEntity<List<BookingEntry>> findByUser(@PathVariable String userId) {
        log.debug("GET /v1/bookings/user/{}", userId);
        return ResponseEntity.ok(bookingWorkflowService.getBookingsForUser(userId));
    }

    @PostMapping("/{confirmationNumber}/checkin")
    public ResponseEntity<BoardingPass> checkIn(@PathVariable String confirmationNumber) {
        log.info("POST /v1/bookings/{}/checkin", confirmationNumber);
        return ResponseEntity.ok(bookingWorkflowService.checkIn(confirmationNumber));
    }

    @PostMapping("/{confirmationNumber}/cancel")
    public ResponseEntity<BookingEntry> cancel(@PathVariable String confirmationNumber) {
        log.info("POST /v1/bookings/{}/cancel", confirmationNumber);
        return ResponseEntity.ok(bookingWorkflowService.cancelBooking(confirmationNumber));
    }

    @PostMapping("/{confirmationNumber}/complete")
    public ResponseEntity<BookingEntry> complete(@PathVariable String confirmationNumber) {
        log.info("POST /v1/bookings/{}/complete", confirmationNumber);
        return ResponseEntity.ok(bookingWorkflowService.completeBooking(confirmationNumber));
    }
}
