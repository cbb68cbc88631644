package com.airlinesim.booking.controller.v1;

import com.airlinesim.booking.dto.BaggageEntry;
import com.airlinesim.booking.dto.BaggageRequest;
import com.airlinesim.booking.enums.BaggageStatus;
import com.airlinesim.booking.service.BaggageService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Slf4j
public class BaggageController {

    private final BaggageService baggageService;

    @PostMapping("/bookings/{confirmationNumber}/baggage")
    public ResponseEntity<BaggageEntry> addBaggage(
            @PathVariable String confirmationNumber,
            @Valid @RequestBody BaggageRequest request) {
        log.info("POST /v1/bookings/{}/baggage - type={}, weight={}", confirmationNumber, request.getType(), request.getWeight());
        return ResponseEntity.status(HttpStatus.CREATED).body(baggageService.addBaggage(confirmationNumber, request));
    }

    @GetMapping("/bookings/{confirmationNumber}/baggage")
    public ResponseEntity<List<BaggageEntry>> listBaggage(@PathVariable String confirmationNumber) {
        log.debug("GET /v1/bookings/{}/baggage", confirmationNumber);
        return ResponseEntity.ok(baggageService.listBaggage(confirmationNumber));
    }

    @GetMapping("/baggage/{trackingNumber}")
    public ResponseEntity<BaggageEntry> track(@PathVariable String trackingNumber) {
        log.debug("GET /v1/baggage/{}", trackingNumber);
        return ResponseEntity.ok(baggageService.trackBaggage(trackingNumber));
    }

    @PatchMapping("/baggage/{trackingNumber}/status")
    public ResponseEntity<BaggageEntry> updateStatus(
            @PathVariable String trackingNumber,
            @RequestParam BaggageStatus status) {
        log.info("PATCH /v1/baggage/{}/status - status={}", trackingNumber, status);
        return ResponseEntity.ok(baggageService.updateBaggageStatus(trackingNumber, status));
    }
}
