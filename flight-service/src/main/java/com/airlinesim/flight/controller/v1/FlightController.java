package com.airlinesim.flight.controller.v1;

import com.airlinesim.flight.dto.FlightEntry;
import com.airlinesim.flight.dto.FlightStatusUpdate;
import com.airlinesim.flight.service.FlightService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/v1/flights")
public class FlightController {

    private final FlightService flightService;

    @PostMapping
    public ResponseEntity<FlightEntry> create(@Valid @RequestBody FlightEntry entry) {
        log.info("POST /v1/flights: number={}, origin={}, destination={}",
                entry.getFlightNumber(), entry.getOriginAirport(), entry.getDestinationAirport());

        FlightEntry created = flightService.createFlight(entry);

        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping
    public ResponseEntity<List<FlightEntry>> search(
            @RequestParam(required = false) String origin,
            @RequestParam(required = false) String destination,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        log.debug("GET /v1/flights: origin={}, destination={}, date={}", origin, destination, date);
        return ResponseEntity.ok(flightService.findFlights(origin, destination, date));
    }

    @GetMapping("/{flightNumber}")
    public ResponseEntity<FlightEntry> getFlight(
            @PathVariable String flightNumber,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        log.debug("GET /v1/flights/{}?date={}", flightNumber, date);
        return ResponseEntity.ok(flightService.getFlight(flightNumber, date));
    }

    @PatchMapping("/{flightNumber}/status")
    public ResponseEntity<FlightEntry> updateStatus(
            @PathVariable String flightNumber,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestBody FlightStatusUpdate update) {
        log.info("PATCH /v1/flights/{}/status?date={}: status={}, gate={}",
                flightNumber, date, update.getStatus(), update.getGate());
        return ResponseEntity.ok(flightService.updateStatus(flightNumber, date, update));
    }
}
