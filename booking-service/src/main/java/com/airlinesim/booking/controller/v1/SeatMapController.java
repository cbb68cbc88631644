package com.airlinesim.booking.controller.v1;

import com.airlinesim.booking.client.FlightServiceClient;
import com.airlinesim.booking.dto.FlightEntry;
import com.airlinesim.booking.dto.SeatMap;
import com.airlinesim.booking.exception.NotFoundException;
import com.airlinesim.booking.service.seat.SeatInventoryService;
import com.airlinesim.booking.util.StringUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@RestController
@RequestMapping("/v1/flights")
@RequiredArgsConstructor
@Slf4j
public class SeatMapController {

    private final FlightServiceClient flightServiceClient;
    private final SeatInventoryService seatInventoryService;

    @GetMapping("/{flightNumber}/seats")
    public ResponseEntity<SeatMap> getSeatMap(
            @PathVariable String flightNumber,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        log.debug("GET /v1/flights/{}/seats - date={}", flightNumber, date);

        String normalized = StringUtils.normalizeCode(flightNumber);
        FlightEntry flight = flightServiceClient.getFlight(normalized, date)
                .orElseThrow(() -> NotFoundException.flight(normalized, date));
        return ResponseEntity.ok(seatInventoryService.getSeatMap(flight));
    }
}
