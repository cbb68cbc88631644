package com.airlinesim.flight.bootstrap;

import com.airlinesim.flight.dto.FlightEntry;
import com.airlinesim.flight.repository.FlightRepository;
import com.airlinesim.flight.service.FlightService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Seeds a week of sample flights for local runs.
 */
@Component
@Profile("dev")
@RequiredArgsConstructor
@Slf4j
public class DevDataLoader implements CommandLineRunner {

    private record Route(String flightNumber, String airline, String origin, String destination,
                         LocalTime departure, int durationMinutes, String aircraft) {
    }

    private static final List<Route> ROUTES = List.of(
            new Route("AA123", "American Airlines", "JFK", "LAX", LocalTime.of(8, 0), 360, "Boeing 737-800"),
            new Route("UA456", "United Airlines", "ORD", "SFO", LocalTime.of(10, 30), 285, "Airbus A320"),
            new Route("DL789", "Delta Air Lines", "ATL", "BOS", LocalTime.of(13, 15), 150, "Airbus A321"),
            new Route("AS321", "Alaska Airlines", "SEA", "DEN", LocalTime.of(17, 45), 165, "Boeing 737 MAX 8"));

    private final FlightRepository flightRepository;
    private final FlightService flightService;
    private final Clock clock;

    @Override
    public void run(String... args) {
        if (flightRepository.count() > 0) {
            log.info("Data already exists, skipping seed");
            return;
        }

        log.info("Seeding dev flights...");
        LocalDate today = LocalDate.now(clock);
        for (int day = 0; day < 7; day++) {
            LocalDate date = today.plusDays(day);
            for (Route route : ROUTES) {
                flightService.createFlight(FlightEntry.builder()
                        .flightNumber(route.flightNumber())
                        .airline(route.airline())
                        .originAirport(route.origin())
                        .destinationAirport(route.destination())
                        .scheduledDeparture(date.atTime(route.departure()))
                        .scheduledArrival(date.atTime(route.departure()).plusMinutes(route.durationMinutes()))
                        .gate("B" + (10 + day))
                        .terminal("1")
                        .aircraft(route.aircraft())
                        .build());
            }
        }
        log.info("Dev flight seeding complete: {} flights", flightRepository.count());
    }
}
