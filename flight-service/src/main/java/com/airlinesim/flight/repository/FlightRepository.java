package com.airlinesim.flight.repository;

import com.airlinesim.flight.model.Flight;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface FlightRepository extends JpaRepository<Flight, Long> {

    Optional<Flight> findByFlightNumberAndDepartureDate(String flightNumber, LocalDate departureDate);

    boolean existsByFlightNumberAndDepartureDate(String flightNumber, LocalDate departureDate);

    List<Flight> findByDepartureDateOrderByScheduledDepartureAsc(LocalDate departureDate);

    List<Flight> findByOriginAirportAndDestinationAirportAndDepartureDateOrderByScheduledDepartureAsc(
            String originAirport, String destinationAirport, LocalDate departureDate);
}
