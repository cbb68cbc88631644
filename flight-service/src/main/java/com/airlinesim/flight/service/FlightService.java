package com.airlinesim.flight.service;

import com.airlinesim.flight.constants.ValidationMessages;
import com.airlinesim.flight.dto.FlightEntry;
import com.airlinesim.flight.dto.FlightStatusUpdate;
import com.airlinesim.flight.enums.FlightStatus;
import com.airlinesim.flight.exception.FlightNotFoundException;
import com.airlinesim.flight.exception.FlightOperationException;
import com.airlinesim.flight.exception.FlightValidationException;
import com.airlinesim.flight.mapper.FlightMapper;
import com.airlinesim.flight.model.Flight;
import com.airlinesim.flight.repository.FlightRepository;
import com.airlinesim.flight.util.StringUtils;
import com.airlinesim.flight.validator.FlightValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Flight instance lookup and maintenance. Bookings read flights through
 * {@link #getFlight(String, LocalDate)}; the status feed writes through {@link #updateStatus}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FlightService {

    private final FlightRepository flightRepository;
    private final Clock clock;

    // ========== CRUD Operations ==========

    @Transactional
    public FlightEntry createFlight(FlightEntry entry) {
        FlightValidator.validateFlightEntry(entry);

        Flight flight = FlightMapper.toEntity(entry);
        if (flightRepository.existsByFlightNumberAndDepartureDate(flight.getFlightNumber(), flight.getDepartureDate())) {
            throw FlightOperationException.duplicateFlight(flight.getFlightNumber(), flight.getDepartureDate());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        flight.setCreatedAt(now);
        flight.setUpdatedAt(now);
        try {
            flight = flightRepository.saveAndFlush(flight);
        } catch (DataIntegrityViolationException e) {
            throw FlightOperationException.duplicateFlight(flight.getFlightNumber(), flight.getDepartureDate());
        }

        log.info("Created flight: number={}, date={}, route={}->{}",
                flight.getFlightNumber(), flight.getDepartureDate(),
                flight.getOriginAirport(), flight.getDestinationAirport());
        return FlightMapper.toEntry(flight);
    }

    @Transactional(readOnly = true)
    public FlightEntry getFlight(String flightNumber, LocalDate departureDate) {
        return FlightMapper.toEntry(findFlightOrThrow(flightNumber, departureDate));
    }

    @Transactional(readOnly = true)
    public List<FlightEntry> findFlights(String originAirport, String destinationAirport, LocalDate departureDate) {
        FlightValidator.validateDepartureDate(departureDate);

        String origin = StringUtils.normalizeCode(originAirport);
        String destination = StringUtils.normalizeCode(destinationAirport);

        if (origin != null && destination != null) {
            return FlightMapper.toEntryList(flightRepository
                    .findByOriginAirportAndDestinationAirportAndDepartureDateOrderByScheduledDepartureAsc(
                            origin, destination, departureDate));
        }

        List<Flight> flights = flightRepository.findByDepartureDateOrderByScheduledDepartureAsc(departureDate).stream()
                .filter(f -> origin == null || origin.equals(f.getOriginAirport()))
                .filter(f -> destination == null || destination.equals(f.getDestinationAirport()))
                .toList();
        return FlightMapper.toEntryList(flights);
    }

    // ========== Status Feed ==========

    @Transactional
    public FlightEntry updateStatus(String flightNumber, LocalDate departureDate, FlightStatusUpdate update) {
        if (update == null) {
            throw new FlightValidationException(ValidationMessages.STATUS_UPDATE_REQUIRED);
        }

        Flight flight = findFlightOrThrow(flightNumber, departureDate);
        FlightStatus previous = flight.getStatus();
        FlightMapper.applyStatusUpdate(flight, update);

        if (flight.getEstimatedDeparture() != null && flight.getEstimatedArrival() != null) {
            FlightValidator.validateArrivalAfterDeparture(flight.getEstimatedDeparture(), flight.getEstimatedArrival());
        }

        flight.setUpdatedAt(LocalDateTime.now(clock));
        flight = flightRepository.save(flight);
        log.info("Updated flight status: number={}, date={}, status={}->{}, gate={}",
                flight.getFlightNumber(), departureDate, previous, flight.getStatus(), flight.getGate());
        return FlightMapper.toEntry(flight);
    }

    // ========== Private: Entity Operations ==========

    private Flight findFlightOrThrow(String flightNumber, LocalDate departureDate) {
        FlightValidator.validateFlightNumber(flightNumber);
        FlightValidator.validateDepartureDate(departureDate);

        String normalized = StringUtils.normalizeCode(flightNumber);
        return flightRepository.findByFlightNumberAndDepartureDate(normalized, departureDate)
                .orElseThrow(() -> new FlightNotFoundException(normalized, departureDate));
    }
}
