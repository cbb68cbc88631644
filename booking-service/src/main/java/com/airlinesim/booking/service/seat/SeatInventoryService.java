package com.airlinesim.booking.service.seat;

import com.airlinesim.booking.constants.BookingConstants;
import com.airlinesim.booking.dto.FlightEntry;
import com.airlinesim.booking.dto.SeatMap;
import com.airlinesim.booking.enums.SeatClass;
import com.airlinesim.booking.exception.BookingValidationException;
import com.airlinesim.booking.exception.NotFoundException;
import com.airlinesim.booking.exception.SeatUnavailableException;
import com.airlinesim.booking.mapper.BookingMapper;
import com.airlinesim.booking.model.FlightSeat;
import com.airlinesim.booking.repository.FlightSeatRepository;
import com.airlinesim.booking.util.StringUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Authoritative seat inventory. A seat is claimed with a single conditional update,
 * so two bookings can never hold the same seat.
 */
@Service
@Slf4j
public class SeatInventoryService {

    private static final int MAX_ASSIGNMENT_ATTEMPTS = 10;

    private final FlightSeatRepository flightSeatRepository;
    private final SeatMapFactory seatMapFactory;
    private final Counter conflictCounter;

    public SeatInventoryService(FlightSeatRepository flightSeatRepository,
                                SeatMapFactory seatMapFactory,
                                MeterRegistry meterRegistry) {
        this.flightSeatRepository = flightSeatRepository;
        this.seatMapFactory = seatMapFactory;
        this.conflictCounter = meterRegistry.counter(BookingConstants.METRIC_SEAT_CONFLICTS);
    }

    // ========== Seat Map ==========

    public SeatMap getSeatMap(FlightEntry flight) {
        ensureSeatMap(flight);
        List<FlightSeat> seats = flightSeatRepository.findByFlightNumberAndFlightDateOrderByRowNumberAscSeatLetterAsc(
                flight.getFlightNumber(), flightDate(flight));
        return BookingMapper.toSeatMap(flight.getFlightNumber(), flightDate(flight), seats);
    }

    /**
     * Persists the seat map on first access. Must not be called inside a transaction: a concurrent
     * initialiser loses on the unique constraint and simply uses the winner's map.
     */
    public void ensureSeatMap(FlightEntry flight) {
        String flightNumber = flight.getFlightNumber();
        LocalDate flightDate = flightDate(flight);
        if (flightSeatRepository.existsByFlightNumberAndFlightDate(flightNumber, flightDate)) {
            return;
        }

        try {
            flightSeatRepository.saveAllAndFlush(seatMapFactory.generate(flightNumber, flightDate));
            log.info("Initialised seat map: flight={}, date={}", flightNumber, flightDate);
        } catch (DataIntegrityViolationException e) {
            log.info("Seat map already initialised concurrently: flight={}, date={}", flightNumber, flightDate);
        }
    }

    public boolean isAvailable(FlightEntry flight, String seatNumber) {
        return findSeatOrThrow(flight, seatNumber).isAvailable();
    }

    /**
     * Fast pre-check before payment. Not authoritative; {@link #reserve} decides.
     */
    public void checkSelectable(FlightEntry flight, String seatNumber, SeatClass seatClass) {
        FlightSeat seat = findSeatOrThrow(flight, seatNumber);
        if (seat.getSeatClass() != seatClass) {
            throw classMismatch(seat, seatClass);
        }
        if (!seat.isAvailable()) {
            throw new SeatUnavailableException(flight.getFlightNumber(), seat.getSeatNumber());
        }
    }

    // ========== Reservations ==========

    @Transactional(propagation = Propagation.MANDATORY)
    public void reserve(FlightEntry flight, String seatNumber, SeatClass seatClass, String confirmationNumber) {
        String flightNumber = flight.getFlightNumber();
        LocalDate flightDate = flightDate(flight);
        String normalized = StringUtils.normalizeCode(seatNumber);

        int updated;
        try {
            updated = flightSeatRepository.reserveSeat(flightNumber, flightDate, normalized, seatClass, confirmationNumber);
        } catch (ConcurrencyFailureException e) {
            conflictCounter.increment();
            log.warn("Seat reservation lock conflict: flight={}, seat={}", flightNumber, normalized);
            throw new SeatUnavailableException(flightNumber, normalized);
        }

        if (updated == 1) {
            log.info("Reserved seat: flight={}, date={}, seat={}, booking={}",
                    flightNumber, flightDate, normalized, confirmationNumber);
            return;
        }

        FlightSeat seat = flightSeatRepository.findByFlightNumberAndFlightDateAndSeatNumber(flightNumber, flightDate, normalized)
                .orElseThrow(() -> NotFoundException.seat(flightNumber, normalized));
        if (seat.getSeatClass() != seatClass) {
            throw classMismatch(seat, seatClass);
        }

        conflictCounter.increment();
        log.warn("Seat already taken: flight={}, date={}, seat={}", flightNumber, flightDate, normalized);
        throw new SeatUnavailableException(flightNumber, normalized);
    }

    /**
     * Frees a seat, but only if {@code confirmationNumber} is the booking holding it.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean release(String flightNumber, LocalDate flightDate, String seatNumber, String confirmationNumber) {
        int updated = flightSeatRepository.releaseSeat(flightNumber, flightDate,
                StringUtils.normalizeCode(seatNumber), confirmationNumber);
        if (updated == 0) {
            log.warn("Seat not held by booking, nothing released: flight={}, seat={}, booking={}",
                    flightNumber, seatNumber, confirmationNumber);
            return false;
        }
        log.info("Released seat: flight={}, date={}, seat={}, booking={}", flightNumber, flightDate, seatNumber, confirmationNumber);
        return true;
    }

    /**
     * Claims the lowest free seat of the class, retrying past seats taken concurrently.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<String> assignFirstAvailable(FlightEntry flight, SeatClass seatClass, String confirmationNumber) {
        String flightNumber = flight.getFlightNumber();
        LocalDate flightDate = flightDate(flight);

        for (int attempt = 0; attempt < MAX_ASSIGNMENT_ATTEMPTS; attempt++) {
            Optional<FlightSeat> candidate = flightSeatRepository
                    .findFirstByFlightNumberAndFlightDateAndSeatClassAndAvailableTrueOrderByRowNumberAscSeatLetterAsc(
                            flightNumber, flightDate, seatClass);
            if (candidate.isEmpty()) {
                log.warn("No {} seat left: flight={}, date={}", seatClass, flightNumber, flightDate);
                return Optional.empty();
            }

            String seatNumber = candidate.get().getSeatNumber();
            int updated;
            try {
                updated = flightSeatRepository.reserveSeat(flightNumber, flightDate, seatNumber, seatClass, confirmationNumber);
            } catch (ConcurrencyFailureException e) {
                // transaction is rollback-only from here on
                conflictCounter.increment();
                log.warn("Seat assignment lock conflict: flight={}, seat={}", flightNumber, seatNumber);
                throw new SeatUnavailableException(flightNumber, seatNumber);
            }

            if (updated == 1) {
                log.info("Assigned seat: flight={}, seat={}, booking={}", flightNumber, seatNumber, confirmationNumber);
                return Optional.of(seatNumber);
            }
            conflictCounter.increment();
        }

        log.warn("Gave up assigning a {} seat after {} conflicts: flight={}", seatClass, MAX_ASSIGNMENT_ATTEMPTS, flightNumber);
        return Optional.empty();
    }

    // ============ Private Methods ============

    private FlightSeat findSeatOrThrow(FlightEntry flight, String seatNumber) {
        String normalized = StringUtils.normalizeCode(seatNumber);
        return flightSeatRepository.findByFlightNumberAndFlightDateAndSeatNumber(
                        flight.getFlightNumber(), flightDate(flight), normalized)
                .orElseThrow(() -> NotFoundException.seat(flight.getFlightNumber(), normalized));
    }

    private static BookingValidationException classMismatch(FlightSeat seat, SeatClass requested) {
        return new BookingValidationException(BookingConstants.ERROR_SEAT_CLASS_MISMATCH,
                "Seat " + seat.getSeatNumber() + " is " + seat.getSeatClass() + ", not " + requested);
    }

    private static LocalDate flightDate(FlightEntry flight) {
        return flight.getDepartureDate() != null
                ? flight.getDepartureDate()
                : flight.getScheduledDeparture().toLocalDate();
    }
}
