package com.airlinesim.booking.service;

import com.airlinesim.booking.dto.BookingRequest;
import com.airlinesim.booking.dto.FlightEntry;
import com.airlinesim.booking.dto.PassengerRequest;
import com.airlinesim.booking.enums.BookingStatus;
import com.airlinesim.booking.enums.PaymentStatus;
import com.airlinesim.booking.model.Booking;
import com.airlinesim.booking.model.Passenger;
import com.airlinesim.booking.repository.BookingRepository;
import com.airlinesim.booking.service.seat.SeatInventoryService;
import com.airlinesim.booking.util.StringUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Writes a paid booking, its passengers and its seat claims as one unit.
 * A confirmation number collision surfaces as {@link org.springframework.dao.DataIntegrityViolationException}
 * before any seat is touched.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BookingPersister {

    private final BookingRepository bookingRepository;
    private final SeatInventoryService seatInventoryService;
    private final Clock clock;

    @Transactional
    public Booking persist(String confirmationNumber, BookingRequest request, FlightEntry flight,
                           BigDecimal totalAmount, String transactionId) {
        LocalDateTime now = LocalDateTime.now(clock);
        Booking booking = Booking.builder()
                .confirmationNumber(confirmationNumber)
                .userId(request.getUserId().trim())
                .flightNumber(flight.getFlightNumber())
                .flightDate(request.getFlightDate())
                .scheduledDeparture(flight.getScheduledDeparture())
                .status(BookingStatus.CONFIRMED)
                .paymentStatus(PaymentStatus.COMPLETED)
                .totalAmount(totalAmount)
                .paymentTransactionId(transactionId)
                .contactEmail(request.getContactEmail())
                .createdAt(now)
                .updatedAt(now)
                .build();

        List<String> selectedSeats = request.getSelectedSeats() != null ? request.getSelectedSeats() : List.of();
        List<PassengerRequest> passengers = request.getPassengers();
        for (int i = 0; i < passengers.size(); i++) {
            PassengerRequest passenger = passengers.get(i);
            booking.addPassenger(Passenger.builder()
                    .firstName(passenger.getFirstName().trim())
                    .lastName(passenger.getLastName().trim())
                    .dateOfBirth(passenger.getDateOfBirth())
                    .seatClass(passenger.getSeatClass())
                    .seatNumber(i < selectedSeats.size() ? StringUtils.normalizeCode(selectedSeats.get(i)) : null)
                    .build());
        }

        booking = bookingRepository.saveAndFlush(booking);

        for (Passenger passenger : booking.getPassengers()) {
            if (passenger.getSeatNumber() != null) {
                seatInventoryService.reserve(flight, passenger.getSeatNumber(), passenger.getSeatClass(), confirmationNumber);
            }
        }

        log.info("Persisted booking: confirmation={}, flight={}, passengers={}",
                confirmationNumber, flight.getFlightNumber(), passengers.size());
        return booking;
    }
}
