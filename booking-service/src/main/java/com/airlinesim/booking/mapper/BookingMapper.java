package com.airlinesim.booking.mapper;

import com.airlinesim.booking.constants.BookingConstants;
import com.airlinesim.booking.dto.*;
import com.airlinesim.booking.model.BaggageItem;
import com.airlinesim.booking.model.Booking;
import com.airlinesim.booking.model.FlightSeat;
import com.airlinesim.booking.model.Passenger;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class BookingMapper {

    private BookingMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static BookingEntry toEntry(Booking booking) {
        if (booking == null) {
            return null;
        }

        return BookingEntry.builder()
                .confirmationNumber(booking.getConfirmationNumber())
                .userId(booking.getUserId())
                .flightNumber(booking.getFlightNumber())
                .flightDate(booking.getFlightDate())
                .scheduledDeparture(booking.getScheduledDeparture())
                .status(booking.getStatus())
                .paymentStatus(booking.getPaymentStatus())
                .totalAmount(booking.getTotalAmount())
                .contactEmail(booking.getContactEmail())
                .passengers(toPassengerEntries(booking.getPassengers()))
                .createdAt(booking.getCreatedAt())
                .updatedAt(booking.getUpdatedAt())
                .build();
    }

    public static BookingConfirmation toConfirmation(Booking booking) {
        if (booking == null) {
            return null;
        }

        return BookingConfirmation.builder()
                .confirmationNumber(booking.getConfirmationNumber())
                .status(booking.getStatus())
                .paymentStatus(booking.getPaymentStatus())
                .totalAmount(booking.getTotalAmount())
                .flightNumber(booking.getFlightNumber())
                .flightDate(booking.getFlightDate())
                .passengers(toPassengerEntries(booking.getPassengers()))
                .createdAt(booking.getCreatedAt())
                .build();
    }

    public static List<PassengerEntry> toPassengerEntries(List<Passenger> passengers) {
        if (passengers == null || passengers.isEmpty()) {
            return new ArrayList<>();
        }

        List<PassengerEntry> result = new ArrayList<>(passengers.size());
        for (Passenger passenger : passengers) {
            result.add(PassengerEntry.builder()
                    .firstName(passenger.getFirstName())
                    .lastName(passenger.getLastName())
                    .dateOfBirth(passenger.getDateOfBirth())
                    .seatNumber(passenger.getSeatNumber())
                    .seatClass(passenger.getSeatClass())
                    .checkedIn(passenger.isCheckedIn())
                    .checkInTime(passenger.getCheckInTime())
                    .build());
        }
        return result;
    }

    public static BoardingPass toBoardingPass(Booking booking, Passenger passenger, FlightEntry flight,
                                              LocalDateTime boardingTime) {
        return BoardingPass.builder()
                .confirmationNumber(booking.getConfirmationNumber())
                .passengerName(passenger.getFullName())
                .flightNumber(booking.getFlightNumber())
                .seatNumber(orNotAssigned(passenger.getSeatNumber()))
                .gate(orNotAssigned(flight.getGate()))
                .terminal(flight.getTerminal())
                .departureTime(flight.getScheduledDeparture())
                .boardingTime(boardingTime)
                .qrCode(booking.getBoardingPassCode())
                .build();
    }

    public static BaggageEntry toBaggageEntry(BaggageItem item) {
        if (item == null) {
            return null;
        }

        Booking booking = item.getBooking();
        Passenger passenger = item.getPassenger();
        return BaggageEntry.builder()
                .trackingNumber(item.getTrackingNumber())
                .confirmationNumber(booking.getConfirmationNumber())
                .flightNumber(booking.getFlightNumber())
                .passengerName(passenger != null ? passenger.getFullName() : null)
                .type(item.getType())
                .weight(item.getWeight())
                .status(item.getStatus())
                .currentLocation(item.getStatus().getLocation())
                .createdAt(item.getCreatedAt())
                .updatedAt(item.getUpdatedAt())
                .build();
    }

    /**
     * Groups persisted seats into rows. Seats must already be ordered by row and letter.
     */
    public static SeatMap toSeatMap(String flightNumber, LocalDate flightDate, List<FlightSeat> seats) {
        Map<Integer, List<SeatEntry>> rows = new LinkedHashMap<>();
        int available = 0;

        for (FlightSeat seat : seats) {
            rows.computeIfAbsent(seat.getRowNumber(), row -> new ArrayList<>())
                    .add(SeatEntry.builder()
                            .seatNumber(seat.getSeatNumber())
                            .seatClass(seat.getSeatClass())
                            .available(seat.isAvailable())
                            .build());
            if (seat.isAvailable()) {
                available++;
            }
        }

        List<SeatRow> seatRows = new ArrayList<>(rows.size());
        rows.forEach((rowNumber, rowSeats) -> seatRows.add(SeatRow.builder()
                .rowNumber(rowNumber)
                .seats(rowSeats)
                .build()));

        return SeatMap.builder()
                .flightNumber(flightNumber)
                .flightDate(flightDate)
                .availableSeats(available)
                .rows(seatRows)
                .build();
    }

    private static String orNotAssigned(String value) {
        return value != null ? value : BookingConstants.NOT_ASSIGNED;
    }
}
