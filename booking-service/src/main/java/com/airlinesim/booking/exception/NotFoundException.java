package com.airlinesim.booking.exception;

import com.airlinesim.booking.constants.BookingConstants;

import java.time.LocalDate;

public class NotFoundException extends BookingException {

    public NotFoundException(String errorCode, String message) {
        super(errorCode, message);
    }

    public static NotFoundException flight(String flightNumber, LocalDate flightDate) {
        return new NotFoundException(BookingConstants.ERROR_FLIGHT_NOT_FOUND,
                "Flight not found: " + flightNumber + " on " + flightDate);
    }

    public static NotFoundException booking(String confirmationNumber) {
        return new NotFoundException(BookingConstants.ERROR_BOOKING_NOT_FOUND,
                "Booking not found: " + confirmationNumber);
    }

    public static NotFoundException seat(String flightNumber, String seatNumber) {
        return new NotFoundException(BookingConstants.ERROR_SEAT_NOT_FOUND,
                "Seat " + seatNumber + " does not exist on flight " + flightNumber);
    }

    public static NotFoundException baggage(String trackingNumber) {
        return new NotFoundException(BookingConstants.ERROR_BAGGAGE_NOT_FOUND,
                "Baggage not found with tracking number: " + trackingNumber);
    }
}
