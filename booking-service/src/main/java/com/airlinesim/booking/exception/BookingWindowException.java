package com.airlinesim.booking.exception;

import com.airlinesim.booking.constants.BookingConstants;
import com.airlinesim.booking.enums.FlightStatus;

/**
 * The request is well formed but arrives at the wrong time in the flight's life.
 */
public class BookingWindowException extends BookingException {

    public BookingWindowException(String errorCode, String message) {
        super(errorCode, message);
    }

    public static BookingWindowException flightDeparted(String flightNumber) {
        return new BookingWindowException(BookingConstants.ERROR_FLIGHT_DEPARTED,
                "Flight " + flightNumber + " has already departed");
    }

    public static BookingWindowException flightNotBookable(String flightNumber, FlightStatus status) {
        return new BookingWindowException(BookingConstants.ERROR_FLIGHT_NOT_BOOKABLE,
                "Flight " + flightNumber + " cannot be booked in status " + status);
    }

    public static BookingWindowException checkInClosed(String flightNumber) {
        return new BookingWindowException(BookingConstants.ERROR_CHECK_IN_CLOSED,
                "Check-in for flight " + flightNumber + " is closed");
    }
}
