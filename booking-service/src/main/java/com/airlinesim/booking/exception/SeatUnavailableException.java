package com.airlinesim.booking.exception;

import com.airlinesim.booking.constants.BookingConstants;
import lombok.Getter;

@Getter
public class SeatUnavailableException extends BookingException {

    private final String seatNumber;

    public SeatUnavailableException(String flightNumber, String seatNumber) {
        super(BookingConstants.ERROR_SEAT_UNAVAILABLE,
                "Seat " + seatNumber + " on flight " + flightNumber + " is no longer available");
        this.seatNumber = seatNumber;
    }
}
