package com.airlinesim.booking.exception;

import com.airlinesim.booking.constants.BookingConstants;
import com.airlinesim.booking.enums.BookingStatus;

public class InvalidBookingStateException extends BookingException {

    public InvalidBookingStateException(String confirmationNumber, BookingStatus current, String action) {
        super(BookingConstants.ERROR_INVALID_BOOKING_STATE,
                "Cannot " + action + " booking " + confirmationNumber + " in status " + current);
    }
}
