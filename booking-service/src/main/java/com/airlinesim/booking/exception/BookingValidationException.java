package com.airlinesim.booking.exception;

import com.airlinesim.booking.constants.BookingConstants;

public class BookingValidationException extends BookingException {

    public BookingValidationException(String message) {
        super(BookingConstants.ERROR_VALIDATION, message);
    }

    public BookingValidationException(String errorCode, String message) {
        super(errorCode, message);
    }
}
