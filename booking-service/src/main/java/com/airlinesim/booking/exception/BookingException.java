package com.airlinesim.booking.exception;

import lombok.Getter;

/**
 * Root of all booking failures. {@code errorCode} is returned to the caller and selects the HTTP status.
 */
@Getter
public class BookingException extends RuntimeException {

    private final String errorCode;

    public BookingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BookingException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
