package com.airlinesim.booking.exception;

import com.airlinesim.booking.constants.BookingConstants;

/**
 * Thrown when a downstream service cannot be reached or answers unexpectedly.
 */
public class ServiceUnavailableException extends BookingException {

    public ServiceUnavailableException(String message) {
        super(BookingConstants.ERROR_SERVICE_UNAVAILABLE, message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(BookingConstants.ERROR_SERVICE_UNAVAILABLE, message, cause);
    }
}
