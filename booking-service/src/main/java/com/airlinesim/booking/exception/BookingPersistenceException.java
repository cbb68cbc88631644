package com.airlinesim.booking.exception;

import com.airlinesim.booking.constants.BookingConstants;

public class BookingPersistenceException extends BookingException {

    public BookingPersistenceException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static BookingPersistenceException persistenceFailed(Throwable cause) {
        return new BookingPersistenceException(BookingConstants.ERROR_PERSISTENCE_FAILED,
                "Booking could not be saved", cause);
    }

    public static BookingPersistenceException confirmationCollision(int attempts) {
        return new BookingPersistenceException(BookingConstants.ERROR_CONFIRMATION_COLLISION,
                "Could not allocate a unique confirmation number after " + attempts + " attempts", null);
    }

    public static BookingPersistenceException trackingNumberCollision(int attempts) {
        return new BookingPersistenceException(BookingConstants.ERROR_TRACKING_NUMBER_COLLISION,
                "Could not allocate a unique tracking number after " + attempts + " attempts", null);
    }
}
