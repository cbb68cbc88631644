package com.airlinesim.booking.exception;

import com.airlinesim.booking.constants.BookingConstants;
import lombok.Getter;

import java.time.LocalDateTime;

@Getter
public class CheckInNotYetAvailableException extends BookingWindowException {

    private final LocalDateTime opensAt;

    public CheckInNotYetAvailableException(String flightNumber, LocalDateTime opensAt) {
        super(BookingConstants.ERROR_CHECK_IN_NOT_YET_AVAILABLE,
                "Check-in for flight " + flightNumber + " opens at " + opensAt);
        this.opensAt = opensAt;
    }
}
