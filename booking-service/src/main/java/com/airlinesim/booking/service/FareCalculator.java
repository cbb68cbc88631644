package com.airlinesim.booking.service;

import com.airlinesim.booking.constants.BookingConstants;
import com.airlinesim.booking.constants.ValidationMessages;
import com.airlinesim.booking.enums.SeatClass;
import com.airlinesim.booking.exception.BookingValidationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Prices a booking as the sum of {@code baseFare x class multiplier} per passenger.
 * The total is rounded once, not per passenger.
 */
@Component
public class FareCalculator {

    private final BigDecimal baseFare;

    public FareCalculator(@Value("${booking.fare.base-fare:" + BookingConstants.DEFAULT_BASE_FARE + "}") BigDecimal baseFare) {
        this.baseFare = baseFare;
    }

    public BigDecimal priceFor(List<SeatClass> seatClasses) {
        if (seatClasses == null || seatClasses.isEmpty()) {
            throw new BookingValidationException(BookingConstants.ERROR_INVALID_PASSENGERS, ValidationMessages.PASSENGERS_REQUIRED);
        }

        BigDecimal total = BigDecimal.ZERO;
        for (SeatClass seatClass : seatClasses) {
            if (seatClass == null) {
                throw new BookingValidationException(BookingConstants.ERROR_INVALID_PASSENGERS, ValidationMessages.SEAT_CLASS_REQUIRED);
            }
            total = total.add(baseFare.multiply(seatClass.getMultiplier()));
        }
        return total.setScale(2, RoundingMode.HALF_UP);
    }
}
