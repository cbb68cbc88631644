package com.airlinesim.booking.exception;

import com.airlinesim.booking.constants.BookingConstants;

public class PaymentDeclinedException extends BookingException {

    public PaymentDeclinedException(String message) {
        super(BookingConstants.ERROR_PAYMENT_DECLINED, message);
    }
}
