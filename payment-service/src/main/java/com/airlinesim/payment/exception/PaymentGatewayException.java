package com.airlinesim.payment.exception;

import com.airlinesim.payment.constants.PaymentConstants;
import lombok.Getter;

/**
 * The gateway could not process a request for reasons unrelated to the card. Callers may retry.
 */
@Getter
public class PaymentGatewayException extends RuntimeException {

    private final String errorCode;

    public PaymentGatewayException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public static PaymentGatewayException transactionIdExhausted(int attempts) {
        return new PaymentGatewayException(PaymentConstants.ERROR_GATEWAY_UNAVAILABLE,
                "Unable to allocate a unique transaction id after " + attempts + " attempts");
    }

    public static PaymentGatewayException transactionDisappeared(String transactionId) {
        return new PaymentGatewayException(PaymentConstants.ERROR_GATEWAY_UNAVAILABLE,
                "Transaction disappeared: " + transactionId);
    }
}
