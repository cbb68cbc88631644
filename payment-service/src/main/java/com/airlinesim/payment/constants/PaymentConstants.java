package com.airlinesim.payment.constants;

public final class PaymentConstants {

    private PaymentConstants() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    public static final String TRANSACTION_ID_PREFIX = "TXN_";
    public static final String REFUND_ID_PREFIX = "RFD_";

    public static final int DEFAULT_SUCCESS_PROBABILITY = 90;
    public static final int DEFAULT_REFUND_SUCCESS_PROBABILITY = 95;

    public static final int DEFAULT_MIN_PROCESSING_DELAY_MS = 200;
    public static final int DEFAULT_MAX_PROCESSING_DELAY_MS = 1000;
    public static final int MAX_ID_GENERATION_ATTEMPTS = 5;

    public static final int MIN_CARD_NUMBER_LENGTH = 13;
    public static final int MAX_CARD_NUMBER_LENGTH = 19;
    public static final int MIN_CVV_LENGTH = 3;
    public static final int MAX_CVV_LENGTH = 4;

    public static final String OUTCOME_APPROVE = "APPROVE";
    public static final String OUTCOME_DECLINE = "DECLINE";

    public static final String MESSAGE_INVALID_PAYMENT = "Invalid payment information";
    public static final String MESSAGE_DECLINED = "Payment was declined by the bank";
    public static final String MESSAGE_INVALID_REFUND = "Invalid refund request";
    public static final String MESSAGE_UNKNOWN_TRANSACTION = "Transaction not found";
    public static final String MESSAGE_REFUND_EXCEEDS_CHARGE = "Refund amount exceeds the charged amount";
    public static final String MESSAGE_REFUND_DECLINED = "Refund was declined";

    public static final String ERROR_VALIDATION = "VALIDATION_ERROR";
    public static final String ERROR_INVALID_REQUEST = "INVALID_REQUEST";
    public static final String ERROR_INVALID_MOCK_CONFIGURATION = "INVALID_MOCK_CONFIGURATION";
    public static final String ERROR_GATEWAY_UNAVAILABLE = "GATEWAY_UNAVAILABLE";
    public static final String ERROR_INTERNAL = "INTERNAL_ERROR";
}
