package com.airlinesim.payment.enums;

/**
 * Lifecycle of an approved charge held by the gateway.
 */
public enum TransactionStatus {
    CAPTURED,
    REFUNDED
}
