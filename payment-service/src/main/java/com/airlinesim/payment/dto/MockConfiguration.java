package com.airlinesim.payment.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

/**
 * Runtime overrides for the gateway stub.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class MockConfiguration {

    /**
     * APPROVE or DECLINE. When null, outcomes are drawn from the probabilities.
     */
    String forcedOutcome;

    /**
     * Charge approval probability (0-100).
     */
    Integer successProbability;

    /**
     * Refund approval probability (0-100).
     */
    Integer refundSuccessProbability;

    Integer minDelayMs;

    Integer maxDelayMs;

    Boolean skipDelay;
}
