package com.airlinesim.payment.service.processor;

import com.airlinesim.payment.dto.ChargeRequest;
import com.airlinesim.payment.dto.ChargeResult;
import com.airlinesim.payment.dto.RefundResult;

import java.math.BigDecimal;

/**
 * Card authorization and refund. A decline is reported through the result, never thrown.
 */
public interface PaymentProcessor {

    ChargeResult charge(ChargeRequest request);

    RefundResult refund(String transactionId, BigDecimal amount);
}
