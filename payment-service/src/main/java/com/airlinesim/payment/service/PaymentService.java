package com.airlinesim.payment.service;

import com.airlinesim.payment.dto.ChargeRequest;
import com.airlinesim.payment.dto.ChargeResult;
import com.airlinesim.payment.dto.PaymentEntry;
import com.airlinesim.payment.dto.RefundResult;
import com.airlinesim.payment.service.processor.PaymentProcessor;
import com.airlinesim.payment.service.repository.PaymentRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Entry point for gateway operations. Records outcome metrics around the processor.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    private final PaymentProcessor paymentProcessor;
    private final PaymentRepository paymentRepository;
    private final MeterRegistry meterRegistry;

    public ChargeResult charge(ChargeRequest request) {
        log.info("Processing charge: reference={}, amount={}", request.getReference(), request.getAmount());

        ChargeResult result = paymentProcessor.charge(request);
        meterRegistry.counter("payment.charge", "outcome", result.isSuccess() ? "approved" : "declined").increment();
        return result;
    }

    public RefundResult refund(String transactionId, BigDecimal amount) {
        log.info("Processing refund: transactionId={}, amount={}", transactionId, amount);

        RefundResult result = paymentProcessor.refund(transactionId, amount);
        meterRegistry.counter("payment.refund", "outcome", result.isSuccess() ? "approved" : "declined").increment();
        return result;
    }

    public Optional<PaymentEntry> findByTransactionId(String transactionId) {
        return paymentRepository.findByTransactionId(transactionId);
    }
}
