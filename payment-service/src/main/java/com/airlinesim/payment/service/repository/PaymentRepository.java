package com.airlinesim.payment.service.repository;

import com.airlinesim.payment.dto.PaymentEntry;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Storage for approved charges.
 */
public interface PaymentRepository {

    PaymentEntry save(PaymentEntry entry);

    Optional<PaymentEntry> findByTransactionId(String transactionId);

    boolean existsByTransactionId(String transactionId);

    /**
     * Atomically replaces the stored entry with the result of {@code update}.
     */
    Optional<PaymentEntry> update(String transactionId, UnaryOperator<PaymentEntry> update);
}
