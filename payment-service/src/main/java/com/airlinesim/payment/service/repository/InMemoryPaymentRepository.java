package com.airlinesim.payment.service.repository;

import com.airlinesim.payment.dto.PaymentEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Repository
@Slf4j
public class InMemoryPaymentRepository implements PaymentRepository {

    private final Map<String, PaymentEntry> paymentsByTransactionId = new ConcurrentHashMap<>();

    @Override
    public PaymentEntry save(PaymentEntry entry) {
        log.debug("Saving payment: transactionId={}, reference={}", entry.getTransactionId(), entry.getReference());
        paymentsByTransactionId.put(entry.getTransactionId(), entry);
        return entry;
    }

    @Override
    public Optional<PaymentEntry> findByTransactionId(String transactionId) {
        return Optional.ofNullable(paymentsByTransactionId.get(transactionId));
    }

    @Override
    public boolean existsByTransactionId(String transactionId) {
        return paymentsByTransactionId.containsKey(transactionId);
    }

    @Override
    public Optional<PaymentEntry> update(String transactionId, UnaryOperator<PaymentEntry> update) {
        return Optional.ofNullable(paymentsByTransactionId.computeIfPresent(transactionId, (id, current) -> update.apply(current)));
    }
}
