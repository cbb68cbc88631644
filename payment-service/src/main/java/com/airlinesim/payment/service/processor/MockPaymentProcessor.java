package com.airlinesim.payment.service.processor;

import com.airlinesim.payment.constants.PaymentConstants;
import com.airlinesim.payment.dto.ChargeRequest;
import com.airlinesim.payment.dto.ChargeResult;
import com.airlinesim.payment.dto.PaymentEntry;
import com.airlinesim.payment.dto.RefundResult;
import com.airlinesim.payment.enums.TransactionStatus;
import com.airlinesim.payment.exception.PaymentGatewayException;
import com.airlinesim.payment.service.MockConfigurationService;
import com.airlinesim.payment.service.outcome.OutcomeStrategy;
import com.airlinesim.payment.service.repository.PaymentRepository;
import com.airlinesim.payment.validator.CardValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;

/**
 * Simulated card gateway with configurable latency and approval rates.
 */
@Component
@Slf4j
public class MockPaymentProcessor implements PaymentProcessor {

    private final PaymentRepository paymentRepository;
    private final OutcomeStrategy outcomeStrategy;
    private final MockConfigurationService mockConfig;
    private final Random random;
    private final Clock clock;

    public MockPaymentProcessor(PaymentRepository paymentRepository,
                                OutcomeStrategy outcomeStrategy,
                                MockConfigurationService mockConfig,
                                Random paymentRandom,
                                Clock clock) {
        this.paymentRepository = paymentRepository;
        this.outcomeStrategy = outcomeStrategy;
        this.mockConfig = mockConfig;
        this.random = paymentRandom;
        this.clock = clock;
    }

    @Override
    public ChargeResult charge(ChargeRequest request) {
        LocalDateTime now = LocalDateTime.now(clock);
        Optional<String> violation = CardValidator.findViolation(request, YearMonth.now(clock));
        if (violation.isPresent()) {
            log.warn("Charge rejected before authorization: reason={}, reference={}",
                    violation.get(), request != null ? request.getReference() : null);
            return ChargeResult.declined(PaymentConstants.MESSAGE_INVALID_PAYMENT, now);
        }

        simulateDelay(mockConfig.getProcessingDelay());

        if (!outcomeStrategy.approveCharge()) {
            log.warn("Charge declined: amount={}, reference={}", request.getAmount(), request.getReference());
            return ChargeResult.declined(PaymentConstants.MESSAGE_DECLINED, LocalDateTime.now(clock));
        }

        String transactionId = generateTransactionId();
        LocalDateTime processedAt = LocalDateTime.now(clock);
        paymentRepository.save(PaymentEntry.builder()
                .transactionId(transactionId)
                .reference(request.getReference())
                .cardLastFour(CardValidator.lastFour(request.getCardNumber()))
                .amount(request.getAmount())
                .status(TransactionStatus.CAPTURED)
                .processedAt(processedAt)
                .build());

        log.info("Charge approved: transactionId={}, amount={}", transactionId, request.getAmount());
        return ChargeResult.approved(transactionId, request.getAmount(), processedAt);
    }

    @Override
    public RefundResult refund(String transactionId, BigDecimal amount) {
        LocalDateTime now = LocalDateTime.now(clock);
        if (!StringUtils.hasText(transactionId) || amount == null || amount.compareTo(BigDecimal.ZERO) <= 0) {
            return RefundResult.declined(transactionId, PaymentConstants.MESSAGE_INVALID_REFUND, now);
        }

        Optional<PaymentEntry> existing = paymentRepository.findByTransactionId(transactionId);
        if (existing.isEmpty()) {
            log.warn("Refund for unknown transaction: {}", transactionId);
            return RefundResult.declined(transactionId, PaymentConstants.MESSAGE_UNKNOWN_TRANSACTION, now);
        }

        PaymentEntry payment = existing.get();
        if (payment.getStatus() == TransactionStatus.REFUNDED) {
            log.info("Idempotent refund - returning existing refund: {}", payment.getRefundId());
            return RefundResult.approved(transactionId, payment.getRefundId(),
                    payment.getRefundedAmount(), payment.getRefundedAt());
        }
        if (amount.compareTo(payment.getAmount()) > 0) {
            return RefundResult.declined(transactionId, PaymentConstants.MESSAGE_REFUND_EXCEEDS_CHARGE, now);
        }

        simulateDelay(mockConfig.getProcessingDelay() / 2);

        if (!outcomeStrategy.approveRefund()) {
            log.warn("Refund declined: transactionId={}, amount={}", transactionId, amount);
            return RefundResult.declined(transactionId, PaymentConstants.MESSAGE_REFUND_DECLINED, LocalDateTime.now(clock));
        }

        String refundId = PaymentConstants.REFUND_ID_PREFIX + randomSuffix();
        LocalDateTime refundedAt = LocalDateTime.now(clock);
        PaymentEntry refunded = paymentRepository.update(transactionId, current ->
                        current.getStatus() == TransactionStatus.REFUNDED
                                ? current
                                : current.toBuilder()
                                        .status(TransactionStatus.REFUNDED)
                                        .refundId(refundId)
                                        .refundedAmount(amount)
                                        .refundedAt(refundedAt)
                                        .build())
                .orElseThrow(() -> PaymentGatewayException.transactionDisappeared(transactionId));

        log.info("Refund approved: transactionId={}, refundId={}", transactionId, refunded.getRefundId());
        return RefundResult.approved(transactionId, refunded.getRefundId(),
                refunded.getRefundedAmount(), refunded.getRefundedAt());
    }

    // ============ Private Methods ============

    private String generateTransactionId() {
        for (int attempt = 0; attempt < PaymentConstants.MAX_ID_GENERATION_ATTEMPTS; attempt++) {
            String candidate = PaymentConstants.TRANSACTION_ID_PREFIX
                    + clock.instant().getEpochSecond() + "_" + randomSuffix();
            if (!paymentRepository.existsByTransactionId(candidate)) {
                return candidate;
            }
        }
        throw PaymentGatewayException.transactionIdExhausted(PaymentConstants.MAX_ID_GENERATION_ATTEMPTS);
    }

    private String randomSuffix() {
        return Integer.toUnsignedString(random.nextInt(), 36).toUpperCase(Locale.ROOT);
    }

    private void simulateDelay(int delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            log.debug("Simulating gateway latency: {}ms", delayMs);
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
