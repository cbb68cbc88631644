package com.airlinesim.payment.service;

import com.airlinesim.payment.constants.PaymentConstants;
import com.airlinesim.payment.dto.MockConfiguration;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the gateway behaviour that end-to-end tests can change at runtime.
 */
@Service
@Slf4j
public class MockConfigurationService {

    private final AtomicReference<MockConfiguration> config = new AtomicReference<>();
    private final Random random;

    @Getter
    private final int defaultSuccessProbability;
    @Getter
    private final int defaultRefundSuccessProbability;
    @Getter
    private final int defaultMinDelayMs;
    @Getter
    private final int defaultMaxDelayMs;

    public MockConfigurationService(
            Random paymentRandom,
            @Value("${payment.success-probability:" + PaymentConstants.DEFAULT_SUCCESS_PROBABILITY + "}") int successProbability,
            @Value("${payment.refund-success-probability:" + PaymentConstants.DEFAULT_REFUND_SUCCESS_PROBABILITY + "}") int refundSuccessProbability,
            @Value("${payment.min-processing-delay-ms:" + PaymentConstants.DEFAULT_MIN_PROCESSING_DELAY_MS + "}") int minDelayMs,
            @Value("${payment.max-processing-delay-ms:" + PaymentConstants.DEFAULT_MAX_PROCESSING_DELAY_MS + "}") int maxDelayMs) {
        this.random = paymentRandom;
        this.defaultSuccessProbability = successProbability;
        this.defaultRefundSuccessProbability = refundSuccessProbability;
        this.defaultMinDelayMs = minDelayMs;
        this.defaultMaxDelayMs = maxDelayMs;
    }

    /**
     * Updates mock configuration. Null values fall back to the configured defaults.
     */
    public MockConfiguration updateConfiguration(MockConfiguration newConfig) {
        MockConfiguration merged = MockConfiguration.builder()
                .forcedOutcome(normalizeOutcome(newConfig.getForcedOutcome()))
                .successProbability(newConfig.getSuccessProbability() != null
                        ? newConfig.getSuccessProbability() : defaultSuccessProbability)
                .refundSuccessProbability(newConfig.getRefundSuccessProbability() != null
                        ? newConfig.getRefundSuccessProbability() : defaultRefundSuccessProbability)
                .minDelayMs(newConfig.getMinDelayMs() != null
                        ? newConfig.getMinDelayMs() : defaultMinDelayMs)
                .maxDelayMs(newConfig.getMaxDelayMs() != null
                        ? newConfig.getMaxDelayMs() : defaultMaxDelayMs)
                .skipDelay(Boolean.TRUE.equals(newConfig.getSkipDelay()))
                .build();

        config.set(merged);
        log.info("Mock configuration updated: {}", merged);
        return merged;
    }

    public MockConfiguration getConfiguration() {
        MockConfiguration current = config.get();
        if (current == null) {
            return MockConfiguration.builder()
                    .successProbability(defaultSuccessProbability)
                    .refundSuccessProbability(defaultRefundSuccessProbability)
                    .minDelayMs(defaultMinDelayMs)
                    .maxDelayMs(defaultMaxDelayMs)
                    .skipDelay(false)
                    .build();
        }
        return current;
    }

    public MockConfiguration reset() {
        config.set(null);
        log.info("Mock configuration reset to defaults");
        return getConfiguration();
    }

    public Optional<String> getForcedOutcome() {
        return Optional.ofNullable(getConfiguration().getForcedOutcome());
    }

    public int getSuccessProbability() {
        return getConfiguration().getSuccessProbability();
    }

    public int getRefundSuccessProbability() {
        return getConfiguration().getRefundSuccessProbability();
    }

    /**
     * Simulated gateway latency in milliseconds, drawn between the configured bounds.
     */
    public int getProcessingDelay() {
        MockConfiguration cfg = getConfiguration();

        if (Boolean.TRUE.equals(cfg.getSkipDelay())) {
            return 0;
        }

        int min = cfg.getMinDelayMs();
        int max = cfg.getMaxDelayMs();

        if (max <= min) {
            return Math.max(min, 0);
        }

        return random.nextInt(max - min) + min;
    }

    private String normalizeOutcome(String outcome) {
        if (outcome == null) {
            return null;
        }
        String normalized = outcome.trim().toUpperCase(Locale.ROOT);
        if (!PaymentConstants.OUTCOME_APPROVE.equals(normalized)
                && !PaymentConstants.OUTCOME_DECLINE.equals(normalized)) {
            throw new IllegalArgumentException("Unsupported forced outcome: " + outcome);
        }
        return normalized;
    }
}
