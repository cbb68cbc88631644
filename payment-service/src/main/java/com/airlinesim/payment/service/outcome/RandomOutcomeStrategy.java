package com.airlinesim.payment.service.outcome;

import com.airlinesim.payment.constants.PaymentConstants;
import com.airlinesim.payment.service.MockConfigurationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Random;

/**
 * Draws approvals from the configured probabilities unless an outcome is forced.
 */
@Component
@Slf4j
public class RandomOutcomeStrategy implements OutcomeStrategy {

    private final MockConfigurationService mockConfig;
    private final Random random;

    public RandomOutcomeStrategy(MockConfigurationService mockConfig, Random paymentRandom) {
        this.mockConfig = mockConfig;
        this.random = paymentRandom;
        log.info("Initialized RandomOutcomeStrategy: charge={}%, refund={}%",
                mockConfig.getSuccessProbability(), mockConfig.getRefundSuccessProbability());
    }

    @Override
    public boolean approveCharge() {
        return forced().orElseGet(() -> random.nextInt(100) < mockConfig.getSuccessProbability());
    }

    @Override
    public boolean approveRefund() {
        return forced().orElseGet(() -> random.nextInt(100) < mockConfig.getRefundSuccessProbability());
    }

    private Optional<Boolean> forced() {
        return mockConfig.getForcedOutcome()
                .map(PaymentConstants.OUTCOME_APPROVE::equals);
    }
}
