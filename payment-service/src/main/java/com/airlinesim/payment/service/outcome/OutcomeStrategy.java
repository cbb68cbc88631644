package com.airlinesim.payment.service.outcome;

/**
 * Decides whether the simulated issuer approves an operation.
 */
public interface OutcomeStrategy {

    boolean approveCharge();

    boolean approveRefund();
}
