package com.airlinesim.booking.client;

import com.airlinesim.booking.dto.ChargeRequest;
import com.airlinesim.booking.dto.PaymentDetails;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Builds gateway requests, falling back to the configured demo card when the booking carries no card.
 */
@Component
public class ChargeRequestFactory {

    private final PaymentDetails demoCard;

    public ChargeRequestFactory(@Value("${booking.payment.demo-card.number:4111111111111111}") String cardNumber,
                                @Value("${booking.payment.demo-card.expiry-month:12}") int expiryMonth,
                                @Value("${booking.payment.demo-card.expiry-year:2030}") int expiryYear,
                                @Value("${booking.payment.demo-card.cvv:123}") String cvv,
                                @Value("${booking.payment.demo-card.holder:Demo Customer}") String holder) {
        this.demoCard = PaymentDetails.builder()
                .cardNumber(cardNumber)
                .expiryMonth(expiryMonth)
                .expiryYear(expiryYear)
                .cvv(cvv)
                .cardholderName(holder)
                .build();
    }

    public ChargeRequest create(PaymentDetails payment, BigDecimal amount, String reference) {
        PaymentDetails card = payment != null ? payment : demoCard;
        return ChargeRequest.builder()
                .amount(amount)
                .cardNumber(card.getCardNumber())
                .expiryMonth(card.getExpiryMonth())
                .expiryYear(card.getExpiryYear())
                .cvv(card.getCvv())
                .cardholderName(card.getCardholderName())
                .reference(reference)
                .build();
    }
}
