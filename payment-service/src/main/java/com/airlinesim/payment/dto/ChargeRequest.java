package com.airlinesim.payment.dto;

import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;

/**
 * Card authorization request. Card fields are checked by the gateway itself,
 * so a malformed card is answered with a decline rather than a 400.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ChargeRequest {

    @NotNull(message = "Amount is required")
    BigDecimal amount;

    @ToString.Exclude
    String cardNumber;

    Integer expiryMonth;
    Integer expiryYear;

    @ToString.Exclude
    String cvv;

    String cardholderName;

    /**
     * Caller reference, e.g. the booking attempt. Stored with the transaction.
     */
    String reference;
}
