package com.airlinesim.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ChargeRequest {

    BigDecimal amount;

    @ToString.Exclude
    String cardNumber;

    Integer expiryMonth;
    Integer expiryYear;

    @ToString.Exclude
    String cvv;

    String cardholderName;
    String reference;
}
