package com.airlinesim.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class PaymentDetails {

    @ToString.Exclude
    String cardNumber;

    Integer expiryMonth;
    Integer expiryYear;

    @ToString.Exclude
    String cvv;

    String cardholderName;
}
