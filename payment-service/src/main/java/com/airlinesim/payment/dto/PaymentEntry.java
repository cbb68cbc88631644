package com.airlinesim.payment.dto;

import com.airlinesim.payment.enums.TransactionStatus;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * An approved charge as remembered by the gateway. Declines are not stored.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class PaymentEntry {

    String transactionId;
    String reference;
    String cardLastFour;
    BigDecimal amount;
    TransactionStatus status;
    String refundId;
    BigDecimal refundedAmount;
    LocalDateTime processedAt;
    LocalDateTime refundedAt;
}
