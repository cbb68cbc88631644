package com.airlinesim.payment.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChargeResult {

    boolean success;
    String transactionId;
    BigDecimal amount;
    String errorMessage;
    LocalDateTime processedAt;

    public static ChargeResult approved(String transactionId, BigDecimal amount, LocalDateTime processedAt) {
        return ChargeResult.builder()
                .success(true)
                .transactionId(transactionId)
                .amount(amount)
                .processedAt(processedAt)
                .build();
    }

    public static ChargeResult declined(String errorMessage, LocalDateTime processedAt) {
        return ChargeResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .processedAt(processedAt)
                .build();
    }
}
