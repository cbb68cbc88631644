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
public class RefundResult {

    boolean success;
    String transactionId;
    String refundId;
    BigDecimal amount;
    String errorMessage;
    LocalDateTime processedAt;

    public static RefundResult approved(String transactionId, String refundId,
                                        BigDecimal amount, LocalDateTime processedAt) {
        return RefundResult.builder()
                .success(true)
                .transactionId(transactionId)
                .refundId(refundId)
                .amount(amount)
                .processedAt(processedAt)
                .build();
    }

    public static RefundResult declined(String transactionId, String errorMessage, LocalDateTime processedAt) {
        return RefundResult.builder()
                .success(false)
                .transactionId(transactionId)
                .errorMessage(errorMessage)
                .processedAt(processedAt)
                .build();
    }
}
