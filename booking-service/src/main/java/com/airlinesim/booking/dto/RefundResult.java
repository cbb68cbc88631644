package com.airlinesim.booking.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RefundResult {

    boolean success;
    String transactionId;
    String refundId;
    BigDecimal amount;
    String errorMessage;
    LocalDateTime processedAt;

    public static RefundResult failed(String transactionId, String errorMessage) {
        return RefundResult.builder()
                .success(false)
                .transactionId(transactionId)
                .errorMessage(errorMessage)
                .build();
    }
}
