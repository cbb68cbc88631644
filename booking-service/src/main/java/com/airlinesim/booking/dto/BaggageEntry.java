package com.airlinesim.booking.dto;

import com.airlinesim.booking.enums.BaggageStatus;
import com.airlinesim.booking.enums.BaggageType;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BaggageEntry {

    String trackingNumber;
    String confirmationNumber;
    String flightNumber;
    String passengerName;
    BaggageType type;
    BigDecimal weight;
    BaggageStatus status;
    String currentLocation;
    LocalDateTime createdAt;
    LocalDateTime updatedAt;
}
