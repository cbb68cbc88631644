package com.airlinesim.booking.dto;

import com.airlinesim.booking.constants.BookingConstants;
import com.airlinesim.booking.constants.ValidationMessages;
import com.airlinesim.booking.enums.BaggageType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BaggageRequest {

    @NotNull(message = ValidationMessages.BAGGAGE_TYPE_REQUIRED)
    BaggageType type;

    @NotNull(message = ValidationMessages.BAGGAGE_WEIGHT_REQUIRED)
    @DecimalMin(value = "0", inclusive = false, message = ValidationMessages.BAGGAGE_WEIGHT_POSITIVE)
    @DecimalMax(value = BookingConstants.MAX_BAGGAGE_WEIGHT_KG, message = ValidationMessages.BAGGAGE_WEIGHT_MAX)
    BigDecimal weight;

    /**
     * Zero-based index into the booking's passengers. Defaults to the first passenger.
     */
    @Min(0)
    Integer passengerIndex;
}
