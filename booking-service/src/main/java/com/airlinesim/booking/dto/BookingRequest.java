package com.airlinesim.booking.dto;

import com.airlinesim.booking.constants.BookingConstants;
import com.airlinesim.booking.constants.ValidationMessages;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BookingRequest {

    @NotBlank(message = ValidationMessages.FLIGHT_NUMBER_REQUIRED)
    String flightNumber;

    @NotNull(message = ValidationMessages.FLIGHT_DATE_REQUIRED)
    LocalDate flightDate;

    @NotBlank(message = ValidationMessages.USER_ID_REQUIRED)
    String userId;

    @Email(message = ValidationMessages.CONTACT_EMAIL_FORMAT)
    String contactEmail;

    @NotEmpty(message = ValidationMessages.PASSENGERS_REQUIRED)
    @Size(max = BookingConstants.MAX_PASSENGERS_PER_BOOKING, message = ValidationMessages.PASSENGERS_MAX)
    @Valid
    List<PassengerRequest> passengers;

    /**
     * Seat numbers in passenger order. Passengers beyond the end of the list get a seat at check-in.
     */
    @Builder.Default
    List<String> selectedSeats = new ArrayList<>();

    /**
     * Card details. When absent the configured demo card is charged.
     */
    @Valid
    PaymentDetails payment;
}
