package com.airlinesim.booking.dto;

import com.airlinesim.booking.constants.ValidationMessages;
import com.airlinesim.booking.enums.SeatClass;
import jakarta.validation.constraints.NotBlank;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class PassengerRequest {

    @NotBlank(message = ValidationMessages.FIRST_NAME_REQUIRED)
    String firstName;

    @NotBlank(message = ValidationMessages.LAST_NAME_REQUIRED)
    String lastName;

    LocalDate dateOfBirth;

    @Builder.Default
    SeatClass seatClass = SeatClass.ECONOMY;
}
