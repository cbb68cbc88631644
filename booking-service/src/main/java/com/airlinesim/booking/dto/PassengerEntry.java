package com.airlinesim.booking.dto;

import com.airlinesim.booking.enums.SeatClass;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class PassengerEntry {

    String firstName;
    String lastName;
    LocalDate dateOfBirth;
    String seatNumber;
    SeatClass seatClass;
    boolean checkedIn;
    LocalDateTime checkInTime;
}
