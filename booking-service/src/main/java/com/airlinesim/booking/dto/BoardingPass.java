package com.airlinesim.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BoardingPass {

    String confirmationNumber;
    String passengerName;
    String flightNumber;
    String seatNumber;
    String gate;
    String terminal;
    LocalDateTime departureTime;
    LocalDateTime boardingTime;
    String qrCode;
}
