package com.airlinesim.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class SeatMap {

    String flightNumber;
    LocalDate flightDate;
    int availableSeats;
    List<SeatRow> rows;
}
