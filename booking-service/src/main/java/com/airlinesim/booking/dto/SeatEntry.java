package com.airlinesim.booking.dto;

import com.airlinesim.booking.enums.SeatClass;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class SeatEntry {

    String seatNumber;
    SeatClass seatClass;
    boolean available;
}
