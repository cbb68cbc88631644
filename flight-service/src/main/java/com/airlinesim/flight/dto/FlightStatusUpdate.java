package com.airlinesim.flight.dto;

import com.airlinesim.flight.enums.FlightStatus;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

/**
 * Partial update pushed by the flight-status feed. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightStatusUpdate {

    FlightStatus status;
    String gate;
    String terminal;
    LocalDateTime estimatedDeparture;
    LocalDateTime estimatedArrival;
}
