package com.airlinesim.booking.dto;

import com.airlinesim.booking.enums.FlightStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Flight instance as returned by the flight service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlightEntry {

    String flightNumber;
    String airline;
    String originAirport;
    String destinationAirport;
    LocalDate departureDate;
    LocalDateTime scheduledDeparture;
    LocalDateTime estimatedDeparture;
    LocalDateTime scheduledArrival;
    LocalDateTime estimatedArrival;
    FlightStatus status;
    String gate;
    String terminal;
    String aircraft;
}
