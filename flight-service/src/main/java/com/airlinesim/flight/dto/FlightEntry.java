package com.airlinesim.flight.dto;

import com.airlinesim.flight.constants.ValidationMessages;
import com.airlinesim.flight.enums.FlightStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlightEntry {

    @NotBlank(message = ValidationMessages.FLIGHT_NUMBER_REQUIRED)
    @Pattern(regexp = "^[A-Za-z0-9]{2,10}$", message = ValidationMessages.FLIGHT_NUMBER_FORMAT)
    String flightNumber;

    @NotBlank(message = ValidationMessages.AIRLINE_REQUIRED)
    String airline;

    @NotBlank(message = ValidationMessages.ORIGIN_REQUIRED)
    String originAirport;

    @NotBlank(message = ValidationMessages.DESTINATION_REQUIRED)
    String destinationAirport;

    LocalDate departureDate;

    @NotNull(message = ValidationMessages.DEPARTURE_TIME_REQUIRED)
    LocalDateTime scheduledDeparture;

    LocalDateTime estimatedDeparture;

    @NotNull(message = ValidationMessages.ARRIVAL_TIME_REQUIRED)
    LocalDateTime scheduledArrival;

    LocalDateTime estimatedArrival;

    FlightStatus status;

    String gate;

    String terminal;

    String aircraft;

    LocalDateTime updatedAt;
}
