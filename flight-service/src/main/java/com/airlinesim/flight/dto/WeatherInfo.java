package com.airlinesim.flight.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class WeatherInfo {

    String airportCode;
    String location;
    double temperatureCelsius;
    String conditions;
    String description;
    int humidity;
    int pressureHpa;
    double visibilityKm;
    double windSpeedMps;
    String windDirection;
    LocalDateTime observedAt;
}
