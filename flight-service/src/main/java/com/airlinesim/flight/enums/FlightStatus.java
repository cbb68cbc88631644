package com.airlinesim.flight.enums;

public enum FlightStatus {
    SCHEDULED,
    ON_TIME,
    DELAYED,
    BOARDING,
    DEPARTED,
    IN_FLIGHT,
    ARRIVED,
    CANCELLED
}
