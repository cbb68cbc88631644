package com.airlinesim.booking.enums;

/**
 * Flight status as reported by the flight service.
 */
public enum FlightStatus {
    SCHEDULED,
    ON_TIME,
    DELAYED,
    BOARDING,
    DEPARTED,
    IN_FLIGHT,
    ARRIVED,
    CANCELLED;

    public boolean isBookable() {
        return switch (this) {
            case SCHEDULED, ON_TIME, DELAYED, BOARDING -> true;
            case DEPARTED, IN_FLIGHT, ARRIVED, CANCELLED -> false;
        };
    }
}
