package com.airlinesim.flight.constants;

public final class FlightConstants {

    private FlightConstants() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    public static final int MAX_FLIGHT_NUMBER_LENGTH = 10;
    public static final int AIRPORT_CODE_LENGTH = 3;

    public static final String ERROR_FLIGHT_NOT_FOUND = "FLIGHT_NOT_FOUND";
    public static final String ERROR_VALIDATION = "VALIDATION_ERROR";
    public static final String ERROR_DUPLICATE_FLIGHT = "DUPLICATE_FLIGHT";
    public static final String ERROR_AIRPORT_NOT_FOUND = "AIRPORT_NOT_FOUND";
    public static final String ERROR_WEATHER_UNAVAILABLE = "WEATHER_UNAVAILABLE";
}
