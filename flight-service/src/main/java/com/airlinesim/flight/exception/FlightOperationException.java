package com.airlinesim.flight.exception;

import com.airlinesim.flight.constants.FlightConstants;

import java.time.LocalDate;

/**
 * Thrown when a flight or weather operation cannot be carried out.
 */
public class FlightOperationException extends FlightException {

    public FlightOperationException(String errorCode, String message, boolean retryable) {
        super(errorCode, message, retryable);
    }

    public FlightOperationException(String errorCode, String message, boolean retryable, Throwable cause) {
        super(errorCode, message, retryable, cause);
    }

    public static FlightOperationException duplicateFlight(String flightNumber, LocalDate departureDate) {
        return new FlightOperationException(FlightConstants.ERROR_DUPLICATE_FLIGHT,
                "Flight " + flightNumber + " already exists on " + departureDate, false);
    }

    public static FlightOperationException airportNotFound(String airportCode) {
        return new FlightOperationException(FlightConstants.ERROR_AIRPORT_NOT_FOUND,
                "No weather station for airport: " + airportCode, false);
    }

    public static FlightOperationException weatherUnavailable(String airportCode, Throwable cause) {
        return new FlightOperationException(FlightConstants.ERROR_WEATHER_UNAVAILABLE,
                "Weather data is temporarily unavailable for " + airportCode, true, cause);
    }
}
