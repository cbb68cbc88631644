package com.airlinesim.flight.exception;

import com.airlinesim.flight.constants.FlightConstants;

import java.time.LocalDate;

/**
 * Thrown when no flight instance exists for a flight number and departure date.
 */
public class FlightNotFoundException extends FlightException {

    public FlightNotFoundException(String flightNumber, LocalDate departureDate) {
        super(FlightConstants.ERROR_FLIGHT_NOT_FOUND,
                "Flight not found: " + flightNumber + " on " + departureDate);
    }
}
