package com.airlinesim.flight.validator;

import com.airlinesim.flight.constants.FlightConstants;
import com.airlinesim.flight.constants.ValidationMessages;
import com.airlinesim.flight.dto.FlightEntry;
import com.airlinesim.flight.exception.FlightValidationException;
import com.airlinesim.flight.util.StringUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;

public final class FlightValidator {

    private FlightValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void validateFlightEntry(FlightEntry entry) {

        if (entry == null) {
            throw new FlightValidationException(ValidationMessages.FLIGHT_DATA_REQUIRED);
        }

        validateFlightNumber(entry.getFlightNumber());

        validateAirportCode(entry.getOriginAirport());
        validateAirportCode(entry.getDestinationAirport());
        validateOriginDestinationNotSame(entry.getOriginAirport(), entry.getDestinationAirport());

        validateArrivalAfterDeparture(entry.getScheduledDeparture(), entry.getScheduledArrival());
    }

    public static void validateFlightNumber(String flightNumber) {
        if (!StringUtils.hasText(flightNumber)) {
            throw new FlightValidationException(ValidationMessages.FLIGHT_NUMBER_REQUIRED);
        }
    }

    public static void validateDepartureDate(LocalDate departureDate) {
        if (departureDate == null) {
            throw new FlightValidationException(ValidationMessages.DEPARTURE_DATE_REQUIRED);
        }
    }

    public static void validateAirportCode(String code) {
        String normalized = StringUtils.normalizeCode(code);
        if (normalized == null || normalized.length() != FlightConstants.AIRPORT_CODE_LENGTH
                || !normalized.chars().allMatch(Character::isLetter)) {
            throw new FlightValidationException(ValidationMessages.AIRPORT_CODE_FORMAT);
        }
    }

    public static void validateOriginDestinationNotSame(String origin, String destination) {
        String normalizedOrigin = StringUtils.normalizeCode(origin);
        if (normalizedOrigin != null && normalizedOrigin.equals(StringUtils.normalizeCode(destination))) {
            throw new FlightValidationException(ValidationMessages.ORIGIN_DESTINATION_SAME);
        }
    }

    public static void validateArrivalAfterDeparture(LocalDateTime departureTime, LocalDateTime arrivalTime) {
        if (departureTime == null) {
            throw new FlightValidationException(ValidationMessages.DEPARTURE_TIME_REQUIRED);
        }
        if (arrivalTime == null) {
            throw new FlightValidationException(ValidationMessages.ARRIVAL_TIME_REQUIRED);
        }
        if (!arrivalTime.isAfter(departureTime)) {
            throw new FlightValidationException(ValidationMessages.ARRIVAL_AFTER_DEPARTURE);
        }
    }
}
