package com.airlinesim.flight.exception;

import com.airlinesim.flight.constants.FlightConstants;

public class FlightValidationException extends FlightException {

    public FlightValidationException(String message) {
        super(FlightConstants.ERROR_VALIDATION, message);
    }
}
