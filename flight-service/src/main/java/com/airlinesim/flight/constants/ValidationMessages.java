package com.airlinesim.flight.constants;

public final class ValidationMessages {

    private ValidationMessages() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    public static final String FLIGHT_DATA_REQUIRED = "Flight data is required";
    public static final String FLIGHT_NUMBER_REQUIRED = "Flight number is required";
    public static final String FLIGHT_NUMBER_FORMAT = "Flight number must be 2-10 letters and digits";
    public static final String AIRLINE_REQUIRED = "Airline is required";
    public static final String ORIGIN_REQUIRED = "Origin airport is required";
    public static final String DESTINATION_REQUIRED = "Destination airport is required";
    public static final String AIRPORT_CODE_FORMAT = "Airport codes must be 3 letters";
    public static final String ORIGIN_DESTINATION_SAME = "Origin and destination cannot be the same";
    public static final String DEPARTURE_TIME_REQUIRED = "Scheduled departure is required";
    public static final String ARRIVAL_TIME_REQUIRED = "Scheduled arrival is required";
    public static final String ARRIVAL_AFTER_DEPARTURE = "Arrival must be after departure";
    public static final String DEPARTURE_DATE_REQUIRED = "Departure date is required";
    public static final String STATUS_UPDATE_REQUIRED = "Status update is required";
}
