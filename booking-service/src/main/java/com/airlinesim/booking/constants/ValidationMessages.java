package com.airlinesim.booking.constants;

public final class ValidationMessages {

    private ValidationMessages() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    public static final String REQUEST_REQUIRED = "Booking request is required";
    public static final String USER_ID_REQUIRED = "User ID is required";
    public static final String FLIGHT_NUMBER_REQUIRED = "Flight number is required";
    public static final String FLIGHT_DATE_REQUIRED = "Flight date is required";
    public static final String CONFIRMATION_NUMBER_REQUIRED = "Confirmation number is required";
    public static final String CONTACT_EMAIL_FORMAT = "Contact email must be a valid email address";

    public static final String PASSENGERS_REQUIRED = "At least one passenger is required";
    public static final String PASSENGERS_MAX = "A booking cannot have more than 9 passengers";
    public static final String PASSENGER_REQUIRED = "Passenger details are required";
    public static final String FIRST_NAME_REQUIRED = "Passenger first name is required";
    public static final String LAST_NAME_REQUIRED = "Passenger last name is required";
    public static final String SEAT_CLASS_REQUIRED = "Seat class is required for every passenger";

    public static final String SEATS_EXCEED_PASSENGERS = "Cannot select more seats than passengers";
    public static final String SEAT_NUMBER_REQUIRED = "Selected seat numbers cannot be blank";
    public static final String DUPLICATE_SEAT = "Seat selected more than once: ";

    public static final String BAGGAGE_REQUIRED = "Baggage details are required";
    public static final String BAGGAGE_TYPE_REQUIRED = "Baggage type is required";
    public static final String BAGGAGE_WEIGHT_REQUIRED = "Baggage weight is required";
    public static final String BAGGAGE_WEIGHT_POSITIVE = "Baggage weight must be greater than zero";
    public static final String BAGGAGE_WEIGHT_MAX = "Baggage weight cannot exceed 45 kg";
    public static final String BAGGAGE_STATUS_REQUIRED = "Baggage status is required";
    public static final String TRACKING_NUMBER_REQUIRED = "Tracking number is required";
}
