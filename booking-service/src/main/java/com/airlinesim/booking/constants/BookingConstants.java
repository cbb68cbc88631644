package com.airlinesim.booking.constants;

public final class BookingConstants {

    private BookingConstants() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    public static final int MIN_PASSENGERS_PER_BOOKING = 1;
    public static final int MAX_PASSENGERS_PER_BOOKING = 9;

    public static final int CONFIRMATION_NUMBER_LENGTH = 6;
    public static final String CONFIRMATION_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    public static final String TRACKING_LETTERS = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    public static final int TRACKING_LETTER_COUNT = 3;
    public static final int TRACKING_DIGIT_COUNT = 6;
    public static final String QR_PREFIX = "QR-";

    public static final String DEFAULT_BASE_FARE = "299.99";
    public static final int DEFAULT_MAX_CODE_ATTEMPTS = 5;
    public static final int DEFAULT_CHECK_IN_WINDOW_HOURS = 24;
    public static final int DEFAULT_BOARDING_OFFSET_MINUTES = 30;

    public static final String MAX_BAGGAGE_WEIGHT_KG = "45";

    public static final String NOT_ASSIGNED = "TBD";

    // ========== Error Codes ==========

    public static final String ERROR_VALIDATION = "VALIDATION_ERROR";
    public static final String ERROR_INVALID_REQUEST = "INVALID_REQUEST";
    public static final String ERROR_INVALID_PASSENGERS = "INVALID_PASSENGERS";
    public static final String ERROR_INVALID_SEAT_SELECTION = "INVALID_SEAT_SELECTION";
    public static final String ERROR_SEAT_CLASS_MISMATCH = "SEAT_CLASS_MISMATCH";
    public static final String ERROR_INVALID_BAGGAGE = "INVALID_BAGGAGE";

    public static final String ERROR_FLIGHT_NOT_FOUND = "FLIGHT_NOT_FOUND";
    public static final String ERROR_BOOKING_NOT_FOUND = "BOOKING_NOT_FOUND";
    public static final String ERROR_SEAT_NOT_FOUND = "SEAT_NOT_FOUND";
    public static final String ERROR_BAGGAGE_NOT_FOUND = "BAGGAGE_NOT_FOUND";

    public static final String ERROR_SEAT_UNAVAILABLE = "SEAT_UNAVAILABLE";
    public static final String ERROR_INVALID_BOOKING_STATE = "INVALID_BOOKING_STATE";
    public static final String ERROR_BOOKING_LOCKED = "BOOKING_LOCKED";

    public static final String ERROR_FLIGHT_DEPARTED = "FLIGHT_DEPARTED";
    public static final String ERROR_FLIGHT_NOT_BOOKABLE = "FLIGHT_NOT_BOOKABLE";
    public static final String ERROR_CHECK_IN_NOT_YET_AVAILABLE = "CHECK_IN_NOT_YET_AVAILABLE";
    public static final String ERROR_CHECK_IN_CLOSED = "CHECK_IN_CLOSED";

    public static final String ERROR_PAYMENT_DECLINED = "PAYMENT_DECLINED";

    public static final String ERROR_PERSISTENCE_FAILED = "BOOKING_PERSISTENCE_FAILED";
    public static final String ERROR_CONFIRMATION_COLLISION = "CONFIRMATION_COLLISION";
    public static final String ERROR_TRACKING_NUMBER_COLLISION = "TRACKING_NUMBER_COLLISION";

    public static final String ERROR_SERVICE_UNAVAILABLE = "SERVICE_UNAVAILABLE";

    // ========== Metrics ==========

    public static final String METRIC_BOOKING_CREATED = "booking.created";
    public static final String METRIC_BOOKING_FAILED = "booking.failed";
    public static final String METRIC_BOOKING_CHECKIN = "booking.checkin";
    public static final String METRIC_SEAT_CONFLICTS = "seat.reservation.conflicts";
    public static final String METRIC_CREATE_DURATION = "booking.create.duration";
    public static final String METRIC_PAYMENT_CHARGE = "payment.charge";
    public static final String TAG_REASON = "reason";
    public static final String TAG_OUTCOME = "outcome";
}
