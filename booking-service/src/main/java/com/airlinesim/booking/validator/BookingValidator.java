package com.airlinesim.booking.validator;

import com.airlinesim.booking.constants.BookingConstants;
import com.airlinesim.booking.constants.ValidationMessages;
import com.airlinesim.booking.dto.BaggageRequest;
import com.airlinesim.booking.dto.BookingRequest;
import com.airlinesim.booking.dto.PassengerRequest;
import com.airlinesim.booking.exception.BookingValidationException;
import com.airlinesim.booking.util.StringUtils;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.airlinesim.booking.util.StringUtils.hasText;

/**
 * Request checks that run before any side effect. Bean Validation covers the HTTP path;
 * these cover every caller.
 */
public final class BookingValidator {

    private static final BigDecimal MAX_BAGGAGE_WEIGHT = new BigDecimal(BookingConstants.MAX_BAGGAGE_WEIGHT_KG);

    private BookingValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void validateBookingRequest(BookingRequest request) {
        if (request == null) {
            throw new BookingValidationException(BookingConstants.ERROR_INVALID_REQUEST, ValidationMessages.REQUEST_REQUIRED);
        }
        if (!hasText(request.getFlightNumber())) {
            throw new BookingValidationException(ValidationMessages.FLIGHT_NUMBER_REQUIRED);
        }
        if (request.getFlightDate() == null) {
            throw new BookingValidationException(ValidationMessages.FLIGHT_DATE_REQUIRED);
        }
        validateUserId(request.getUserId());
        validatePassengers(request.getPassengers());
        validateSelectedSeats(request.getSelectedSeats(), request.getPassengers().size());
    }

    public static void validateUserId(String userId) {
        if (!hasText(userId)) {
            throw new BookingValidationException(ValidationMessages.USER_ID_REQUIRED);
        }
    }

    public static void validateConfirmationNumber(String confirmationNumber) {
        if (!hasText(confirmationNumber)) {
            throw new BookingValidationException(ValidationMessages.CONFIRMATION_NUMBER_REQUIRED);
        }
    }

    public static void validateTrackingNumber(String trackingNumber) {
        if (!hasText(trackingNumber)) {
            throw new BookingValidationException(ValidationMessages.TRACKING_NUMBER_REQUIRED);
        }
    }

    public static void validateBaggageRequest(BaggageRequest request) {
        if (request == null) {
            throw new BookingValidationException(BookingConstants.ERROR_INVALID_BAGGAGE, ValidationMessages.BAGGAGE_REQUIRED);
        }
        if (request.getType() == null) {
            throw new BookingValidationException(BookingConstants.ERROR_INVALID_BAGGAGE, ValidationMessages.BAGGAGE_TYPE_REQUIRED);
        }
        if (request.getWeight() == null) {
            throw new BookingValidationException(BookingConstants.ERROR_INVALID_BAGGAGE, ValidationMessages.BAGGAGE_WEIGHT_REQUIRED);
        }
        if (request.getWeight().signum() <= 0) {
            throw new BookingValidationException(BookingConstants.ERROR_INVALID_BAGGAGE, ValidationMessages.BAGGAGE_WEIGHT_POSITIVE);
        }
        if (request.getWeight().compareTo(MAX_BAGGAGE_WEIGHT) > 0) {
            throw new BookingValidationException(BookingConstants.ERROR_INVALID_BAGGAGE, ValidationMessages.BAGGAGE_WEIGHT_MAX);
        }
    }

    // ============ Private Methods ============

    private static void validatePassengers(List<PassengerRequest> passengers) {
        if (passengers == null || passengers.size() < BookingConstants.MIN_PASSENGERS_PER_BOOKING) {
            throw new BookingValidationException(BookingConstants.ERROR_INVALID_PASSENGERS, ValidationMessages.PASSENGERS_REQUIRED);
        }
        if (passengers.size() > BookingConstants.MAX_PASSENGERS_PER_BOOKING) {
            throw new BookingValidationException(BookingConstants.ERROR_INVALID_PASSENGERS, ValidationMessages.PASSENGERS_MAX);
        }
        for (PassengerRequest passenger : passengers) {
            if (passenger == null) {
                throw new BookingValidationException(BookingConstants.ERROR_INVALID_PASSENGERS, ValidationMessages.PASSENGER_REQUIRED);
            }
            if (!hasText(passenger.getFirstName())) {
                throw new BookingValidationException(BookingConstants.ERROR_INVALID_PASSENGERS, ValidationMessages.FIRST_NAME_REQUIRED);
            }
            if (!hasText(passenger.getLastName())) {
                throw new BookingValidationException(BookingConstants.ERROR_INVALID_PASSENGERS, ValidationMessages.LAST_NAME_REQUIRED);
            }
            if (passenger.getSeatClass() == null) {
                throw new BookingValidationException(BookingConstants.ERROR_INVALID_PASSENGERS, ValidationMessages.SEAT_CLASS_REQUIRED);
            }
        }
    }

    private static void validateSelectedSeats(List<String> selectedSeats, int passengerCount) {
        if (selectedSeats == null || selectedSeats.isEmpty()) {
            return;
        }
        if (selectedSeats.size() > passengerCount) {
            throw new BookingValidationException(BookingConstants.ERROR_INVALID_SEAT_SELECTION, ValidationMessages.SEATS_EXCEED_PASSENGERS);
        }

        Set<String> seen = new HashSet<>();
        for (String seat : selectedSeats) {
            if (!hasText(seat)) {
                throw new BookingValidationException(BookingConstants.ERROR_INVALID_SEAT_SELECTION, ValidationMessages.SEAT_NUMBER_REQUIRED);
            }
            String normalized = StringUtils.normalizeCode(seat);
            if (!seen.add(normalized)) {
                throw new BookingValidationException(BookingConstants.ERROR_INVALID_SEAT_SELECTION,
                        ValidationMessages.DUPLICATE_SEAT + normalized);
            }
        }
    }
}
