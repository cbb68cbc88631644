package com.airlinesim.booking.exception;

import com.airlinesim.booking.constants.BookingConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(BookingException.class)
    public ResponseEntity<ErrorResponse> handleBookingException(BookingException ex) {
        HttpStatus status = statusFor(ex.getErrorCode());

        if (status.is5xxServerError()) {
            log.error("Booking error: code={}, message={}", ex.getErrorCode(), ex.getMessage(), ex);
        } else {
            log.warn("Booking error: code={}, message={}", ex.getErrorCode(), ex.getMessage());
        }

        Map<String, String> details = null;
        if (ex instanceof CheckInNotYetAvailableException notYet) {
            details = Map.of("opensAt", notYet.getOpensAt().toString());
        }

        return ResponseEntity.status(status)
                .body(ErrorResponse.of(ex.getErrorCode(), ex.getMessage(), details));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            errors.put(error.getField(), error.getDefaultMessage());
        }
        log.warn("Validation errors: {}", errors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(BookingConstants.ERROR_VALIDATION, "Invalid request", errors));
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(BookingConstants.ERROR_INVALID_REQUEST, "Malformed or incomplete request"));
    }

    @ExceptionHandler(PessimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleLockFailure(PessimisticLockingFailureException ex) {
        log.warn("Booking row lock not acquired: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorResponse.of(BookingConstants.ERROR_BOOKING_LOCKED, "Booking is being updated by another request, retry shortly"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected exception: ", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    static HttpStatus statusFor(String errorCode) {
        return switch (errorCode) {
            case BookingConstants.ERROR_FLIGHT_NOT_FOUND,
                 BookingConstants.ERROR_BOOKING_NOT_FOUND,
                 BookingConstants.ERROR_SEAT_NOT_FOUND,
                 BookingConstants.ERROR_BAGGAGE_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case BookingConstants.ERROR_SEAT_UNAVAILABLE,
                 BookingConstants.ERROR_INVALID_BOOKING_STATE,
                 BookingConstants.ERROR_BOOKING_LOCKED -> HttpStatus.CONFLICT;
            case BookingConstants.ERROR_PERSISTENCE_FAILED,
                 BookingConstants.ERROR_CONFIRMATION_COLLISION,
                 BookingConstants.ERROR_TRACKING_NUMBER_COLLISION -> HttpStatus.INTERNAL_SERVER_ERROR;
            case BookingConstants.ERROR_SERVICE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.BAD_REQUEST;
        };
    }

    public record ErrorResponse(
            String error,
            String message,
            Map<String, String> details,
            LocalDateTime timestamp
    ) {
        public static ErrorResponse of(String error, String message) {
            return new ErrorResponse(error, message, null, LocalDateTime.now());
        }

        public static ErrorResponse of(String error, String message, Map<String, String> details) {
            return new ErrorResponse(error, message, details, LocalDateTime.now());
        }
    }
}
