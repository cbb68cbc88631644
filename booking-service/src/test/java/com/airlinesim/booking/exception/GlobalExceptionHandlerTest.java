package com.airlinesim.booking.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GlobalExceptionHandler Tests")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("Error codes map to HTTP statuses")
    void statusFor_Taxonomy() {
        assertThat(GlobalExceptionHandler.statusFor("BOOKING_NOT_FOUND")).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(GlobalExceptionHandler.statusFor("SEAT_NOT_FOUND")).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(GlobalExceptionHandler.statusFor("SEAT_UNAVAILABLE")).isEqualTo(HttpStatus.CONFLICT);
        assertThat(GlobalExceptionHandler.statusFor("INVALID_BOOKING_STATE")).isEqualTo(HttpStatus.CONFLICT);
        assertThat(GlobalExceptionHandler.statusFor("CONFIRMATION_COLLISION")).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(GlobalExceptionHandler.statusFor("SERVICE_UNAVAILABLE")).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(GlobalExceptionHandler.statusFor("PAYMENT_DECLINED")).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(GlobalExceptionHandler.statusFor("CHECK_IN_CLOSED")).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    @DisplayName("Early check-in reports when the window opens")
    void handleBookingException_CheckInNotYetAvailable_Details() {
        LocalDateTime opensAt = LocalDateTime.of(2026, 11, 1, 10, 0);

        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
                handler.handleBookingException(new CheckInNotYetAvailableException("AA123", opensAt));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().error()).isEqualTo("CHECK_IN_NOT_YET_AVAILABLE");
        assertThat(response.getBody().details()).containsEntry("opensAt", "2026-11-01T10:00");
    }

    @Test
    @DisplayName("Seat conflicts are reported as 409")
    void handleBookingException_SeatUnavailable_Conflict() {
        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
                handler.handleBookingException(new SeatUnavailableException("AA123", "14A"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().details()).isNull();
    }

    @Test
    @DisplayName("A lock wait that times out is reported as a retryable 409")
    void handleLockFailure_Conflict() {
        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
                handler.handleLockFailure(new PessimisticLockingFailureException("lock timeout on bookings"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().error()).isEqualTo("BOOKING_LOCKED");
    }
}
