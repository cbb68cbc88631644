package com.airlinesim.booking.controller.v1;

import com.airlinesim.booking.dto.BookingConfirmation;
import com.airlinesim.booking.enums.BookingStatus;
import com.airlinesim.booking.exception.CheckInNotYetAvailableException;
import com.airlinesim.booking.exception.SeatUnavailableException;
import com.airlinesim.booking.service.BookingWorkflowService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(BookingController.class)
@DisplayName("BookingController Tests")
class BookingControllerTest {

    private static final String VALID_BODY = """
            {"flightNumber":"AA123","flightDate":"2026-11-02","userId":"user123",
             "passengers":[{"firstName":"Ada","lastName":"Lovelace","seatClass":"ECONOMY"}],
             "selectedSeats":["14A"]}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BookingWorkflowService bookingWorkflowService;

    @Test
    @DisplayName("POST /v1/bookings returns the confirmation")
    void create_Valid_Ok() throws Exception {
        when(bookingWorkflowService.createBooking(any())).thenReturn(BookingConfirmation.builder()
                .confirmationNumber("ABC123")
                .status(BookingStatus.CONFIRMED)
                .totalAmount(new BigDecimal("299.99"))
                .build());

        mockMvc.perform(post("/v1/bookings").contentType(MediaType.APPLICATION_JSON).content(VALID_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.confirmationNumber").value("ABC123"))
                .andExpect(jsonPath("$.status").value("CONFIRMED"));
    }

    @Test
    @DisplayName("A request without passengers is rejected before the service")
    void create_NoPassengers_BadRequest() throws Exception {
        mockMvc.perform(post("/v1/bookings").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"flightNumber\":\"AA123\",\"flightDate\":\"2026-11-02\",\"userId\":\"u1\",\"passengers\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
        verifyNoInteractions(bookingWorkflowService);
    }

    @Test
    @DisplayName("A seat lost to another booking is a 409")
    void create_SeatTaken_Conflict() throws Exception {
        when(bookingWorkflowService.createBooking(any())).thenThrow(new SeatUnavailableException("AA123", "14A"));

        mockMvc.perform(post("/v1/bookings").contentType(MediaType.APPLICATION_JSON).content(VALID_BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("SEAT_UNAVAILABLE"));
    }

    @Test
    @DisplayName("Early check-in reports the opening time")
    void checkIn_TooEarly_BadRequestWithOpensAt() throws Exception {
        when(bookingWorkflowService.checkIn("ABC123"))
                .thenThrow(new CheckInNotYetAvailableException("AA123", LocalDateTime.of(2026, 11, 1, 10, 0)));

        mockMvc.perform(post("/v1/bookings/ABC123/checkin"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("CHECK_IN_NOT_YET_AVAILABLE"))
                .andExpect(jsonPath("$.details.opensAt").value("2026-11-01T10:00"));
    }

    @Test
    @DisplayName("A malformed body is an invalid request")
    void create_MalformedJson_BadRequest() throws Exception {
        mockMvc.perform(post("/v1/bookings").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));
    }
}
