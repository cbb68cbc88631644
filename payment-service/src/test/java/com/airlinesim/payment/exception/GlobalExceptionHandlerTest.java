package com.airlinesim.payment.exception;

import com.airlinesim.payment.dto.ApiError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.mock.http.MockHttpInputMessage;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GlobalExceptionHandler Tests")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("An unreadable body is a non-retryable 400")
    void handleMalformedRequest_BadRequest() {
        ResponseEntity<ApiError> response = handler.handleMalformedRequest(
                new HttpMessageNotReadableException("JSON parse error", new MockHttpInputMessage(new byte[0])));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getError()).isEqualTo("INVALID_REQUEST");
        assertThat(response.getBody().isRetryable()).isFalse();
    }

    @Test
    @DisplayName("An unsupported forced outcome is reported as a mock configuration error")
    void handleMockConfiguration_BadRequest() {
        ResponseEntity<ApiError> response = handler.handleMockConfiguration(
                new IllegalArgumentException("Unsupported forced outcome: MAYBE"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getError()).isEqualTo("INVALID_MOCK_CONFIGURATION");
        assertThat(response.getBody().getMessage()).contains("MAYBE");
    }

    @Test
    @DisplayName("Transaction id exhaustion is a retryable 503")
    void handleGatewayException_ServiceUnavailable() {
        ResponseEntity<ApiError> response = handler.handleGatewayException(
                PaymentGatewayException.transactionIdExhausted(5));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().getError()).isEqualTo("GATEWAY_UNAVAILABLE");
        assertThat(response.getBody().isRetryable()).isTrue();
    }

    @Test
    @DisplayName("Anything else is a retryable 500 without internal detail")
    void handleGenericException_InternalError() {
        ResponseEntity<ApiError> response = handler.handleGenericException(new NullPointerException("cardNumber"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getError()).isEqualTo("INTERNAL_ERROR");
        assertThat(response.getBody().getMessage()).doesNotContain("cardNumber");
    }
}
