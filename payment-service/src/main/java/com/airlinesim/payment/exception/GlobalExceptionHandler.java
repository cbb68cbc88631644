package com.airlinesim.payment.exception;

import com.airlinesim.payment.constants.PaymentConstants;
import com.airlinesim.payment.dto.ApiError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

/**
 * Error bodies for the gateway endpoints. Card declines never reach this class; they are
 * returned as {@code success=false} results. {@code retryable} tells the booking side whether
 * the same request may succeed later.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            errors.put(error.getField(), error.getDefaultMessage());
        }
        log.warn("Rejected gateway request: {}", errors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(error(PaymentConstants.ERROR_VALIDATION, PaymentConstants.MESSAGE_INVALID_PAYMENT, errors, false));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleMalformedRequest(Exception ex) {
        log.warn("Malformed gateway request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(error(PaymentConstants.ERROR_INVALID_REQUEST, "Malformed or unreadable request body", null, false));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleMockConfiguration(IllegalArgumentException ex) {
        log.warn("Rejected mock configuration: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(error(PaymentConstants.ERROR_INVALID_MOCK_CONFIGURATION, ex.getMessage(), null, false));
    }

    @ExceptionHandler(PaymentGatewayException.class)
    public ResponseEntity<ApiError> handleGatewayException(PaymentGatewayException ex) {
        log.error("Gateway failure: code={}, message={}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(error(ex.getErrorCode(), ex.getMessage(), null, true));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception ex) {
        log.error("Unexpected exception: ", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(error(PaymentConstants.ERROR_INTERNAL, "An unexpected error occurred", null, true));
    }

    private static ApiError error(String code, String message, Map<String, String> details, boolean retryable) {
        return ApiError.builder()
                .error(code)
                .message(message)
                .details(details)
                .retryable(retryable)
                .build();
    }
}
