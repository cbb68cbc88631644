package com.airlinesim.booking.client;

import com.airlinesim.booking.dto.ChargeRequest;
import com.airlinesim.booking.dto.ChargeResult;
import com.airlinesim.booking.dto.RefundRequest;
import com.airlinesim.booking.dto.RefundResult;
import com.airlinesim.booking.exception.ServiceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;

/**
 * Client for the payment gateway. A charge that cannot be completed is an error for the caller;
 * a refund that cannot be completed comes back as a failed result.
 */
@Component
@Slf4j
public class PaymentServiceClient {

    private final RestTemplate restTemplate;
    private final String paymentServiceUrl;

    public PaymentServiceClient(RestTemplate restTemplate,
                                @Value("${payment-service.url:http://localhost:8084}") String paymentServiceUrl) {
        this.restTemplate = restTemplate;
        this.paymentServiceUrl = paymentServiceUrl;
    }

    public ChargeResult charge(ChargeRequest request) {
        log.info("Calling payment service: POST /v1/payments/charge - reference={}, amount={}",
                request.getReference(), request.getAmount());

        ChargeResult result;
        try {
            result = restTemplate.postForObject(paymentServiceUrl + "/v1/payments/charge", request, ChargeResult.class);
        } catch (RestClientException e) {
            log.error("Payment service unavailable during charge: reference={}, error={}",
                    request.getReference(), e.getMessage());
            throw new ServiceUnavailableException("Payment service unavailable", e);
        }

        if (result == null) {
            throw new ServiceUnavailableException("Payment service returned an empty response");
        }
        log.info("Charge result: reference={}, success={}, transactionId={}",
                request.getReference(), result.isSuccess(), result.getTransactionId());
        return result;
    }

    public RefundResult refund(String transactionId, BigDecimal amount) {
        log.info("Calling payment service: POST /v1/payments/{}/refund - amount={}", transactionId, amount);

        try {
            RefundResult result = restTemplate.postForObject(
                    paymentServiceUrl + "/v1/payments/{transactionId}/refund",
                    RefundRequest.builder().amount(amount).build(),
                    RefundResult.class,
                    transactionId);
            if (result == null) {
                return RefundResult.failed(transactionId, "Payment service returned an empty response");
            }
            return result;
        } catch (RestClientException e) {
            log.error("Refund request failed: transactionId={}, error={}", transactionId, e.getMessage());
            return RefundResult.failed(transactionId, "Payment service unavailable: " + e.getMessage());
        }
    }
}
