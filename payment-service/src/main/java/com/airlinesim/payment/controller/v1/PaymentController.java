package com.airlinesim.payment.controller.v1;

import com.airlinesim.payment.dto.ChargeRequest;
import com.airlinesim.payment.dto.ChargeResult;
import com.airlinesim.payment.dto.PaymentEntry;
import com.airlinesim.payment.dto.RefundRequest;
import com.airlinesim.payment.dto.RefundResult;
import com.airlinesim.payment.service.PaymentService;
import jakarta.validation.Valid;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Gateway endpoints. Declines are returned with 200 and {@code success=false}.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/v1/payments")
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class PaymentController {

    PaymentService paymentService;

    @PostMapping("/charge")
    public ResponseEntity<ChargeResult> charge(@Valid @RequestBody ChargeRequest request) {
        log.info("POST /v1/payments/charge - reference={}", request.getReference());
        return ResponseEntity.ok(paymentService.charge(request));
    }

    @PostMapping("/{transactionId}/refund")
    public ResponseEntity<RefundResult> refund(
            @PathVariable String transactionId,
            @Valid @RequestBody RefundRequest request) {
        log.info("POST /v1/payments/{}/refund - amount={}", transactionId, request.getAmount());
        return ResponseEntity.ok(paymentService.refund(transactionId, request.getAmount()));
    }

    @GetMapping("/{transactionId}")
    public ResponseEntity<PaymentEntry> findById(@PathVariable String transactionId) {
        log.debug("GET /v1/payments/{}", transactionId);

        return paymentService.findByTransactionId(transactionId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
