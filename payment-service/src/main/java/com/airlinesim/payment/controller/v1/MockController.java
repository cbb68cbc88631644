package com.airlinesim.payment.controller.v1;

import com.airlinesim.payment.constants.PaymentConstants;
import com.airlinesim.payment.dto.MockConfiguration;
import com.airlinesim.payment.service.MockConfigurationService;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Runtime control of the gateway stub for end-to-end scenarios.
 *
 * WARNING: This endpoint should be disabled or secured outside test environments.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/v1/mock")
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class MockController {

    MockConfigurationService mockConfigService;

    @GetMapping("/config")
    public ResponseEntity<MockConfiguration> getConfiguration() {
        return ResponseEntity.ok(mockConfigService.getConfiguration());
    }

    @PutMapping("/config")
    public ResponseEntity<MockConfiguration> updateConfiguration(@RequestBody MockConfiguration config) {
        log.info("Updating mock configuration: {}", config);
        return ResponseEntity.ok(mockConfigService.updateConfiguration(config));
    }

    @PostMapping("/reset")
    public ResponseEntity<MockConfiguration> resetConfiguration() {
        log.info("Resetting mock configuration to defaults");
        return ResponseEntity.ok(mockConfigService.reset());
    }

    @PostMapping("/force-approve")
    public ResponseEntity<Map<String, String>> forceApprove() {
        return force(PaymentConstants.OUTCOME_APPROVE, "All charges and refunds will now be approved instantly");
    }

    @PostMapping("/force-decline")
    public ResponseEntity<Map<String, String>> forceDecline() {
        return force(PaymentConstants.OUTCOME_DECLINE, "All charges and refunds will now be declined instantly");
    }

    private ResponseEntity<Map<String, String>> force(String outcome, String message) {
        mockConfigService.updateConfiguration(
                MockConfiguration.builder()
                        .forcedOutcome(outcome)
                        .skipDelay(true)
                        .build()
        );
        return ResponseEntity.ok(Map.of(
                "status", "configured",
                "message", message
        ));
    }
}
