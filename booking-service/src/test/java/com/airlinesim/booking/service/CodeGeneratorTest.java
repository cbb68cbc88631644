package com.airlinesim.booking.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CodeGenerator Unit Tests")
class CodeGeneratorTest {

    private final CodeGenerator codeGenerator = new CodeGenerator(new Random(42));

    @Test
    @DisplayName("Confirmation numbers are six upper-case alphanumerics")
    void generateConfirmationNumber_Format() {
        for (int i = 0; i < 1000; i++) {
            assertThat(codeGenerator.generateConfirmationNumber()).matches("[A-Z0-9]{6}");
        }
    }

    @Test
    @DisplayName("Confirmation numbers do not repeat within a seeded run")
    void generateConfirmationNumber_SeededRun_NoDuplicates() {
        Set<String> codes = new HashSet<>();
        for (int i = 0; i < 1_000; i++) {
            codes.add(codeGenerator.generateConfirmationNumber());
        }
        assertThat(codes).hasSize(1_000);
    }

    @Test
    @DisplayName("Tracking numbers are three letters and six digits")
    void generateTrackingNumber_Format() {
        for (int i = 0; i < 1000; i++) {
            assertThat(codeGenerator.generateTrackingNumber()).matches("[A-Z]{3}[0-9]{6}");
        }
    }

    @Test
    @DisplayName("Boarding payload embeds the confirmation number")
    void generateBoardingQrPayload_Format() {
        assertThat(codeGenerator.generateBoardingQrPayload("ABC123")).matches("QR-ABC123-[0-9]+");
    }

    @Test
    @DisplayName("Same seed gives the same codes")
    void generate_SeededRandom_Deterministic() {
        CodeGenerator first = new CodeGenerator(new Random(7));
        CodeGenerator second = new CodeGenerator(new Random(7));

        assertThat(first.generateConfirmationNumber()).isEqualTo(second.generateConfirmationNumber());
        assertThat(first.generateTrackingNumber()).isEqualTo(second.generateTrackingNumber());
    }
}
