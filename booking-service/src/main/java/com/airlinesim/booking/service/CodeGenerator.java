package com.airlinesim.booking.service;

import com.airlinesim.booking.constants.BookingConstants;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Confirmation numbers, baggage tracking numbers and boarding pass payloads.
 * Uniqueness is enforced by the database; callers retry on collision.
 */
@Component
public class CodeGenerator {

    private final Random random;

    public CodeGenerator(Random bookingRandom) {
        this.random = bookingRandom;
    }

    public String generateConfirmationNumber() {
        return randomChars(BookingConstants.CONFIRMATION_ALPHABET, BookingConstants.CONFIRMATION_NUMBER_LENGTH);
    }

    /**
     * Three letters followed by six digits, e.g. {@code KQZ048213}.
     */
    public String generateTrackingNumber() {
        StringBuilder sb = new StringBuilder(randomChars(BookingConstants.TRACKING_LETTERS,
                BookingConstants.TRACKING_LETTER_COUNT));
        for (int i = 0; i < BookingConstants.TRACKING_DIGIT_COUNT; i++) {
            sb.append(random.nextInt(10));
        }
        return sb.toString();
    }

    public String generateBoardingQrPayload(String confirmationNumber) {
        return BookingConstants.QR_PREFIX + confirmationNumber + "-" + Long.toUnsignedString(random.nextLong());
    }

    private String randomChars(String alphabet, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
        }
        return sb.toString();
    }
}
