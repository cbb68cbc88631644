package com.airlinesim.payment.validator;

import com.airlinesim.payment.constants.PaymentConstants;
import com.airlinesim.payment.dto.ChargeRequest;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.YearMonth;
import java.util.Optional;

public final class CardValidator {

    private CardValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Returns the first problem found with the charge request, or empty when it can be sent for authorization.
     * A card is usable through the last day of its expiry month.
     */
    public static Optional<String> findViolation(ChargeRequest request, YearMonth currentMonth) {
        if (request == null) {
            return Optional.of("request missing");
        }
        if (request.getAmount() == null || request.getAmount().compareTo(BigDecimal.ZERO) <= 0) {
            return Optional.of("amount not positive");
        }
        if (!isDigits(request.getCardNumber(),
                PaymentConstants.MIN_CARD_NUMBER_LENGTH, PaymentConstants.MAX_CARD_NUMBER_LENGTH)) {
            return Optional.of("card number length");
        }
        if (!isDigits(request.getCvv(), PaymentConstants.MIN_CVV_LENGTH, PaymentConstants.MAX_CVV_LENGTH)) {
            return Optional.of("cvv length");
        }
        YearMonth expiry = toExpiry(request.getExpiryMonth(), request.getExpiryYear());
        if (expiry == null) {
            return Optional.of("expiry malformed");
        }
        if (expiry.isBefore(currentMonth)) {
            return Optional.of("card expired");
        }
        return Optional.empty();
    }

    public static String lastFour(String cardNumber) {
        if (cardNumber == null || cardNumber.length() < 4) {
            return null;
        }
        return cardNumber.substring(cardNumber.length() - 4);
    }

    private static boolean isDigits(String value, int minLength, int maxLength) {
        if (value == null) {
            return false;
        }
        String trimmed = value.replace(" ", "");
        if (trimmed.length() < minLength || trimmed.length() > maxLength) {
            return false;
        }
        for (int i = 0; i < trimmed.length(); i++) {
            if (!Character.isDigit(trimmed.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static YearMonth toExpiry(Integer month, Integer year) {
        if (month == null || year == null) {
            return null;
        }
        int fullYear = year < 100 ? 2000 + year : year;
        try {
            return YearMonth.of(fullYear, month);
        } catch (DateTimeException e) {
            return null;
        }
    }
}
