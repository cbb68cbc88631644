package com.airlinesim.booking.enums;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public enum SeatClass {
    ECONOMY(new BigDecimal("1.0")),
    PREMIUM_ECONOMY(new BigDecimal("1.5")),
    BUSINESS(new BigDecimal("2.5")),
    FIRST(new BigDecimal("4.0"));

    private final BigDecimal multiplier;

    SeatClass(BigDecimal multiplier) {
        this.multiplier = multiplier;
    }
}
