package com.airlinesim.booking.enums;

public enum BaggageType {
    CARRY_ON,
    CHECKED,
    OVERSIZED,
    SPECIAL
}
