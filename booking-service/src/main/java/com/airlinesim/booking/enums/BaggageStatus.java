package com.airlinesim.booking.enums;

import lombok.Getter;

@Getter
public enum BaggageStatus {
    CHECKED_IN("Check-in Counter"),
    IN_TRANSIT("In Transit to Aircraft"),
    LOADED("Loaded on Aircraft"),
    DELIVERED("Delivered to Baggage Claim"),
    LOST("Lost - Under Investigation");

    private final String location;

    BaggageStatus(String location) {
        this.location = location;
    }

    public boolean isTerminal() {
        return this == DELIVERED || this == LOST;
    }
}
