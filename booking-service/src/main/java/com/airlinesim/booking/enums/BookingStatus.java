package com.airlinesim.booking.enums;

/**
 * Booking lifecycle. PENDING is only used while a booking is being assembled;
 * persisted bookings start at CONFIRMED.
 */
public enum BookingStatus {
    PENDING,
    CONFIRMED,
    CHECKED_IN,
    COMPLETED,
    CANCELLED;

    public boolean canTransitionTo(BookingStatus target) {
        return switch (this) {
            case PENDING -> target == CONFIRMED || target == CANCELLED;
            case CONFIRMED -> target == CHECKED_IN || target == CANCELLED;
            case CHECKED_IN -> target == COMPLETED;
            case COMPLETED, CANCELLED -> false;
        };
    }
}
