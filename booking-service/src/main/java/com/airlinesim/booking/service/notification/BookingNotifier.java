package com.airlinesim.booking.service.notification;

import com.airlinesim.booking.dto.BoardingPass;
import com.airlinesim.booking.dto.BookingEntry;
import com.airlinesim.booking.dto.FlightEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Fire-and-forget delivery of booking notifications. Failures are logged and never reach the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BookingNotifier {

    private final NotificationSender notificationSender;

    @Async
    public void bookingConfirmed(BookingEntry booking, FlightEntry flight, String email) {
        try {
            if (!notificationSender.sendBookingConfirmation(booking, flight, email)) {
                log.warn("Booking confirmation not sent: booking={}", booking.getConfirmationNumber());
            }
        } catch (RuntimeException e) {
            log.error("Booking confirmation failed: booking={}, error={}", booking.getConfirmationNumber(), e.getMessage(), e);
        }
    }

    @Async
    public void checkInCompleted(BookingEntry booking, BoardingPass boardingPass, String email) {
        try {
            if (!notificationSender.sendCheckInConfirmation(booking, boardingPass, email)) {
                log.warn("Check-in confirmation not sent: booking={}", booking.getConfirmationNumber());
            }
        } catch (RuntimeException e) {
            log.error("Check-in confirmation failed: booking={}, error={}", booking.getConfirmationNumber(), e.getMessage(), e);
        }
    }
}
