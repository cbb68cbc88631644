package com.airlinesim.booking.service.notification;

import com.airlinesim.booking.dto.BoardingPass;
import com.airlinesim.booking.dto.BookingEntry;
import com.airlinesim.booking.dto.FlightEntry;

/**
 * Outbound customer messages. Returns {@code false} when the message could not be handed off.
 */
public interface NotificationSender {

    boolean sendBookingConfirmation(BookingEntry booking, FlightEntry flight, String email);

    boolean sendCheckInConfirmation(BookingEntry booking, BoardingPass boardingPass, String email);
}
