package com.airlinesim.booking.service.notification;

import com.airlinesim.booking.constants.BookingConstants;
import com.airlinesim.booking.dto.BoardingPass;
import com.airlinesim.booking.dto.BookingEntry;
import com.airlinesim.booking.dto.FlightEntry;
import com.airlinesim.booking.dto.PassengerEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import com.airlinesim.booking.util.StringUtils;

import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders plain-text emails and logs them. Delivery is handled outside this service.
 */
@Component
@Slf4j
public class EmailNotificationSender implements NotificationSender {

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("MMMM dd, yyyy 'at' h:mm a", Locale.US);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("h:mm a", Locale.US);

    @Override
    public boolean sendBookingConfirmation(BookingEntry booking, FlightEntry flight, String email) {
        if (!StringUtils.hasText(email)) {
            return false;
        }

        log.info("Sending booking confirmation email to {} for booking {}", email, booking.getConfirmationNumber());
        log.debug("Email content:\n{}", renderBookingConfirmation(booking, flight));
        return true;
    }

    @Override
    public boolean sendCheckInConfirmation(BookingEntry booking, BoardingPass boardingPass, String email) {
        if (!StringUtils.hasText(email)) {
            return false;
        }

        log.info("Sending check-in confirmation email to {} for booking {}", email, booking.getConfirmationNumber());
        log.debug("Email content:\n{}", renderCheckInConfirmation(boardingPass));
        return true;
    }

    String renderBookingConfirmation(BookingEntry booking, FlightEntry flight) {
        StringBuilder sb = new StringBuilder();
        sb.append("Flight Booking Confirmation - ").append(booking.getConfirmationNumber()).append("\n\n");
        sb.append("Dear Customer,\n\nYour flight booking has been confirmed!\n\n");
        sb.append("Confirmation Number: ").append(booking.getConfirmationNumber()).append("\n\n");

        sb.append("FLIGHT INFORMATION:\n");
        sb.append("Flight: ").append(flight.getFlightNumber());
        if (flight.getAirline() != null) {
            sb.append(" - ").append(flight.getAirline());
        }
        sb.append("\n");
        sb.append("Route: ").append(flight.getOriginAirport()).append(" -> ").append(flight.getDestinationAirport()).append("\n");
        sb.append("Departure: ").append(flight.getScheduledDeparture().format(DATE_TIME)).append("\n");
        if (flight.getScheduledArrival() != null) {
            sb.append("Arrival: ").append(flight.getScheduledArrival().format(DATE_TIME)).append("\n");
        }
        if (flight.getGate() != null) {
            sb.append("Gate: ").append(flight.getGate()).append("\n");
        }
        if (flight.getTerminal() != null) {
            sb.append("Terminal: ").append(flight.getTerminal()).append("\n");
        }

        sb.append("\nPASSENGER INFORMATION:\n");
        for (PassengerEntry passenger : booking.getPassengers()) {
            sb.append("- ").append(passenger.getFirstName()).append(" ").append(passenger.getLastName())
                    .append(" (").append(passenger.getSeatClass()).append(") - Seat: ")
                    .append(passenger.getSeatNumber() != null ? passenger.getSeatNumber() : BookingConstants.NOT_ASSIGNED)
                    .append("\n");
        }

        sb.append("\nPAYMENT INFORMATION:\n");
        sb.append("Total Amount: $").append(booking.getTotalAmount().toPlainString()).append("\n");
        sb.append("Payment Status: ").append(booking.getPaymentStatus()).append("\n\n");
        sb.append("Online check-in opens 24 hours before departure.\n");
        return sb.toString();
    }

    String renderCheckInConfirmation(BoardingPass pass) {
        return "Check-in Complete!\n\n"
                + "Dear Customer,\n\nYou're all set for your flight!\n\n"
                + "DIGITAL BOARDING PASS:\n"
                + "Flight: " + pass.getFlightNumber() + "\n"
                + "Passenger: " + pass.getPassengerName() + "\n"
                + "Seat: " + pass.getSeatNumber() + "\n"
                + "Gate: " + pass.getGate() + "\n"
                + "Boarding Time: " + pass.getBoardingTime().format(TIME) + "\n"
                + "Boarding Code: " + pass.getQrCode() + "\n\n"
                + "Safe travels!\n";
    }
}
