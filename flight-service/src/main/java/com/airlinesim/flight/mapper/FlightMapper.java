package com.airlinesim.flight.mapper;

import com.airlinesim.flight.dto.FlightEntry;
import com.airlinesim.flight.dto.FlightStatusUpdate;
import com.airlinesim.flight.enums.FlightStatus;
import com.airlinesim.flight.model.Flight;
import com.airlinesim.flight.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

public final class FlightMapper {

    private FlightMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static FlightEntry toEntry(Flight flight) {
        if (flight == null) {
            return null;
        }

        return FlightEntry.builder()
                .flightNumber(flight.getFlightNumber())
                .airline(flight.getAirline())
                .originAirport(flight.getOriginAirport())
                .destinationAirport(flight.getDestinationAirport())
                .departureDate(flight.getDepartureDate())
                .scheduledDeparture(flight.getScheduledDeparture())
                .estimatedDeparture(flight.getEstimatedDeparture())
                .scheduledArrival(flight.getScheduledArrival())
                .estimatedArrival(flight.getEstimatedArrival())
                .status(flight.getStatus())
                .gate(flight.getGate())
                .terminal(flight.getTerminal())
                .aircraft(flight.getAircraft())
                .updatedAt(flight.getUpdatedAt())
                .build();
    }

    public static List<FlightEntry> toEntryList(List<Flight> flights) {
        if (flights == null || flights.isEmpty()) {
            return new ArrayList<>();
        }

        List<FlightEntry> result = new ArrayList<>(flights.size());
        for (Flight flight : flights) {
            result.add(toEntry(flight));
        }
        return result;
    }

    public static Flight toEntity(FlightEntry entry) {
        if (entry == null) {
            return null;
        }

        return Flight.builder()
                .flightNumber(StringUtils.normalizeCode(entry.getFlightNumber()))
                .airline(entry.getAirline().trim())
                .originAirport(StringUtils.normalizeCode(entry.getOriginAirport()))
                .destinationAirport(StringUtils.normalizeCode(entry.getDestinationAirport()))
                .departureDate(entry.getScheduledDeparture().toLocalDate())
                .scheduledDeparture(entry.getScheduledDeparture())
                .estimatedDeparture(entry.getEstimatedDeparture())
                .scheduledArrival(entry.getScheduledArrival())
                .estimatedArrival(entry.getEstimatedArrival())
                .status(entry.getStatus() != null ? entry.getStatus() : FlightStatus.SCHEDULED)
                .gate(entry.getGate())
                .terminal(entry.getTerminal())
                .aircraft(entry.getAircraft())
                .build();
    }

    public static void applyStatusUpdate(Flight flight, FlightStatusUpdate update) {
        if (flight == null || update == null) {
            return;
        }

        if (update.getStatus() != null) {
            flight.setStatus(update.getStatus());
        }
        if (update.getGate() != null) {
            flight.setGate(update.getGate());
        }
        if (update.getTerminal() != null) {
            flight.setTerminal(update.getTerminal());
        }
        if (update.getEstimatedDeparture() != null) {
            flight.setEstimatedDeparture(update.getEstimatedDeparture());
        }
        if (update.getEstimatedArrival() != null) {
            flight.setEstimatedArrival(update.getEstimatedArrival());
        }
    }
}
