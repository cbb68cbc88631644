package com.airlinesim.booking.service.seat;

import com.airlinesim.booking.model.FlightSeat;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Builds the initial seat map of a flight instance. Each seat starts free with probability
 * {@code initialAvailability}, which stands in for seats sold through other channels.
 */
@Component
@Slf4j
public class SeatMapFactory {

    private final Random random;
    @Getter
    private final SeatLayout layout;
    private final double initialAvailability;

    public SeatMapFactory(Random bookingRandom,
                          @Value("${booking.seat-map.rows:30}") int rows,
                          @Value("${booking.seat-map.letters:ABCDEF}") String letters,
                          @Value("${booking.seat-map.class-ranges:FIRST:1-2,BUSINESS:3-6,PREMIUM_ECONOMY:7-12,ECONOMY:13-30}") String classRanges,
                          @Value("${booking.seat-map.initial-availability:0.7}") double initialAvailability) {
        if (initialAvailability < 0.0 || initialAvailability > 1.0) {
            throw new IllegalArgumentException("Initial seat availability must be between 0 and 1");
        }
        this.random = bookingRandom;
        this.layout = SeatLayout.parse(rows, letters, classRanges);
        this.initialAvailability = initialAvailability;
    }

    public List<FlightSeat> generate(String flightNumber, LocalDate flightDate) {
        List<FlightSeat> seats = new ArrayList<>(layout.getRows() * layout.getLetters().length());

        for (int row = 1; row <= layout.getRows(); row++) {
            for (char letter : layout.getLetters().toCharArray()) {
                seats.add(FlightSeat.builder()
                        .flightNumber(flightNumber)
                        .flightDate(flightDate)
                        .seatNumber(row + String.valueOf(letter))
                        .rowNumber(row)
                        .seatLetter(String.valueOf(letter))
                        .seatClass(layout.classForRow(row))
                        .available(random.nextDouble() < initialAvailability)
                        .build());
            }
        }

        log.debug("Generated seat map: flight={}, date={}, seats={}", flightNumber, flightDate, seats.size());
        return seats;
    }
}
