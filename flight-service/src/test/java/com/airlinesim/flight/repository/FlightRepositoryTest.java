package com.airlinesim.flight.repository;

import com.airlinesim.flight.model.Flight;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@DisplayName("FlightRepository Tests")
class FlightRepositoryTest {

    private static final LocalDate DATE = LocalDate.of(2026, 11, 2);

    @Autowired
    private FlightRepository flightRepository;

    private Flight flight(String number) {
        return Flight.builder()
                .flightNumber(number)
                .airline("American Airlines")
                .originAirport("JFK")
                .destinationAirport("LAX")
                .scheduledDeparture(DATE.atTime(8, 0))
                .scheduledArrival(DATE.atTime(14, 0))
                .build();
    }

    @Test
    @DisplayName("Should derive the departure date and find the instance by it")
    void findByFlightNumberAndDepartureDate_Persisted_Found() {
        flightRepository.saveAndFlush(flight("AA123"));

        assertThat(flightRepository.findByFlightNumberAndDepartureDate("AA123", DATE)).isPresent();
        assertThat(flightRepository.findByFlightNumberAndDepartureDate("AA123", DATE.plusDays(1))).isEmpty();
    }

    @Test
    @DisplayName("Should enforce one instance per flight number and date")
    void save_DuplicateInstance_Rejected() {
        flightRepository.saveAndFlush(flight("AA123"));

        assertThatThrownBy(() -> flightRepository.saveAndFlush(flight("AA123")))
                .isInstanceOf(DataIntegrityViolationException.class);
    }
}
