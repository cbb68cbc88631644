package com.airlinesim.flight.model;

import com.airlinesim.flight.enums.FlightStatus;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One operated instance of a flight number, identified by its departure date.
 */
@Entity
@Table(name = "flights",
        uniqueConstraints = @UniqueConstraint(name = "uk_flight_number_date",
                columnNames = {"flight_number", "departure_date"}),
        indexes = {
                @Index(name = "idx_origin_destination", columnList = "origin_airport, destination_airport"),
                @Index(name = "idx_departure_date", columnList = "departure_date"),
                @Index(name = "idx_status", columnList = "status")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class Flight {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    Long id;

    @Column(name = "flight_number", nullable = false, length = 10)
    String flightNumber;

    @Column(name = "airline", nullable = false, length = 100)
    String airline;

    @Column(name = "origin_airport", nullable = false, length = 3)
    String originAirport;

    @Column(name = "destination_airport", nullable = false, length = 3)
    String destinationAirport;

    @Column(name = "departure_date", nullable = false)
    LocalDate departureDate;

    @Column(name = "scheduled_departure", nullable = false)
    LocalDateTime scheduledDeparture;

    @Column(name = "estimated_departure")
    LocalDateTime estimatedDeparture;

    @Column(name = "scheduled_arrival", nullable = false)
    LocalDateTime scheduledArrival;

    @Column(name = "estimated_arrival")
    LocalDateTime estimatedArrival;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, columnDefinition = "VARCHAR(20)")
    @Builder.Default
    FlightStatus status = FlightStatus.SCHEDULED;

    @Column(name = "gate", length = 10)
    String gate;

    @Column(name = "terminal", length = 10)
    String terminal;

    @Column(name = "aircraft", length = 50)
    String aircraft;

    @Column(name = "created_at", updatable = false)
    LocalDateTime createdAt;

    @Column(name = "updated_at")
    LocalDateTime updatedAt;

    @PrePersist
    protected void deriveDepartureDate() {
        departureDate = scheduledDeparture.toLocalDate();
    }
}
