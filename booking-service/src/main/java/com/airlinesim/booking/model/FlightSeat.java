package com.airlinesim.booking.model;

import com.airlinesim.booking.enums.SeatClass;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;

/**
 * One cell of a flight instance's seat map. {@code confirmationNumber} is set while a booking holds the seat.
 */
@Entity
@Table(name = "flight_seats", uniqueConstraints = {
        @UniqueConstraint(name = "uk_flight_seat", columnNames = {"flight_number", "flight_date", "seat_number"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightSeat {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "flight_number", nullable = false, length = 10)
    String flightNumber;

    @Column(name = "flight_date", nullable = false)
    LocalDate flightDate;

    @Column(name = "seat_number", nullable = false, length = 4)
    String seatNumber;

    @Column(name = "seat_row", nullable = false)
    int rowNumber;

    @Column(name = "seat_letter", nullable = false, length = 1)
    String seatLetter;

    @Enumerated(EnumType.STRING)
    @Column(name = "seat_class", nullable = false, length = 20)
    SeatClass seatClass;

    @Column(name = "available", nullable = false)
    boolean available;

    @Column(name = "confirmation_number", length = 6)
    String confirmationNumber;
}
