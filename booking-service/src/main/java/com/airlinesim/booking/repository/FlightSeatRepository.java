package com.airlinesim.booking.repository;

import com.airlinesim.booking.enums.SeatClass;
import com.airlinesim.booking.model.FlightSeat;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface FlightSeatRepository extends JpaRepository<FlightSeat, Long> {

    boolean existsByFlightNumberAndFlightDate(String flightNumber, LocalDate flightDate);

    List<FlightSeat> findByFlightNumberAndFlightDateOrderByRowNumberAscSeatLetterAsc(
            String flightNumber, LocalDate flightDate);

    Optional<FlightSeat> findByFlightNumberAndFlightDateAndSeatNumber(
            String flightNumber, LocalDate flightDate, String seatNumber);

    List<FlightSeat> findByFlightNumberAndFlightDateAndConfirmationNumber(
            String flightNumber, LocalDate flightDate, String confirmationNumber);

    Optional<FlightSeat> findFirstByFlightNumberAndFlightDateAndSeatClassAndAvailableTrueOrderByRowNumberAscSeatLetterAsc(
            String flightNumber, LocalDate flightDate, SeatClass seatClass);

    /**
     * Claims a seat only if it is still free and of the requested class. Returns the number of rows claimed (0 or 1).
     */
    @Modifying
    @Transactional
    @Query("UPDATE FlightSeat s SET s.available = false, s.confirmationNumber = :confirmationNumber "
            + "WHERE s.flightNumber = :flightNumber AND s.flightDate = :flightDate "
            + "AND s.seatNumber = :seatNumber AND s.seatClass = :seatClass AND s.available = true")
    int reserveSeat(@Param("flightNumber") String flightNumber,
                    @Param("flightDate") LocalDate flightDate,
                    @Param("seatNumber") String seatNumber,
                    @Param("seatClass") SeatClass seatClass,
                    @Param("confirmationNumber") String confirmationNumber);

    @Modifying
    @Transactional
    @Query("UPDATE FlightSeat s SET s.available = true, s.confirmationNumber = null "
            + "WHERE s.flightNumber = :flightNumber AND s.flightDate = :flightDate "
            + "AND s.seatNumber = :seatNumber AND s.confirmationNumber = :confirmationNumber")
    int releaseSeat(@Param("flightNumber") String flightNumber,
                    @Param("flightDate") LocalDate flightDate,
                    @Param("seatNumber") String seatNumber,
                    @Param("confirmationNumber") String confirmationNumber);
}
