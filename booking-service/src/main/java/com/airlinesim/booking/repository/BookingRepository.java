package com.airlinesim.booking.repository;

import com.airlinesim.booking.model.Booking;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface BookingRepository extends JpaRepository<Booking, Long> {

    Optional<Booking> findByConfirmationNumber(String confirmationNumber);

    /**
     * Row-locked lookup for status transitions. Concurrent callers wait until the holder commits
     * and then see its status.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Booking b WHERE b.confirmationNumber = :confirmationNumber")
    Optional<Booking> findByConfirmationNumberForUpdate(@Param("confirmationNumber") String confirmationNumber);

    boolean existsByConfirmationNumber(String confirmationNumber);

    List<Booking> findByUserIdOrderByCreatedAtDesc(String userId);
}
