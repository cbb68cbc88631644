package com.airlinesim.booking.model;

import com.airlinesim.booking.enums.BookingStatus;
import com.airlinesim.booking.enums.PaymentStatus;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "bookings", indexes = {
        @Index(name = "idx_booking_user", columnList = "user_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class Booking {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "confirmation_number", nullable = false, unique = true, length = 6)
    String confirmationNumber;

    @Column(name = "user_id", nullable = false, length = 64)
    String userId;

    @Column(name = "flight_number", nullable = false, length = 10)
    String flightNumber;

    @Column(name = "flight_date", nullable = false)
    LocalDate flightDate;

    @Column(name = "scheduled_departure", nullable = false)
    LocalDateTime scheduledDeparture;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    BookingStatus status = BookingStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    @Builder.Default
    PaymentStatus paymentStatus = PaymentStatus.PENDING;

    @Column(name = "total_amount", nullable = false, precision = 10, scale = 2)
    BigDecimal totalAmount;

    @Column(name = "payment_transaction_id", length = 64)
    String paymentTransactionId;

    @Column(name = "contact_email")
    String contactEmail;

    @Column(name = "boarding_pass_code", length = 64)
    String boardingPassCode;

    @OneToMany(mappedBy = "booking", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @Builder.Default
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    List<Passenger> passengers = new ArrayList<>();

    @OneToMany(mappedBy = "booking", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @Builder.Default
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    List<BaggageItem> baggageItems = new ArrayList<>();

    @Column(name = "created_at", updatable = false)
    LocalDateTime createdAt;

    @Column(name = "updated_at")
    LocalDateTime updatedAt;

    public void addPassenger(Passenger passenger) {
        passenger.setBooking(this);
        passengers.add(passenger);
    }

    public void addBaggageItem(BaggageItem item) {
        item.setBooking(this);
        baggageItems.add(item);
    }
}
