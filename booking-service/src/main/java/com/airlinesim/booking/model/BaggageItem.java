package com.airlinesim.booking.model;

import com.airlinesim.booking.enums.BaggageStatus;
import com.airlinesim.booking.enums.BaggageType;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "baggage_items")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BaggageItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "tracking_number", nullable = false, unique = true, length = 9)
    String trackingNumber;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "booking_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    Booking booking;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "passenger_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    Passenger passenger;

    @Enumerated(EnumType.STRING)
    @Column(name = "baggage_type", nullable = false, length = 20)
    BaggageType type;

    @Column(name = "weight_kg", nullable = false, precision = 5, scale = 2)
    BigDecimal weight;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    BaggageStatus status = BaggageStatus.CHECKED_IN;

    @Column(name = "created_at", updatable = false)
    LocalDateTime createdAt;

    @Column(name = "updated_at")
    LocalDateTime updatedAt;
}
