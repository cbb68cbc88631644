package com.airlinesim.booking.dto;

import com.airlinesim.booking.enums.BookingStatus;
import com.airlinesim.booking.enums.PaymentStatus;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BookingConfirmation {

    String confirmationNumber;
    BookingStatus status;
    PaymentStatus paymentStatus;
    BigDecimal totalAmount;
    String flightNumber;
    LocalDate flightDate;
    List<PassengerEntry> passengers;
    LocalDateTime createdAt;
}
