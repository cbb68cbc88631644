package com.airlinesim.booking.service;

import com.airlinesim.booking.constants.BookingConstants;
import com.airlinesim.booking.dto.BaggageEntry;
import com.airlinesim.booking.dto.BaggageRequest;
import com.airlinesim.booking.enums.BaggageStatus;
import com.airlinesim.booking.enums.BookingStatus;
import com.airlinesim.booking.exception.BookingValidationException;
import com.airlinesim.booking.exception.InvalidBookingStateException;
import com.airlinesim.booking.exception.NotFoundException;
import com.airlinesim.booking.mapper.BookingMapper;
import com.airlinesim.booking.model.BaggageItem;
import com.airlinesim.booking.model.Booking;
import com.airlinesim.booking.model.Passenger;
import com.airlinesim.booking.repository.BaggageItemRepository;
import com.airlinesim.booking.repository.BookingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

/**
 * Attaches one baggage item to a locked booking. A tracking number collision surfaces as
 * {@link org.springframework.dao.DataIntegrityViolationException} from the flush.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BaggagePersister {

    private static final Set<BookingStatus> BAGGAGE_ALLOWED = Set.of(BookingStatus.CONFIRMED, BookingStatus.CHECKED_IN);

    private final BookingRepository bookingRepository;
    private final BaggageItemRepository baggageItemRepository;
    private final Clock clock;

    @Transactional
    public BaggageEntry persist(String confirmationNumber, BaggageRequest request, String trackingNumber) {
        Booking booking = bookingRepository.findByConfirmationNumberForUpdate(confirmationNumber)
                .orElseThrow(() -> NotFoundException.booking(confirmationNumber));
        if (!BAGGAGE_ALLOWED.contains(booking.getStatus())) {
            throw new InvalidBookingStateException(booking.getConfirmationNumber(), booking.getStatus(), "add baggage to");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        BaggageItem item = BaggageItem.builder()
                .trackingNumber(trackingNumber)
                .passenger(selectPassenger(booking, request.getPassengerIndex()))
                .type(request.getType())
                .weight(request.getWeight())
                .status(BaggageStatus.CHECKED_IN)
                .createdAt(now)
                .updatedAt(now)
                .build();
        booking.addBaggageItem(item);
        item = baggageItemRepository.saveAndFlush(item);

        log.info("Added baggage: booking={}, tracking={}, type={}, weight={}",
                booking.getConfirmationNumber(), item.getTrackingNumber(), item.getType(), item.getWeight());
        return BookingMapper.toBaggageEntry(item);
    }

    private Passenger selectPassenger(Booking booking, Integer passengerIndex) {
        List<Passenger> passengers = booking.getPassengers();
        int index = passengerIndex != null ? passengerIndex : 0;
        if (index < 0 || index >= passengers.size()) {
            throw new BookingValidationException(BookingConstants.ERROR_INVALID_BAGGAGE,
                    "Passenger index " + index + " is out of range for booking " + booking.getConfirmationNumber());
        }
        return passengers.get(index);
    }
}
