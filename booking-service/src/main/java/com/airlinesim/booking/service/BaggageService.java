package com.airlinesim.booking.service;

import com.airlinesim.booking.constants.BookingConstants;
import com.airlinesim.booking.constants.ValidationMessages;
import com.airlinesim.booking.dto.BaggageEntry;
import com.airlinesim.booking.dto.BaggageRequest;
import com.airlinesim.booking.enums.BaggageStatus;
import com.airlinesim.booking.exception.BookingPersistenceException;
import com.airlinesim.booking.exception.BookingValidationException;
import com.airlinesim.booking.exception.NotFoundException;
import com.airlinesim.booking.mapper.BookingMapper;
import com.airlinesim.booking.model.BaggageItem;
import com.airlinesim.booking.model.Booking;
import com.airlinesim.booking.repository.BaggageItemRepository;
import com.airlinesim.booking.repository.BookingRepository;
import com.airlinesim.booking.util.StringUtils;
import com.airlinesim.booking.validator.BookingValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
public class BaggageService {

    private final BaggageItemRepository baggageItemRepository;
    private final BookingRepository bookingRepository;
    private final BaggagePersister baggagePersister;
    private final CodeGenerator codeGenerator;
    private final Clock clock;
    private final int maxTrackingAttempts;

    public BaggageService(BaggageItemRepository baggageItemRepository,
                          BookingRepository bookingRepository,
                          BaggagePersister baggagePersister,
                          CodeGenerator codeGenerator,
                          Clock clock,
                          @Value("${booking.confirmation.max-attempts:5}") int maxTrackingAttempts) {
        this.baggageItemRepository = baggageItemRepository;
        this.bookingRepository = bookingRepository;
        this.baggagePersister = baggagePersister;
        this.codeGenerator = codeGenerator;
        this.clock = clock;
        this.maxTrackingAttempts = maxTrackingAttempts;
    }

    /**
     * Adds baggage under a fresh tracking number, drawing a new one when the insert collides.
     * Runs outside a transaction so that each attempt commits or rolls back on its own.
     */
    public BaggageEntry addBaggage(String confirmationNumber, BaggageRequest request) {
        BookingValidator.validateConfirmationNumber(confirmationNumber);
        BookingValidator.validateBaggageRequest(request);
        String normalized = StringUtils.normalizeCode(confirmationNumber);

        for (int attempt = 1; attempt <= maxTrackingAttempts; attempt++) {
            String trackingNumber = codeGenerator.generateTrackingNumber();
            try {
                return baggagePersister.persist(normalized, request, trackingNumber);
            } catch (DataIntegrityViolationException e) {
                if (!baggageItemRepository.existsByTrackingNumber(trackingNumber)) {
                    throw e;
                }
                log.warn("Tracking number collision: code={}, attempt={}", trackingNumber, attempt);
            }
        }
        throw BookingPersistenceException.trackingNumberCollision(maxTrackingAttempts);
    }

    @Transactional(readOnly = true)
    public BaggageEntry trackBaggage(String trackingNumber) {
        return BookingMapper.toBaggageEntry(findBaggageOrThrow(trackingNumber));
    }

    /**
     * Moves baggage to a new status. DELIVERED and LOST are final.
     */
    @Transactional
    public BaggageEntry updateBaggageStatus(String trackingNumber, BaggageStatus status) {
        if (status == null) {
            throw new BookingValidationException(BookingConstants.ERROR_INVALID_BAGGAGE, ValidationMessages.BAGGAGE_STATUS_REQUIRED);
        }

        BaggageItem item = findBaggageOrThrow(trackingNumber);
        if (item.getStatus() == status) {
            return BookingMapper.toBaggageEntry(item);
        }
        if (item.getStatus().isTerminal()) {
            throw new BookingValidationException(BookingConstants.ERROR_INVALID_BAGGAGE,
                    "Baggage " + item.getTrackingNumber() + " is already " + item.getStatus());
        }

        BaggageStatus previous = item.getStatus();
        item.setStatus(status);
        item.setUpdatedAt(LocalDateTime.now(clock));
        item = baggageItemRepository.save(item);
        log.info("Updated baggage status: tracking={}, status={}->{}", item.getTrackingNumber(), previous, status);
        return BookingMapper.toBaggageEntry(item);
    }

    @Transactional(readOnly = true)
    public List<BaggageEntry> listBaggage(String confirmationNumber) {
        BookingValidator.validateConfirmationNumber(confirmationNumber);
        String normalized = StringUtils.normalizeCode(confirmationNumber);
        Booking booking = bookingRepository.findByConfirmationNumber(normalized)
                .orElseThrow(() -> NotFoundException.booking(normalized));

        List<BaggageEntry> result = new ArrayList<>(booking.getBaggageItems().size());
        for (BaggageItem item : booking.getBaggageItems()) {
            result.add(BookingMapper.toBaggageEntry(item));
        }
        return result;
    }

    // ============ Private Methods ============

    private BaggageItem findBaggageOrThrow(String trackingNumber) {
        BookingValidator.validateTrackingNumber(trackingNumber);
        String normalized = StringUtils.normalizeCode(trackingNumber);
        return baggageItemRepository.findByTrackingNumber(normalized)
                .orElseThrow(() -> NotFoundException.baggage(normalized));
    }
}
