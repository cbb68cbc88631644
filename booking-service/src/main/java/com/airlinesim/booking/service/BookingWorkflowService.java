package com.airlinesim.booking.service;

import com.airlinesim.booking.client.ChargeRequestFactory;
import com.airlinesim.booking.client.FlightServiceClient;
import com.airlinesim.booking.client.PaymentServiceClient;
import com.airlinesim.booking.constants.BookingConstants;
import com.airlinesim.booking.dto.*;
import com.airlinesim.booking.enums.BookingStatus;
import com.airlinesim.booking.enums.PaymentStatus;
import com.airlinesim.booking.enums.SeatClass;
import com.airlinesim.booking.exception.*;
import com.airlinesim.booking.mapper.BookingMapper;
import com.airlinesim.booking.model.Booking;
import com.airlinesim.booking.model.Passenger;
import com.airlinesim.booking.repository.BookingRepository;
import com.airlinesim.booking.service.notification.BookingNotifier;
import com.airlinesim.booking.service.seat.SeatInventoryService;
import com.airlinesim.booking.util.StringUtils;
import com.airlinesim.booking.validator.BookingValidator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Booking lifecycle: create, check in, cancel and complete.
 * <p>
 * The card is charged before the booking transaction opens. Every failure after a successful
 * charge is compensated with a refund.
 */
@Service
@Slf4j
public class BookingWorkflowService {

    private final BookingRepository bookingRepository;
    private final BookingPersister bookingPersister;
    private final SeatInventoryService seatInventoryService;
    private final FareCalculator fareCalculator;
    private final CodeGenerator codeGenerator;
    private final FlightServiceClient flightServiceClient;
    private final PaymentServiceClient paymentServiceClient;
    private final ChargeRequestFactory chargeRequestFactory;
    private final BookingNotifier bookingNotifier;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final int maxConfirmationAttempts;
    private final int checkInWindowHours;
    private final int boardingOffsetMinutes;

    public BookingWorkflowService(
            BookingRepository bookingRepository,
            BookingPersister bookingPersister,
            SeatInventoryService seatInventoryService,
            FareCalculator fareCalculator,
            CodeGenerator codeGenerator,
            FlightServiceClient flightServiceClient,
            PaymentServiceClient paymentServiceClient,
            ChargeRequestFactory chargeRequestFactory,
            BookingNotifier bookingNotifier,
            MeterRegistry meterRegistry,
            Clock clock,
            @Value("${booking.confirmation.max-attempts:5}") int maxConfirmationAttempts,
            @Value("${booking.check-in.window-hours:24}") int checkInWindowHours,
            @Value("${booking.check-in.boarding-offset-minutes:30}") int boardingOffsetMinutes) {
        this.bookingRepository = bookingRepository;
        this.bookingPersister = bookingPersister;
        this.seatInventoryService = seatInventoryService;
        this.fareCalculator = fareCalculator;
        this.codeGenerator = codeGenerator;
        this.flightServiceClient = flightServiceClient;
        this.paymentServiceClient = paymentServiceClient;
        this.chargeRequestFactory = chargeRequestFactory;
        this.bookingNotifier = bookingNotifier;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.maxConfirmationAttempts = maxConfirmationAttempts;
        this.checkInWindowHours = checkInWindowHours;
        this.boardingOffsetMinutes = boardingOffsetMinutes;
    }

    // ========== Create ==========

    public BookingConfirmation createBooking(BookingRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return doCreateBooking(request);
        } catch (BookingException e) {
            meterRegistry.counter(BookingConstants.METRIC_BOOKING_FAILED, BookingConstants.TAG_REASON, e.getErrorCode()).increment();
            throw e;
        } finally {
            sample.stop(meterRegistry.timer(BookingConstants.METRIC_CREATE_DURATION));
        }
    }

    private BookingConfirmation doCreateBooking(BookingRequest request) {
        BookingValidator.validateBookingRequest(request);

        log.info("Creating booking: user={}, flight={}, date={}, passengers={}",
                request.getUserId(), request.getFlightNumber(), request.getFlightDate(), request.getPassengers().size());

        FlightEntry flight = resolveFlight(request.getFlightNumber(), request.getFlightDate());
        ensureBookable(flight);

        seatInventoryService.ensureSeatMap(flight);
        List<SeatClass> seatClasses = new ArrayList<>();
        for (PassengerRequest passenger : request.getPassengers()) {
            seatClasses.add(passenger.getSeatClass());
        }
        List<String> selectedSeats = request.getSelectedSeats() != null ? request.getSelectedSeats() : List.of();
        for (int i = 0; i < selectedSeats.size(); i++) {
            seatInventoryService.checkSelectable(flight, selectedSeats.get(i), seatClasses.get(i));
        }

        BigDecimal totalAmount = fareCalculator.priceFor(seatClasses);

        ChargeResult charge = chargePayment(request, flight, totalAmount);

        Booking booking;
        try {
            booking = persistWithRetry(request, flight, totalAmount, charge.getTransactionId());
        } catch (BookingException e) {
            compensate(charge.getTransactionId(), totalAmount, e.getErrorCode());
            throw e;
        } catch (RuntimeException e) {
            log.error("Booking persistence failed: flight={}, user={}, error={}",
                    flight.getFlightNumber(), request.getUserId(), e.getMessage(), e);
            compensate(charge.getTransactionId(), totalAmount, BookingConstants.ERROR_PERSISTENCE_FAILED);
            throw BookingPersistenceException.persistenceFailed(e);
        }

        meterRegistry.counter(BookingConstants.METRIC_BOOKING_CREATED).increment();
        log.info("Booking confirmed: confirmation={}, flight={}, total={}",
                booking.getConfirmationNumber(), booking.getFlightNumber(), booking.getTotalAmount());

        if (StringUtils.hasText(booking.getContactEmail())) {
            BookingEntry entry = BookingMapper.toEntry(booking);
            String email = booking.getContactEmail();
            notifyQuietly(booking.getConfirmationNumber(), () -> bookingNotifier.bookingConfirmed(entry, flight, email));
        }
        return BookingMapper.toConfirmation(booking);
    }

    // ========== Check-in ==========

    @Transactional
    public BoardingPass checkIn(String confirmationNumber) {
        Booking booking = lockBookingOrThrow(confirmationNumber);
        FlightEntry flight = resolveFlight(booking.getFlightNumber(), booking.getFlightDate());

        if (booking.getStatus() == BookingStatus.CHECKED_IN) {
            log.info("Booking already checked in, reissuing boarding pass: confirmation={}", booking.getConfirmationNumber());
            return boardingPassFor(booking, flight);
        }
        if (!booking.getStatus().canTransitionTo(BookingStatus.CHECKED_IN)) {
            throw new InvalidBookingStateException(booking.getConfirmationNumber(), booking.getStatus(), "check in");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime departure = flight.getScheduledDeparture();
        LocalDateTime opensAt = departure.minusHours(checkInWindowHours);
        if (now.isBefore(opensAt)) {
            throw new CheckInNotYetAvailableException(flight.getFlightNumber(), opensAt);
        }
        if (!now.isBefore(departure)) {
            throw BookingWindowException.checkInClosed(flight.getFlightNumber());
        }

        for (Passenger passenger : booking.getPassengers()) {
            if (passenger.getSeatNumber() == null) {
                seatInventoryService.assignFirstAvailable(flight, passenger.getSeatClass(), booking.getConfirmationNumber())
                        .ifPresent(passenger::setSeatNumber);
            }
            passenger.setCheckedIn(true);
            passenger.setCheckInTime(now);
        }

        booking.setStatus(BookingStatus.CHECKED_IN);
        booking.setBoardingPassCode(codeGenerator.generateBoardingQrPayload(booking.getConfirmationNumber()));
        booking.setUpdatedAt(now);
        booking = bookingRepository.save(booking);

        meterRegistry.counter(BookingConstants.METRIC_BOOKING_CHECKIN).increment();
        log.info("Checked in: confirmation={}, flight={}, passengers={}",
                booking.getConfirmationNumber(), booking.getFlightNumber(), booking.getPassengers().size());

        BoardingPass boardingPass = boardingPassFor(booking, flight);
        if (StringUtils.hasText(booking.getContactEmail())) {
            BookingEntry entry = BookingMapper.toEntry(booking);
            String email = booking.getContactEmail();
            notifyQuietly(booking.getConfirmationNumber(), () -> bookingNotifier.checkInCompleted(entry, boardingPass, email));
        }
        return boardingPass;
    }

    // ========== Lookup ==========

    @Transactional(readOnly = true)
    public BookingEntry getBooking(String confirmationNumber) {
        return BookingMapper.toEntry(findBookingOrThrow(confirmationNumber));
    }

    @Transactional(readOnly = true)
    public List<BookingEntry> getBookingsForUser(String userId) {
        BookingValidator.validateUserId(userId);

        List<BookingEntry> result = new ArrayList<>();
        for (Booking booking : bookingRepository.findByUserIdOrderByCreatedAtDesc(userId.trim())) {
            result.add(BookingMapper.toEntry(booking));
        }
        return result;
    }

    // ========== Cancel / Complete ==========

    @Transactional
    public BookingEntry cancelBooking(String confirmationNumber) {
        Booking booking = lockBookingOrThrow(confirmationNumber);
        if (!booking.getStatus().canTransitionTo(BookingStatus.CANCELLED)) {
            throw new InvalidBookingStateException(booking.getConfirmationNumber(), booking.getStatus(), "cancel");
        }

        for (Passenger passenger : booking.getPassengers()) {
            if (passenger.getSeatNumber() != null) {
                seatInventoryService.release(booking.getFlightNumber(), booking.getFlightDate(),
                        passenger.getSeatNumber(), booking.getConfirmationNumber());
            }
        }

        if (booking.getPaymentStatus() == PaymentStatus.COMPLETED && booking.getPaymentTransactionId() != null) {
            RefundResult refund = paymentServiceClient.refund(booking.getPaymentTransactionId(), booking.getTotalAmount());
            if (refund.isSuccess()) {
                booking.setPaymentStatus(PaymentStatus.REFUNDED);
            } else {
                log.error("Refund on cancellation failed, manual reconciliation required: confirmation={}, transactionId={}, error={}",
                        booking.getConfirmationNumber(), booking.getPaymentTransactionId(), refund.getErrorMessage());
            }
        }

        booking.setStatus(BookingStatus.CANCELLED);
        booking.setUpdatedAt(LocalDateTime.now(clock));
        booking = bookingRepository.save(booking);
        log.info("Cancelled booking: confirmation={}, paymentStatus={}", booking.getConfirmationNumber(), booking.getPaymentStatus());
        return BookingMapper.toEntry(booking);
    }

    @Transactional
    public BookingEntry completeBooking(String confirmationNumber) {
        Booking booking = lockBookingOrThrow(confirmationNumber);
        if (!booking.getStatus().canTransitionTo(BookingStatus.COMPLETED)) {
            throw new InvalidBookingStateException(booking.getConfirmationNumber(), booking.getStatus(), "complete");
        }

        booking.setStatus(BookingStatus.COMPLETED);
        booking.setUpdatedAt(LocalDateTime.now(clock));
        booking = bookingRepository.save(booking);
        log.info("Completed booking: confirmation={}", booking.getConfirmationNumber());
        return BookingMapper.toEntry(booking);
    }

    // ============ Private Methods ============

    private FlightEntry resolveFlight(String flightNumber, LocalDate flightDate) {
        String normalized = StringUtils.normalizeCode(flightNumber);
        return flightServiceClient.getFlight(normalized, flightDate)
                .orElseThrow(() -> NotFoundException.flight(normalized, flightDate));
    }

    private void ensureBookable(FlightEntry flight) {
        if (!flight.getScheduledDeparture().isAfter(LocalDateTime.now(clock))) {
            throw BookingWindowException.flightDeparted(flight.getFlightNumber());
        }
        if (flight.getStatus() != null && !flight.getStatus().isBookable()) {
            throw BookingWindowException.flightNotBookable(flight.getFlightNumber(), flight.getStatus());
        }
    }

    private ChargeResult chargePayment(BookingRequest request, FlightEntry flight, BigDecimal amount) {
        String reference = "BOOKING-" + flight.getFlightNumber() + "-" + request.getFlightDate() + "-" + request.getUserId().trim();
        ChargeResult charge = paymentServiceClient.charge(chargeRequestFactory.create(request.getPayment(), amount, reference));

        String outcome = charge.isSuccess() ? "approved" : "declined";
        meterRegistry.counter(BookingConstants.METRIC_PAYMENT_CHARGE, BookingConstants.TAG_OUTCOME, outcome).increment();

        if (!charge.isSuccess()) {
            log.warn("Payment declined: reference={}, reason={}", reference, charge.getErrorMessage());
            throw new PaymentDeclinedException(charge.getErrorMessage() != null
                    ? charge.getErrorMessage()
                    : "Payment was declined");
        }
        return charge;
    }

    private Booking persistWithRetry(BookingRequest request, FlightEntry flight, BigDecimal amount, String transactionId) {
        for (int attempt = 1; attempt <= maxConfirmationAttempts; attempt++) {
            String confirmationNumber = codeGenerator.generateConfirmationNumber();
            try {
                return bookingPersister.persist(confirmationNumber, request, flight, amount, transactionId);
            } catch (DataIntegrityViolationException e) {
                if (!bookingRepository.existsByConfirmationNumber(confirmationNumber)) {
                    throw e;
                }
                log.warn("Confirmation number collision: code={}, attempt={}", confirmationNumber, attempt);
            }
        }
        throw BookingPersistenceException.confirmationCollision(maxConfirmationAttempts);
    }

    private void compensate(String transactionId, BigDecimal amount, String reason) {
        RefundResult refund = paymentServiceClient.refund(transactionId, amount);
        if (refund.isSuccess()) {
            log.info("Compensating refund issued: transactionId={}, refundId={}, reason={}",
                    transactionId, refund.getRefundId(), reason);
        } else {
            log.error("Compensating refund failed, manual reconciliation required: transactionId={}, amount={}, reason={}, error={}",
                    transactionId, amount, reason, refund.getErrorMessage());
        }
    }

    private Booking findBookingOrThrow(String confirmationNumber) {
        BookingValidator.validateConfirmationNumber(confirmationNumber);
        String normalized = StringUtils.normalizeCode(confirmationNumber);
        return bookingRepository.findByConfirmationNumber(normalized)
                .orElseThrow(() -> NotFoundException.booking(normalized));
    }

    /**
     * Loads the booking under a row lock held until the surrounding transaction ends, so that
     * concurrent transitions on one booking run one after another.
     */
    private Booking lockBookingOrThrow(String confirmationNumber) {
        BookingValidator.validateConfirmationNumber(confirmationNumber);
        String normalized = StringUtils.normalizeCode(confirmationNumber);
        return bookingRepository.findByConfirmationNumberForUpdate(normalized)
                .orElseThrow(() -> NotFoundException.booking(normalized));
    }

    private void notifyQuietly(String confirmationNumber, Runnable notification) {
        try {
            notification.run();
        } catch (TaskRejectedException e) {
            log.warn("Notification not queued: booking={}, error={}", confirmationNumber, e.getMessage());
        }
    }

    private BoardingPass boardingPassFor(Booking booking, FlightEntry flight) {
        Passenger first = booking.getPassengers().get(0);
        LocalDateTime boardingTime = flight.getScheduledDeparture().minusMinutes(boardingOffsetMinutes);
        return BookingMapper.toBoardingPass(booking, first, flight, boardingTime);
    }
}
