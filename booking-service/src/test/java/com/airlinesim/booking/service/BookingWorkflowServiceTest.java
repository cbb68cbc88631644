package com.airlinesim.booking.service;

import com.airlinesim.booking.client.ChargeRequestFactory;
import com.airlinesim.booking.client.FlightServiceClient;
import com.airlinesim.booking.client.PaymentServiceClient;
import com.airlinesim.booking.dto.*;
import com.airlinesim.booking.enums.BookingStatus;
import com.airlinesim.booking.enums.FlightStatus;
import com.airlinesim.booking.enums.PaymentStatus;
import com.airlinesim.booking.enums.SeatClass;
import com.airlinesim.booking.exception.*;
import com.airlinesim.booking.model.Booking;
import com.airlinesim.booking.model.Passenger;
import com.airlinesim.booking.repository.BookingRepository;
import com.airlinesim.booking.service.notification.BookingNotifier;
import com.airlinesim.booking.service.seat.SeatInventoryService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("BookingWorkflowService Unit Tests")
class BookingWorkflowServiceTest {

    private static final LocalDate DATE = LocalDate.of(2026, 11, 2);
    private static final LocalDateTime DEPARTURE = DATE.atTime(10, 0);
    // 22 hours before departure: booking open, check-in open
    private static final Instant NOW = Instant.parse("2026-11-01T12:00:00Z");

    @Mock
    private BookingRepository bookingRepository;

    @Mock
    private BookingPersister bookingPersister;

    @Mock
    private SeatInventoryService seatInventoryService;

    @Mock
    private CodeGenerator codeGenerator;

    @Mock
    private FlightServiceClient flightServiceClient;

    @Mock
    private PaymentServiceClient paymentServiceClient;

    @Mock
    private BookingNotifier bookingNotifier;

    private SimpleMeterRegistry meterRegistry;
    private BookingWorkflowService workflowService;

    private FlightEntry flight;
    private BookingRequest validRequest;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        workflowService = createService(Clock.fixed(NOW, ZoneOffset.UTC));

        flight = FlightEntry.builder()
                .flightNumber("AA123")
                .airline("American Airlines")
                .originAirport("JFK")
                .destinationAirport("LAX")
                .departureDate(DATE)
                .scheduledDeparture(DEPARTURE)
                .scheduledArrival(DATE.atTime(16, 0))
                .status(FlightStatus.SCHEDULED)
                .gate("B12")
                .terminal("4")
                .build();

        validRequest = BookingRequest.builder()
                .flightNumber("AA123")
                .flightDate(DATE)
                .userId("user123")
                .passengers(new ArrayList<>(List.of(
                        passenger("Ada", "Lovelace", SeatClass.ECONOMY),
                        passenger("Alan", "Turing", SeatClass.PREMIUM_ECONOMY),
                        passenger("Grace", "Hopper", SeatClass.ECONOMY))))
                .selectedSeats(new ArrayList<>(List.of("14A", "8C")))
                .build();

        when(flightServiceClient.getFlight("AA123", DATE)).thenReturn(Optional.of(flight));
        when(codeGenerator.generateConfirmationNumber()).thenReturn("ABC123");
        when(codeGenerator.generateBoardingQrPayload(anyString())).thenAnswer(inv -> "QR-" + inv.getArgument(0) + "-42");
        when(paymentServiceClient.charge(any())).thenReturn(ChargeResult.builder()
                .success(true).transactionId("TXN_1").amount(new BigDecimal("1049.97")).build());
        when(paymentServiceClient.refund(anyString(), any())).thenReturn(RefundResult.builder()
                .success(true).transactionId("TXN_1").refundId("RFD_1").build());
        when(bookingPersister.persist(anyString(), any(), any(), any(), any()))
                .thenAnswer(inv -> persistedBooking(inv.getArgument(0), inv.getArgument(3), inv.getArgument(4)));
        when(bookingRepository.save(any(Booking.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private BookingWorkflowService createService(Clock clock) {
        return new BookingWorkflowService(
                bookingRepository,
                bookingPersister,
                seatInventoryService,
                new FareCalculator(new BigDecimal("299.99")),
                codeGenerator,
                flightServiceClient,
                paymentServiceClient,
                new ChargeRequestFactory("4111111111111111", 12, 2030, "123", "Demo Customer"),
                bookingNotifier,
                meterRegistry,
                clock,
                5,   // maxConfirmationAttempts
                24,  // checkInWindowHours
                30   // boardingOffsetMinutes
        );
    }

    private static PassengerRequest passenger(String first, String last, SeatClass seatClass) {
        return PassengerRequest.builder().firstName(first).lastName(last).seatClass(seatClass).build();
    }

    private Booking persistedBooking(String confirmationNumber, BigDecimal amount, String transactionId) {
        Booking booking = Booking.builder()
                .id(1L)
                .confirmationNumber(confirmationNumber)
                .userId("user123")
                .flightNumber("AA123")
                .flightDate(DATE)
                .scheduledDeparture(DEPARTURE)
                .status(BookingStatus.CONFIRMED)
                .paymentStatus(PaymentStatus.COMPLETED)
                .totalAmount(amount)
                .paymentTransactionId(transactionId)
                .contactEmail(validRequest.getContactEmail())
                .build();
        booking.addPassenger(Passenger.builder().firstName("Ada").lastName("Lovelace")
                .seatClass(SeatClass.ECONOMY).seatNumber("14A").build());
        booking.addPassenger(Passenger.builder().firstName("Alan").lastName("Turing")
                .seatClass(SeatClass.PREMIUM_ECONOMY).seatNumber("8C").build());
        booking.addPassenger(Passenger.builder().firstName("Grace").lastName("Hopper")
                .seatClass(SeatClass.ECONOMY).build());
        return booking;
    }

    private Booking storedBooking(BookingStatus status) {
        Booking booking = persistedBooking("ABC123", new BigDecimal("1049.97"), "TXN_1");
        booking.setStatus(status);
        when(bookingRepository.findByConfirmationNumber("ABC123")).thenReturn(Optional.of(booking));
        when(bookingRepository.findByConfirmationNumberForUpdate("ABC123")).thenReturn(Optional.of(booking));
        return booking;
    }

    private double counter(String name, String... tags) {
        return meterRegistry.counter(name, tags).count();
    }

    @Nested
    @DisplayName("Create Booking Tests")
    class CreateBookingTests {

        @Test
        @DisplayName("Should price, charge once and confirm the booking")
        void createBooking_Valid_Confirmed() {
            BookingConfirmation confirmation = workflowService.createBooking(validRequest);

            assertThat(confirmation.getConfirmationNumber()).isEqualTo("ABC123");
            assertThat(confirmation.getStatus()).isEqualTo(BookingStatus.CONFIRMED);
            assertThat(confirmation.getPaymentStatus()).isEqualTo(PaymentStatus.COMPLETED);
            assertThat(confirmation.getTotalAmount()).isEqualTo(new BigDecimal("1049.97"));
            assertThat(confirmation.getPassengers()).hasSize(3);

            ArgumentCaptor<ChargeRequest> charge = ArgumentCaptor.forClass(ChargeRequest.class);
            verify(paymentServiceClient, times(1)).charge(charge.capture());
            assertThat(charge.getValue().getAmount()).isEqualTo(new BigDecimal("1049.97"));
            assertThat(charge.getValue().getCardNumber()).isEqualTo("4111111111111111");

            verify(seatInventoryService).ensureSeatMap(flight);
            verify(seatInventoryService).checkSelectable(flight, "14A", SeatClass.ECONOMY);
            verify(seatInventoryService).checkSelectable(flight, "8C", SeatClass.PREMIUM_ECONOMY);
            verify(bookingPersister).persist(eq("ABC123"), eq(validRequest), eq(flight),
                    eq(new BigDecimal("1049.97")), eq("TXN_1"));
            verify(paymentServiceClient, never()).refund(anyString(), any());
            assertThat(counter("booking.created")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should reject a request without passengers before any side effect")
        void createBooking_NoPassengers_ValidationError() {
            validRequest.setPassengers(List.of());
            validRequest.setSelectedSeats(List.of());

            assertThatThrownBy(() -> workflowService.createBooking(validRequest))
                    .isInstanceOf(BookingValidationException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "INVALID_PASSENGERS");

            verifyNoInteractions(flightServiceClient, paymentServiceClient, bookingPersister);
            assertThat(counter("booking.failed", "reason", "INVALID_PASSENGERS")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should reject a seat selected twice")
        void createBooking_DuplicateSeat_ValidationError() {
            validRequest.setSelectedSeats(List.of("14A", "14a"));

            assertThatThrownBy(() -> workflowService.createBooking(validRequest))
                    .isInstanceOf(BookingValidationException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "INVALID_SEAT_SELECTION");
            verifyNoInteractions(paymentServiceClient);
        }

        @Test
        @DisplayName("Should reject more seats than passengers")
        void createBooking_TooManySeats_ValidationError() {
            validRequest.setSelectedSeats(List.of("14A", "14B", "14C", "14D"));

            assertThatThrownBy(() -> workflowService.createBooking(validRequest))
                    .hasFieldOrPropertyWithValue("errorCode", "INVALID_SEAT_SELECTION");
        }

        @Test
        @DisplayName("Should fail when the flight does not exist")
        void createBooking_UnknownFlight_NotFound() {
            when(flightServiceClient.getFlight("AA123", DATE)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> workflowService.createBooking(validRequest))
                    .isInstanceOf(NotFoundException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "FLIGHT_NOT_FOUND");
            verifyNoInteractions(paymentServiceClient);
        }

        @Test
        @DisplayName("Should refuse a flight that has already departed")
        void createBooking_Departed_NoCharge() {
            workflowService = createService(Clock.fixed(Instant.parse("2026-11-02T10:00:00Z"), ZoneOffset.UTC));

            assertThatThrownBy(() -> workflowService.createBooking(validRequest))
                    .isInstanceOf(BookingWindowException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "FLIGHT_DEPARTED");
            verifyNoInteractions(paymentServiceClient, bookingPersister);
        }

        @Test
        @DisplayName("Should refuse a cancelled flight")
        void createBooking_CancelledFlight_NotBookable() {
            flight.setStatus(FlightStatus.CANCELLED);

            assertThatThrownBy(() -> workflowService.createBooking(validRequest))
                    .hasFieldOrPropertyWithValue("errorCode", "FLIGHT_NOT_BOOKABLE");
            verifyNoInteractions(paymentServiceClient);
        }

        @Test
        @DisplayName("Should not charge when a selected seat is already taken")
        void createBooking_SeatTakenOnPrecheck_NoCharge() {
            doThrow(new SeatUnavailableException("AA123", "14A"))
                    .when(seatInventoryService).checkSelectable(flight, "14A", SeatClass.ECONOMY);

            assertThatThrownBy(() -> workflowService.createBooking(validRequest))
                    .isInstanceOf(SeatUnavailableException.class);
            verifyNoInteractions(paymentServiceClient);
        }

        @Test
        @DisplayName("Should not persist anything when payment is declined")
        void createBooking_Declined_NoBooking() {
            when(paymentServiceClient.charge(any())).thenReturn(ChargeResult.builder()
                    .success(false).errorMessage("Payment was declined by the bank").build());

            assertThatThrownBy(() -> workflowService.createBooking(validRequest))
                    .isInstanceOf(PaymentDeclinedException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "PAYMENT_DECLINED")
                    .hasMessage("Payment was declined by the bank");

            verifyNoInteractions(bookingPersister);
            verify(paymentServiceClient, never()).refund(anyString(), any());
            assertThat(counter("payment.charge", "outcome", "declined")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should not persist anything when the gateway is unreachable")
        void createBooking_GatewayDown_ServiceUnavailable() {
            when(paymentServiceClient.charge(any())).thenThrow(new ServiceUnavailableException("Payment service unavailable"));

            assertThatThrownBy(() -> workflowService.createBooking(validRequest))
                    .isInstanceOf(ServiceUnavailableException.class);
            verifyNoInteractions(bookingPersister);
        }

        @Test
        @DisplayName("Should retry with a fresh confirmation number after a collision")
        void createBooking_Collision_RetriesWithNewCode() {
            when(codeGenerator.generateConfirmationNumber()).thenReturn("AAAAAA", "BBBBBB");
            when(bookingRepository.existsByConfirmationNumber("AAAAAA")).thenReturn(true);
            doThrow(new DataIntegrityViolationException("uk_confirmation_number"))
                    .when(bookingPersister).persist(eq("AAAAAA"), any(), any(), any(), any());

            BookingConfirmation confirmation = workflowService.createBooking(validRequest);

            assertThat(confirmation.getConfirmationNumber()).isEqualTo("BBBBBB");
            verify(bookingPersister, times(2)).persist(anyString(), any(), any(), any(), any());
            verify(paymentServiceClient, times(1)).charge(any());
            verify(paymentServiceClient, never()).refund(anyString(), any());
        }

        @Test
        @DisplayName("Should give up after the configured attempts and refund")
        void createBooking_CollisionExhausted_Refunded() {
            when(bookingRepository.existsByConfirmationNumber("ABC123")).thenReturn(true);
            doThrow(new DataIntegrityViolationException("uk_confirmation_number"))
                    .when(bookingPersister).persist(anyString(), any(), any(), any(), any());

            assertThatThrownBy(() -> workflowService.createBooking(validRequest))
                    .isInstanceOf(BookingPersistenceException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "CONFIRMATION_COLLISION");

            verify(bookingPersister, times(5)).persist(anyString(), any(), any(), any(), any());
            verify(paymentServiceClient).refund("TXN_1", new BigDecimal("1049.97"));
        }

        @Test
        @DisplayName("Should refund and report a persistence failure after charging")
        void createBooking_PersistenceFails_Refunded() {
            doThrow(new IllegalStateException("connection reset"))
                    .when(bookingPersister).persist(anyString(), any(), any(), any(), any());

            assertThatThrownBy(() -> workflowService.createBooking(validRequest))
                    .isInstanceOf(BookingPersistenceException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "BOOKING_PERSISTENCE_FAILED");

            verify(paymentServiceClient).refund("TXN_1", new BigDecimal("1049.97"));
        }

        @Test
        @DisplayName("Should refund and surface a seat lost to a concurrent booking")
        void createBooking_SeatLostAfterCharge_RefundedAndUnavailable() {
            doThrow(new SeatUnavailableException("AA123", "14A"))
                    .when(bookingPersister).persist(anyString(), any(), any(), any(), any());

            assertThatThrownBy(() -> workflowService.createBooking(validRequest))
                    .isInstanceOf(SeatUnavailableException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "SEAT_UNAVAILABLE");

            verify(paymentServiceClient).refund("TXN_1", new BigDecimal("1049.97"));
        }

        @Test
        @DisplayName("Should still fail cleanly when the compensating refund fails")
        void createBooking_RefundFails_StillPersistenceError() {
            doThrow(new IllegalStateException("connection reset"))
                    .when(bookingPersister).persist(anyString(), any(), any(), any(), any());
            when(paymentServiceClient.refund(anyString(), any())).thenReturn(RefundResult.failed("TXN_1", "unavailable"));

            assertThatThrownBy(() -> workflowService.createBooking(validRequest))
                    .hasFieldOrPropertyWithValue("errorCode", "BOOKING_PERSISTENCE_FAILED");
        }

        @Test
        @DisplayName("Should notify only when a contact email is given")
        void createBooking_WithEmail_Notifies() {
            validRequest.setContactEmail("ada@example.com");

            workflowService.createBooking(validRequest);

            verify(bookingNotifier).bookingConfirmed(any(BookingEntry.class), eq(flight), eq("ada@example.com"));
        }

        @Test
        @DisplayName("Should not notify without a contact email")
        void createBooking_WithoutEmail_NoNotification() {
            workflowService.createBooking(validRequest);

            verifyNoInteractions(bookingNotifier);
        }

        @Test
        @DisplayName("A rejected notification does not fail a paid booking")
        void createBooking_NotifierRejected_StillConfirmed() {
            validRequest.setContactEmail("ada@example.com");
            doThrow(new TaskRejectedException("notification queue full"))
                    .when(bookingNotifier).bookingConfirmed(any(), any(), any());

            BookingConfirmation confirmation = workflowService.createBooking(validRequest);

            assertThat(confirmation.getConfirmationNumber()).isEqualTo("ABC123");
            verify(paymentServiceClient, never()).refund(anyString(), any());
        }
    }

    @Nested
    @DisplayName("Check-in Tests")
    class CheckInTests {

        @Test
        @DisplayName("Should refuse check-in before the window opens")
        void checkIn_TooEarly_ReportsOpeningTime() {
            storedBooking(BookingStatus.CONFIRMED);
            flight.setScheduledDeparture(LocalDateTime.of(2026, 11, 2, 13, 0)); // now + 25h

            assertThatThrownBy(() -> workflowService.checkIn("ABC123"))
                    .isInstanceOf(CheckInNotYetAvailableException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "CHECK_IN_NOT_YET_AVAILABLE")
                    .hasFieldOrPropertyWithValue("opensAt", LocalDateTime.of(2026, 11, 1, 13, 0));
        }

        @Test
        @DisplayName("Should refuse check-in once the flight has left")
        void checkIn_AfterDeparture_Closed() {
            storedBooking(BookingStatus.CONFIRMED);
            flight.setScheduledDeparture(LocalDateTime.of(2026, 11, 1, 12, 0));

            assertThatThrownBy(() -> workflowService.checkIn("ABC123"))
                    .hasFieldOrPropertyWithValue("errorCode", "CHECK_IN_CLOSED");
        }

        @Test
        @DisplayName("Should assign missing seats, mark passengers and issue a boarding pass")
        void checkIn_InWindow_Succeeds() {
            Booking booking = storedBooking(BookingStatus.CONFIRMED);
            when(seatInventoryService.assignFirstAvailable(flight, SeatClass.ECONOMY, "ABC123"))
                    .thenReturn(Optional.of("15C"));

            BoardingPass pass = workflowService.checkIn("ABC123");

            assertThat(booking.getStatus()).isEqualTo(BookingStatus.CHECKED_IN);
            assertThat(booking.getPassengers()).allMatch(Passenger::isCheckedIn);
            assertThat(booking.getPassengers().get(2).getSeatNumber()).isEqualTo("15C");
            assertThat(booking.getBoardingPassCode()).isEqualTo("QR-ABC123-42");

            assertThat(pass.getPassengerName()).isEqualTo("Ada Lovelace");
            assertThat(pass.getSeatNumber()).isEqualTo("14A");
            assertThat(pass.getGate()).isEqualTo("B12");
            assertThat(pass.getBoardingTime()).isEqualTo(DEPARTURE.minusMinutes(30));
            assertThat(pass.getQrCode()).isEqualTo("QR-ABC123-42");
            assertThat(counter("booking.checkin")).isEqualTo(1.0);
            assertThat(booking.getUpdatedAt()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
        }

        @Test
        @DisplayName("Should read the booking under a row lock")
        void checkIn_LocksBooking() {
            storedBooking(BookingStatus.CONFIRMED);

            workflowService.checkIn("abc123");

            verify(bookingRepository).findByConfirmationNumberForUpdate("ABC123");
            verify(bookingRepository, never()).findByConfirmationNumber(anyString());
        }

        @Test
        @DisplayName("A rejected notification does not undo the check-in")
        void checkIn_NotifierRejected_StillCheckedIn() {
            Booking booking = storedBooking(BookingStatus.CONFIRMED);
            booking.setContactEmail("ada@example.com");
            doThrow(new TaskRejectedException("notification queue full"))
                    .when(bookingNotifier).checkInCompleted(any(), any(), any());

            BoardingPass pass = workflowService.checkIn("ABC123");

            assertThat(pass.getQrCode()).isEqualTo("QR-ABC123-42");
            assertThat(booking.getStatus()).isEqualTo(BookingStatus.CHECKED_IN);
            verify(bookingNotifier).checkInCompleted(any(BookingEntry.class), eq(pass), eq("ada@example.com"));
        }

        @Test
        @DisplayName("Should print TBD when no gate is published")
        void checkIn_NoGate_Tbd() {
            storedBooking(BookingStatus.CONFIRMED);
            flight.setGate(null);

            assertThat(workflowService.checkIn("ABC123").getGate()).isEqualTo("TBD");
        }

        @Test
        @DisplayName("Should return the same boarding pass when called again")
        void checkIn_Repeated_SamePass() {
            Booking booking = storedBooking(BookingStatus.CHECKED_IN);
            booking.setBoardingPassCode("QR-ABC123-777");

            BoardingPass pass = workflowService.checkIn("ABC123");

            assertThat(pass.getQrCode()).isEqualTo("QR-ABC123-777");
            verify(codeGenerator, never()).generateBoardingQrPayload(anyString());
            verify(bookingRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should refuse a cancelled booking")
        void checkIn_Cancelled_InvalidState() {
            storedBooking(BookingStatus.CANCELLED);

            assertThatThrownBy(() -> workflowService.checkIn("ABC123"))
                    .isInstanceOf(InvalidBookingStateException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "INVALID_BOOKING_STATE");
        }

        @Test
        @DisplayName("Should report an unknown confirmation number")
        void checkIn_Unknown_NotFound() {
            when(bookingRepository.findByConfirmationNumberForUpdate(anyString())).thenReturn(Optional.empty());

            assertThatThrownBy(() -> workflowService.checkIn("NOPE00"))
                    .isInstanceOf(NotFoundException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "BOOKING_NOT_FOUND");
        }
    }

    @Nested
    @DisplayName("Cancel and Complete Tests")
    class CancelCompleteTests {

        @Test
        @DisplayName("Cancelling releases seats and refunds the charge")
        void cancelBooking_Confirmed_ReleasesAndRefunds() {
            storedBooking(BookingStatus.CONFIRMED);

            BookingEntry entry = workflowService.cancelBooking("abc123");

            assertThat(entry.getStatus()).isEqualTo(BookingStatus.CANCELLED);
            assertThat(entry.getPaymentStatus()).isEqualTo(PaymentStatus.REFUNDED);
            verify(seatInventoryService).release("AA123", DATE, "14A", "ABC123");
            verify(seatInventoryService).release("AA123", DATE, "8C", "ABC123");
            verify(seatInventoryService, times(2)).release(anyString(), any(), anyString(), anyString());
            verify(paymentServiceClient).refund("TXN_1", new BigDecimal("1049.97"));
            assertThat(entry.getUpdatedAt()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
        }

        @Test
        @DisplayName("A failed refund still cancels but keeps the payment status")
        void cancelBooking_RefundFails_PaymentUnchanged() {
            storedBooking(BookingStatus.CONFIRMED);
            when(paymentServiceClient.refund(anyString(), any())).thenReturn(RefundResult.failed("TXN_1", "declined"));

            BookingEntry entry = workflowService.cancelBooking("ABC123");

            assertThat(entry.getStatus()).isEqualTo(BookingStatus.CANCELLED);
            assertThat(entry.getPaymentStatus()).isEqualTo(PaymentStatus.COMPLETED);
        }

        @Test
        @DisplayName("Checked-in bookings cannot be cancelled")
        void cancelBooking_CheckedIn_InvalidState() {
            storedBooking(BookingStatus.CHECKED_IN);

            assertThatThrownBy(() -> workflowService.cancelBooking("ABC123"))
                    .hasFieldOrPropertyWithValue("errorCode", "INVALID_BOOKING_STATE");
            verifyNoInteractions(paymentServiceClient);
        }

        @Test
        @DisplayName("Completing moves a checked-in booking to COMPLETED")
        void completeBooking_CheckedIn_Completed() {
            storedBooking(BookingStatus.CHECKED_IN);

            assertThat(workflowService.completeBooking("ABC123").getStatus()).isEqualTo(BookingStatus.COMPLETED);
        }

        @Test
        @DisplayName("Completing a booking that never checked in is refused")
        void completeBooking_Confirmed_InvalidState() {
            storedBooking(BookingStatus.CONFIRMED);

            assertThatThrownBy(() -> workflowService.completeBooking("ABC123"))
                    .isInstanceOf(InvalidBookingStateException.class);
        }
    }

    @Nested
    @DisplayName("Lookup Tests")
    class LookupTests {

        @Test
        @DisplayName("Should list a user's bookings")
        void getBookingsForUser_ReturnsEntries() {
            when(bookingRepository.findByUserIdOrderByCreatedAtDesc("user123"))
                    .thenReturn(List.of(persistedBooking("ABC123", new BigDecimal("299.99"), "TXN_1")));

            List<BookingEntry> entries = workflowService.getBookingsForUser("user123");

            assertThat(entries).extracting(BookingEntry::getConfirmationNumber).containsExactly("ABC123");
        }

        @Test
        @DisplayName("Should reject a blank user id")
        void getBookingsForUser_Blank_ValidationError() {
            assertThatThrownBy(() -> workflowService.getBookingsForUser(" "))
                    .isInstanceOf(BookingValidationException.class);
        }
    }
}
