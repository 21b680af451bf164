package com.dps.scheduler.booking.service;

import com.dps.scheduler.SchedulerTestFixtures;
import com.dps.scheduler.booking.http.ApiRetryExhaustedException;
import com.dps.scheduler.booking.http.SchedulerApiClient;
import com.dps.scheduler.booking.model.BookSlotResponse;
import com.dps.scheduler.booking.model.BookingOutcome;
import com.dps.scheduler.booking.model.BookingState;
import com.dps.scheduler.booking.model.EligibilityResponse;
import com.dps.scheduler.booking.model.HoldSlotRequest;
import com.dps.scheduler.booking.model.HoldSlotResponse;
import com.dps.scheduler.booking.model.NewBookingRequest;
import com.dps.scheduler.booking.model.SlotCandidate;
import com.dps.scheduler.config.SchedulerConfig;
import com.dps.scheduler.config.SchedulerProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.node.IntNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BookingServiceTest {

    @Mock
    private SchedulerApiClient apiClient;
    @Mock
    private ExistingBookingGuard existingBookingGuard;

    private BookingStateMachine stateMachine;
    private SchedulerProperties properties;
    private BookingService service;
    private SlotCandidate candidate;

    @BeforeEach
    void setUp() {
        stateMachine = new BookingStateMachine();
        properties = SchedulerTestFixtures.properties(null);
        service = new BookingService(apiClient, stateMachine, existingBookingGuard, properties, SchedulerConfig.createObjectMapper());
        candidate = new SlotCandidate(
            SchedulerTestFixtures.location(42, "Austin North", 4.2),
            SchedulerTestFixtures.date("2024-05-02", SchedulerTestFixtures.slot(900, "2024-05-02T10:00:00")),
            SchedulerTestFixtures.slot(900, "2024-05-02T10:00:00")
        );
    }

    @Test
    void attemptIsNoOpWhileAnotherHoldIsInFlight() {
        stateMachine.tryBeginHold();

        BookingOutcome outcome = service.attempt(candidate);

        assertEquals(BookingOutcome.Status.SKIPPED, outcome.status());
        verifyNoInteractions(apiClient, existingBookingGuard);
        assertEquals(BookingState.HOLDING, stateMachine.state());
    }

    @Test
    void existingBookingWithoutAutoCancelStopsBeforeAnyHold() {
        properties.getApp().setCancelIfExist(false);
        when(existingBookingGuard.exists()).thenReturn(true);

        BookingOutcome outcome = service.attempt(candidate);

        assertEquals(BookingOutcome.Status.FATAL, outcome.status());
        assertEquals(1, outcome.exitCode());
        verifyNoInteractions(apiClient);
        verify(existingBookingGuard, never()).cancelExisting();
    }

    @Test
    void rejectedHoldReleasesStateAndDoesNotBook() {
        when(apiClient.post(eq(BookingService.HOLD_PATH), any(), eq(HoldSlotResponse.class)))
            .thenReturn(new HoldSlotResponse(false, "Slot no longer available"));

        BookingOutcome outcome = service.attempt(candidate);

        assertEquals(BookingOutcome.Status.FAILED, outcome.status());
        assertThat(outcome.message()).contains("Slot no longer available");
        assertEquals(BookingState.FAILED, stateMachine.state());
        assertFalse(stateMachine.isInFlight());
        verify(apiClient, never()).post(eq(BookingService.NEW_BOOKING_PATH), any(), eq(BookSlotResponse.class));
    }

    @Test
    void nullBookingInResponseIsRecoverable() {
        stubHoldAndEligibility();
        when(apiClient.post(eq(BookingService.NEW_BOOKING_PATH), any(), eq(BookSlotResponse.class)))
            .thenReturn(new BookSlotResponse(null));

        BookingOutcome outcome = service.attempt(candidate);

        assertEquals(BookingOutcome.Status.FAILED, outcome.status());
        assertFalse(outcome.isTerminal());
        assertEquals(BookingState.FAILED, stateMachine.state());
        assertFalse(stateMachine.isInFlight());
    }

    @Test
    void successfulBookingCancelsExistingBookingFirst() {
        properties.getApp().setCancelIfExist(true);
        when(existingBookingGuard.exists()).thenReturn(true);
        stubHoldAndEligibility();
        when(apiClient.post(eq(BookingService.NEW_BOOKING_PATH), any(), eq(BookSlotResponse.class)))
            .thenReturn(new BookSlotResponse(new BookSlotResponse.Booking("ABC123")));

        BookingOutcome outcome = service.attempt(candidate);

        assertEquals(BookingOutcome.Status.BOOKED, outcome.status());
        assertEquals("ABC123", outcome.confirmationNumber());
        assertEquals("https://public.txdpsscheduler.com/?b=ABC123", outcome.confirmationUrl());
        assertEquals(0, outcome.exitCode());
        assertEquals(BookingState.BOOKED, stateMachine.state());

        InOrder order = inOrder(apiClient, existingBookingGuard);
        order.verify(apiClient).post(eq(BookingService.HOLD_PATH), any(), eq(HoldSlotResponse.class));
        order.verify(existingBookingGuard).cancelExisting();
        order.verify(apiClient).post(eq(BookingService.ELIGIBILITY_PATH), any(), any(TypeReference.class));
        order.verify(apiClient).post(eq(BookingService.NEW_BOOKING_PATH), any(), eq(BookSlotResponse.class));
    }

    @Test
    void bookingRequestCarriesHeldSlotAndOperatorDetails() {
        stubHoldAndEligibility();
        when(apiClient.post(eq(BookingService.NEW_BOOKING_PATH), any(), eq(BookSlotResponse.class)))
            .thenReturn(new BookSlotResponse(new BookSlotResponse.Booking("XYZ")));

        service.attempt(candidate);

        ArgumentCaptor<Object> hold = ArgumentCaptor.forClass(Object.class);
        verify(apiClient).post(eq(BookingService.HOLD_PATH), hold.capture(), eq(HoldSlotResponse.class));
        assertEquals(900L, ((HoldSlotRequest) hold.getValue()).slotId());
        assertEquals("1234", ((HoldSlotRequest) hold.getValue()).last4Ssn());

        ArgumentCaptor<Object> booking = ArgumentCaptor.forClass(Object.class);
        verify(apiClient).post(eq(BookingService.NEW_BOOKING_PATH), booking.capture(), eq(BookSlotResponse.class));
        NewBookingRequest request = (NewBookingRequest) booking.getValue();
        assertEquals("2024-05-02T10:00:00", request.bookingDateTime());
        assertEquals(20, request.bookingDuration());
        assertEquals(42L, request.siteId());
        assertEquals(71, request.serviceTypeId());
        assertEquals("5125550100", request.cellPhone());
        assertEquals(true, request.sendSms());
        assertEquals(IntNode.valueOf(555), request.responseId());
        assertEquals("N", request.spanishLanguage());
        assertFalse(request.adaRequired());
    }

    @Test
    void transportExhaustionPropagates() {
        when(apiClient.post(eq(BookingService.HOLD_PATH), any(), eq(HoldSlotResponse.class)))
            .thenThrow(new ApiRetryExhaustedException(BookingService.HOLD_PATH, 500, 2));

        assertThatThrownBy(() -> service.attempt(candidate)).isInstanceOf(ApiRetryExhaustedException.class);
    }

    @Test
    void missingResponseIdFailsTheAttemptWithoutStickingInHold() {
        when(apiClient.post(eq(BookingService.HOLD_PATH), any(), eq(HoldSlotResponse.class)))
            .thenReturn(new HoldSlotResponse(true, null));
        when(apiClient.post(eq(BookingService.ELIGIBILITY_PATH), any(), any(TypeReference.class)))
            .thenReturn(List.of());

        BookingOutcome outcome = service.attempt(candidate);

        assertEquals(BookingOutcome.Status.FAILED, outcome.status());
        assertFalse(stateMachine.isInFlight());
    }

    private void stubHoldAndEligibility() {
        when(apiClient.post(eq(BookingService.HOLD_PATH), any(), eq(HoldSlotResponse.class)))
            .thenReturn(new HoldSlotResponse(true, null));
        when(apiClient.post(eq(BookingService.ELIGIBILITY_PATH), any(), any(TypeReference.class)))
            .thenReturn(List.of(new EligibilityResponse(IntNode.valueOf(555))));
    }
}
