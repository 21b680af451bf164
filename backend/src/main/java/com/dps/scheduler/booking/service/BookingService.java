package com.dps.scheduler.booking.service;

import com.dps.scheduler.booking.http.SchedulerApiClient;
import com.dps.scheduler.booking.model.BookSlotResponse;
import com.dps.scheduler.booking.model.BookingOutcome;
import com.dps.scheduler.booking.model.BookingState;
import com.dps.scheduler.booking.model.EligibilityRequest;
import com.dps.scheduler.booking.model.EligibilityResponse;
import com.dps.scheduler.booking.model.HoldSlotRequest;
import com.dps.scheduler.booking.model.HoldSlotResponse;
import com.dps.scheduler.booking.model.NewBookingRequest;
import com.dps.scheduler.booking.model.SlotCandidate;
import com.dps.scheduler.booking.model.TimeSlot;
import com.dps.scheduler.config.SchedulerProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Drives a found candidate through hold and book. At most one attempt runs at a time
 * across all locations; the state machine decides whether this call may proceed.
 */
@Service
public class BookingService {
    private static final Logger log = LoggerFactory.getLogger(BookingService.class);
    static final String HOLD_PATH = "/api/HoldSlot";
    static final String ELIGIBILITY_PATH = "/api/Eligibility";
    static final String NEW_BOOKING_PATH = "/api/NewBooking";

    private final SchedulerApiClient apiClient;
    private final BookingStateMachine stateMachine;
    private final ExistingBookingGuard existingBookingGuard;
    private final SchedulerProperties properties;
    private final ObjectMapper objectMapper;

    public BookingService(
        SchedulerApiClient apiClient,
        BookingStateMachine stateMachine,
        ExistingBookingGuard existingBookingGuard,
        SchedulerProperties properties,
        ObjectMapper objectMapper
    ) {
        this.apiClient = apiClient;
        this.stateMachine = stateMachine;
        this.existingBookingGuard = existingBookingGuard;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public BookingOutcome attempt(SlotCandidate candidate) {
        if (!stateMachine.tryBeginHold()) {
            return BookingOutcome.skipped();
        }
        log.info(
            "{} is available on {}! Booking appointment...",
            candidate.location().name(),
            candidate.slot().formattedStartDateTime()
        );
        if (existingBookingGuard.exists() && !properties.getApp().isCancelIfExist()) {
            log.warn("Cancel existing appointment is disabled. Please cancel your existing appointment manually.");
            stateMachine.markFailed();
            return BookingOutcome.fatal("Existing booking present and cancel-if-exist is disabled", 1);
        }

        try {
            HoldSlotResponse hold = holdSlot(candidate.slot());
            if (hold == null || !hold.isHeld()) {
                log.error("Failed to hold appointment slot.");
                log.error("Error Message: {}", hold == null ? null : hold.errorMessage());
                stateMachine.markFailed();
                return BookingOutcome.failed("Hold rejected: " + (hold == null ? "empty response" : hold.errorMessage()));
            }
            log.info("Appointment slot held successfully.");
            return bookSlot(candidate);
        } catch (FatalSchedulerException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Booking attempt at {} failed", candidate.location().name(), e);
            if (stateMachine.state() == BookingState.HOLDING) {
                stateMachine.markFailed();
            }
            return BookingOutcome.failed("Booking attempt failed: " + e.getMessage());
        }
    }

    private HoldSlotResponse holdSlot(TimeSlot slot) {
        SchedulerProperties.PersonalInfo info = properties.getPersonalInfo();
        HoldSlotRequest request = new HoldSlotRequest(
            info.getDob(),
            info.getFirstName(),
            info.getLastName(),
            info.getLastFourSsn(),
            slot.slotId()
        );
        return apiClient.post(HOLD_PATH, request, HoldSlotResponse.class);
    }

    private BookingOutcome bookSlot(SlotCandidate candidate) {
        log.info("Booking appointment...");
        // TODO: re-query /api/Booking after the cancel; a 200 from CancelBooking is not proof and two live bookings can result
        if (existingBookingGuard.exists()) {
            existingBookingGuard.cancelExisting();
        }

        SchedulerProperties.PersonalInfo info = properties.getPersonalInfo();
        TimeSlot slot = candidate.slot();
        NewBookingRequest request = new NewBookingRequest(
            false,
            slot.startDateTime(),
            slot.duration(),
            "",
            info.hasPhoneNumber() ? info.getPhoneNumber() : "",
            info.getDob(),
            info.getEmail(),
            info.getFirstName(),
            info.getLastName(),
            "",
            info.getLastFourSsn(),
            fetchResponseId(),
            info.hasPhoneNumber(),
            info.getTypeId(),
            candidate.location().id(),
            "N"
        );

        BookSlotResponse response = apiClient.post(NEW_BOOKING_PATH, request, BookSlotResponse.class);
        if (response == null || response.booking() == null) {
            log.error("Failed to book appointment.");
            log.error("{}", toJson(response));
            stateMachine.markFailed();
            return BookingOutcome.failed("Booking rejected: " + toJson(response));
        }

        String confirmationNumber = response.booking().confirmationNumber();
        String appointmentUrl = properties.getApi().getPublicSiteUrl() + "/?b=" + confirmationNumber;
        stateMachine.markBooked();
        log.info("Appointment booked successfully. Confirmation Number: {}.", confirmationNumber);
        log.info("Please visit the following URL to print your confirmation: {}.", appointmentUrl);
        return BookingOutcome.booked(confirmationNumber, appointmentUrl);
    }

    JsonNode fetchResponseId() {
        SchedulerProperties.PersonalInfo info = properties.getPersonalInfo();
        EligibilityRequest request = new EligibilityRequest(
            info.getFirstName(),
            info.getLastName(),
            info.getDob(),
            info.getLastFourSsn(),
            ""
        );
        List<EligibilityResponse> response = apiClient.post(ELIGIBILITY_PATH, request, new TypeReference<List<EligibilityResponse>>() {
        });
        if (response == null || response.isEmpty() || response.get(0).responseId() == null) {
            throw new IllegalStateException("Eligibility response did not contain a ResponseId");
        }
        return response.get(0).responseId();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
