package com.dps.scheduler.booking.service;

import com.dps.scheduler.booking.http.SchedulerApiClient;
import com.dps.scheduler.booking.model.CancelBookingRequest;
import com.dps.scheduler.booking.model.ExistingBooking;
import com.dps.scheduler.booking.model.ExistingBookingRequest;
import com.dps.scheduler.booking.util.ApiDateTimes;
import com.dps.scheduler.config.SchedulerProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Tracks the booking the operator already has for the configured appointment type.
 * Queried once at startup; the snapshot is consulted again when a new hold succeeds.
 */
@Service
public class ExistingBookingGuard {
    private static final Logger log = LoggerFactory.getLogger(ExistingBookingGuard.class);
    static final String BOOKING_PATH = "/api/Booking";
    static final String CANCEL_PATH = "/api/CancelBooking";

    private final SchedulerApiClient apiClient;
    private final SchedulerProperties properties;
    private volatile List<ExistingBooking> bookings = List.of();

    public ExistingBookingGuard(SchedulerApiClient apiClient, SchedulerProperties properties) {
        this.apiClient = apiClient;
        this.properties = properties;
    }

    public List<ExistingBooking> checkExisting() {
        SchedulerProperties.PersonalInfo info = properties.getPersonalInfo();
        ExistingBookingRequest request = new ExistingBookingRequest(
            info.getFirstName(),
            info.getLastName(),
            info.getDob(),
            info.getLastFourSsn()
        );
        List<ExistingBooking> response = apiClient.post(BOOKING_PATH, request, new TypeReference<List<ExistingBooking>>() {
        });
        int typeId = info.getTypeId();
        List<ExistingBooking> matching = response == null
            ? List.of()
            : response.stream().filter(booking -> booking.serviceTypeId() == typeId).toList();
        bookings = matching;
        if (!matching.isEmpty()) {
            ExistingBooking first = matching.get(0);
            ZoneId zone = ZoneId.of(properties.getApp().getTimeZone());
            log.warn(
                "You have an existing booking at {} {}.",
                first.siteName(),
                ApiDateTimes.display(first.bookingDateTime(), zone)
            );
            if (properties.getApp().isCancelIfExist()) {
                log.warn("This application will continue to run, and cancel the existing booking if a new one is found.");
            } else {
                log.warn("Cancel existing appointment is disabled. A new slot will not be booked while this booking exists.");
            }
        }
        return matching;
    }

    public boolean exists() {
        return !bookings.isEmpty();
    }

    public Optional<ExistingBooking> current() {
        List<ExistingBooking> snapshot = bookings;
        return snapshot.isEmpty() ? Optional.empty() : Optional.of(snapshot.get(0));
    }

    /**
     * Cancels the existing booking. A failed cancel surfaces as a transport failure; a
     * cancelled booking is dropped from the snapshot so a later attempt does not cancel it again.
     */
    public void cancelExisting() {
        Optional<ExistingBooking> existing = current();
        if (existing.isEmpty()) {
            return;
        }
        String confirmationNumber = existing.get().confirmationNumber();
        log.info("Canceling existing appointment: {}.", confirmationNumber);
        SchedulerProperties.PersonalInfo info = properties.getPersonalInfo();
        CancelBookingRequest request = new CancelBookingRequest(
            confirmationNumber,
            info.getDob(),
            info.getLastFourSsn(),
            info.getFirstName(),
            info.getLastName()
        );
        apiClient.request(CANCEL_PATH, "POST", request);
        bookings = List.of();
        log.info("Appointment cancelled.");
    }
}
