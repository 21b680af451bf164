package com.dps.scheduler.booking.service;

import com.dps.scheduler.booking.http.SchedulerApiClient;
import com.dps.scheduler.booking.model.AvailabilityWindow;
import com.dps.scheduler.booking.model.BookingOutcome;
import com.dps.scheduler.booking.model.LocationDatesRequest;
import com.dps.scheduler.booking.model.LocationDatesResponse;
import com.dps.scheduler.booking.model.SchedulerRunResult;
import com.dps.scheduler.booking.model.SiteLocation;
import com.dps.scheduler.booking.model.SlotCandidate;
import com.dps.scheduler.config.SchedulerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Checks every location in list order, one at a time, then waits {@code interval-ms} and
 * starts over. A hold/book sequence runs inline, so no other location is checked until it
 * finishes; a failed attempt simply lets the loop carry on.
 */
@Service
public class PollScheduler {
    private static final Logger log = LoggerFactory.getLogger(PollScheduler.class);
    static final String LOCATION_DATES_PATH = "/api/AvailableLocationDates";
    private static final String ROUND_SEPARATOR = "-".repeat(120);

    private final SchedulerApiClient apiClient;
    private final AvailabilityFilter availabilityFilter;
    private final BookingService bookingService;
    private final BookingStateMachine stateMachine;
    private final SchedulerProperties properties;
    private final Clock clock;
    private final Object sleepLock = new Object();
    private final AtomicLong roundsCompleted = new AtomicLong();

    private volatile boolean stopRequested;

    public PollScheduler(
        SchedulerApiClient apiClient,
        AvailabilityFilter availabilityFilter,
        BookingService bookingService,
        BookingStateMachine stateMachine,
        SchedulerProperties properties,
        Clock clock
    ) {
        this.apiClient = apiClient;
        this.availabilityFilter = availabilityFilter;
        this.bookingService = bookingService;
        this.stateMachine = stateMachine;
        this.properties = properties;
        this.clock = clock;
    }

    public SchedulerRunResult run(List<SiteLocation> locations) {
        log.info("Checking locations for available appointments...");
        try {
            while (!stopRequested && !Thread.currentThread().isInterrupted()) {
                Optional<BookingOutcome> terminal = runRound(locations);
                if (terminal.isPresent()) {
                    return SchedulerRunResult.fromOutcome(terminal.get());
                }
                if (!pause(properties.getApp().getIntervalMs())) {
                    break;
                }
            }
            return SchedulerRunResult.stopped();
        } catch (FatalSchedulerException e) {
            log.error("Stopping scheduler: {}", e.getMessage());
            return SchedulerRunResult.fatal(e.getExitCode(), e.getMessage());
        }
    }

    /**
     * One poll round. Returns the outcome that ends the run, if any location produced one.
     */
    public Optional<BookingOutcome> runRound(List<SiteLocation> locations) {
        log.info(ROUND_SEPARATOR);
        AvailabilityWindow window = AvailabilityFilter.windowFrom(properties, clock);
        for (SiteLocation location : locations) {
            if (stopRequested || stateMachine.isInFlight()) {
                break;
            }
            Optional<BookingOutcome> outcome = checkLocation(location, window);
            if (outcome.isPresent()) {
                return outcome;
            }
        }
        roundsCompleted.incrementAndGet();
        return Optional.empty();
    }

    Optional<BookingOutcome> checkLocation(SiteLocation location, AvailabilityWindow window) {
        try {
            LocationDatesRequest request = new LocationDatesRequest(
                location.id(),
                0,
                window.sameDay(),
                null,
                properties.getPersonalInfo().getTypeId()
            );
            LocationDatesResponse response = apiClient.post(LOCATION_DATES_PATH, request, LocationDatesResponse.class);
            Optional<SlotCandidate> candidate = availabilityFilter.firstCandidate(
                location,
                response == null ? List.of() : response.locationAvailabilityDates(),
                window
            );
            if (candidate.isEmpty()) {
                if (window.sameDay()) {
                    log.info("{} is not available today.", location.name());
                } else {
                    log.info("{} is not available in the next {} days.", location.name(), window.endOffsetDays());
                }
                return Optional.empty();
            }
            BookingOutcome outcome = bookingService.attempt(candidate.get());
            return outcome.isTerminal() ? Optional.of(outcome) : Optional.empty();
        } catch (FatalSchedulerException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Availability check for {} failed", location.name(), e);
            return Optional.empty();
        }
    }

    public long getRoundsCompleted() {
        return roundsCompleted.get();
    }

    @PreDestroy
    public void stop() {
        stopRequested = true;
        synchronized (sleepLock) {
            sleepLock.notifyAll();
        }
    }

    private boolean pause(long intervalMs) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(intervalMs);
        synchronized (sleepLock) {
            try {
                long remaining = deadline - System.nanoTime();
                while (!stopRequested && remaining > 0) {
                    TimeUnit.NANOSECONDS.timedWait(sleepLock, remaining);
                    remaining = deadline - System.nanoTime();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return !stopRequested;
    }
}
