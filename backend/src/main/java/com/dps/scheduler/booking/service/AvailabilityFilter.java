package com.dps.scheduler.booking.service;

import com.dps.scheduler.booking.model.AvailabilityDate;
import com.dps.scheduler.booking.model.AvailabilityWindow;
import com.dps.scheduler.booking.model.SiteLocation;
import com.dps.scheduler.booking.model.SlotCandidate;
import com.dps.scheduler.booking.model.TimeSlot;
import com.dps.scheduler.booking.util.ApiDateTimes;
import com.dps.scheduler.config.SchedulerProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Narrows a location's raw availability to the dates and hours the operator accepts.
 * Input order is preserved: the chosen candidate is the first surviving slot of the first
 * surviving date, not the earliest by value.
 */
@Component
public class AvailabilityFilter {

    public List<AvailabilityDate> filter(List<AvailabilityDate> rawDates, AvailabilityWindow window) {
        if (rawDates == null || rawDates.isEmpty()) {
            return List.of();
        }
        List<AvailabilityDate> kept = new ArrayList<>();
        for (AvailabilityDate date : rawDates) {
            if (date == null || !date.hasTimeSlots()) {
                continue;
            }
            if (!window.sameDay() && !isInsideDateWindow(date, window)) {
                continue;
            }
            List<TimeSlot> slots = filterSlots(date.availableTimeSlots(), window);
            if (!slots.isEmpty()) {
                kept.add(date.withTimeSlots(slots));
            }
        }
        return List.copyOf(kept);
    }

    public Optional<SlotCandidate> firstCandidate(SiteLocation location, List<AvailabilityDate> rawDates, AvailabilityWindow window) {
        List<AvailabilityDate> filtered = filter(rawDates, window);
        if (filtered.isEmpty()) {
            return Optional.empty();
        }
        AvailabilityDate date = filtered.get(0);
        return Optional.of(new SlotCandidate(location, date, date.availableTimeSlots().get(0)));
    }

    public List<TimeSlot> filterSlots(List<TimeSlot> slots, AvailabilityWindow window) {
        List<TimeSlot> kept = new ArrayList<>();
        for (TimeSlot slot : slots) {
            LocalDateTime start = ApiDateTimes.toLocalDateTime(slot.startDateTime(), window.zone());
            if (start == null) {
                continue;
            }
            int hour = start.getHour();
            if (hour >= window.startHour() && hour < window.endHour()) {
                kept.add(slot);
            }
        }
        return kept;
    }

    private boolean isInsideDateWindow(AvailabilityDate date, AvailabilityWindow window) {
        LocalDate day = ApiDateTimes.toLocalDate(date.availabilityDate(), window.zone());
        if (day == null) {
            return false;
        }
        if (day.isBefore(window.firstDate()) || day.isAfter(window.lastDate())) {
            return false;
        }
        return window.preferredDays().isEmpty() || window.preferredDays().contains(day.getDayOfWeek());
    }

    /**
     * Builds the window from configuration. The reference date is {@code days-around.start-date}
     * when set, otherwise today in the configured zone.
     */
    public static AvailabilityWindow windowFrom(SchedulerProperties properties, Clock clock) {
        SchedulerProperties.Location location = properties.getLocation();
        ZoneId zone = ZoneId.of(properties.getApp().getTimeZone());
        String configuredStart = location.getDaysAround().getStartDate();
        LocalDate referenceDate = configuredStart == null || configuredStart.isBlank()
            ? LocalDate.now(clock.withZone(zone))
            : LocalDate.parse(configuredStart.trim());
        return new AvailabilityWindow(
            location.isSameDay(),
            referenceDate,
            location.getDaysAround().getStart(),
            location.getDaysAround().getEnd(),
            toDaysOfWeek(location.getPreferredDays()),
            location.getTimesAround().getStart(),
            location.getTimesAround().getEnd(),
            zone
        );
    }

    // 0 is Sunday, 6 is Saturday
    static Set<DayOfWeek> toDaysOfWeek(List<Integer> days) {
        if (days == null || days.isEmpty()) {
            return Set.of();
        }
        Set<DayOfWeek> result = EnumSet.noneOf(DayOfWeek.class);
        for (Integer day : days) {
            if (day == null || day < 0 || day > 6) {
                continue;
            }
            result.add(day == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(day));
        }
        return result;
    }
}
