package com.dps.scheduler.booking.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Set;

/**
 * Date and hour limits a slot must fall into. Hours are a half-open range
 * {@code [startHour, endHour)} evaluated in {@code zone}.
 */
public record AvailabilityWindow(
    boolean sameDay,
    LocalDate referenceDate,
    int startOffsetDays,
    int endOffsetDays,
    Set<DayOfWeek> preferredDays,
    int startHour,
    int endHour,
    ZoneId zone
) {
    public AvailabilityWindow {
        preferredDays = preferredDays == null ? Set.of() : Set.copyOf(preferredDays);
    }

    public LocalDate firstDate() {
        return referenceDate.plusDays(startOffsetDays);
    }

    public LocalDate lastDate() {
        return referenceDate.plusDays(endOffsetDays);
    }
}
