package com.dps.scheduler.booking.model;

public record SlotCandidate(
    SiteLocation location,
    AvailabilityDate date,
    TimeSlot slot
) {
}
