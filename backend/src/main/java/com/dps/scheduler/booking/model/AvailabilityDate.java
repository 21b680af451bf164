package com.dps.scheduler.booking.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AvailabilityDate(
    @JsonProperty("AvailabilityDate") String availabilityDate,
    @JsonProperty("AvailableTimeSlots") List<TimeSlot> availableTimeSlots
) {
    public AvailabilityDate {
        availableTimeSlots = availableTimeSlots == null ? List.of() : List.copyOf(availableTimeSlots);
    }

    public AvailabilityDate withTimeSlots(List<TimeSlot> slots) {
        return new AvailabilityDate(availabilityDate, slots);
    }

    public boolean hasTimeSlots() {
        return !availableTimeSlots.isEmpty();
    }
}
