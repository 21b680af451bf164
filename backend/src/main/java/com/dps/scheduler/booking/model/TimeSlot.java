package com.dps.scheduler.booking.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TimeSlot(
    @JsonProperty("SlotId") long slotId,
    @JsonProperty("Duration") int duration,
    @JsonProperty("StartDateTime") String startDateTime,
    @JsonProperty("FormattedStartDateTime") String formattedStartDateTime
) {
}
