package com.dps.scheduler.booking.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LocationDatesRequest(
    @JsonProperty("LocationId") long locationId,
    @JsonProperty("PreferredDay") int preferredDay,
    @JsonProperty("SameDay") boolean sameDay,
    @JsonProperty("StartDate") String startDate,
    @JsonProperty("TypeId") int typeId
) {
}
