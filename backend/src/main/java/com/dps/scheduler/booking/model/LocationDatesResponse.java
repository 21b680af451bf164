package com.dps.scheduler.booking.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record LocationDatesResponse(
    @JsonProperty("LocationAvailabilityDates") List<AvailabilityDate> locationAvailabilityDates
) {
    public LocationDatesResponse {
        locationAvailabilityDates = locationAvailabilityDates == null ? List.of() : List.copyOf(locationAvailabilityDates);
    }
}
