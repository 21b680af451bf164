package com.dps.scheduler.booking.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LocationSearchRequest(
    @JsonProperty("CityName") String cityName,
    @JsonProperty("PreferredDay") int preferredDay,
    @JsonProperty("TypeId") int typeId,
    @JsonProperty("ZipCode") String zipCode
) {
}
