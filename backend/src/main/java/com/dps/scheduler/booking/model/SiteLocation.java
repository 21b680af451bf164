package com.dps.scheduler.booking.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SiteLocation(
    @JsonProperty("Id") long id,
    @JsonProperty("Name") String name,
    @JsonProperty("Address") String address,
    @JsonProperty("Distance") double distance,
    @JsonProperty("ZipCode") String zipCode
) {
    public SiteLocation withZipCode(String zip) {
        return new SiteLocation(id, name, address, distance, zip);
    }
}
