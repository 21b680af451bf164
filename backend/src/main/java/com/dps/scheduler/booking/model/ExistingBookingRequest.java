package com.dps.scheduler.booking.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ExistingBookingRequest(
    @JsonProperty("FirstName") String firstName,
    @JsonProperty("LastName") String lastName,
    @JsonProperty("DateOfBirth") String dateOfBirth,
    @JsonProperty("LastFourDigitsSsn") String lastFourDigitsSsn
) {
}
