package com.dps.scheduler.booking.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CancelBookingRequest(
    @JsonProperty("ConfirmationNumber") String confirmationNumber,
    @JsonProperty("DateOfBirth") String dateOfBirth,
    @JsonProperty("LastFourDigitsSsn") String lastFourDigitsSsn,
    @JsonProperty("FirstName") String firstName,
    @JsonProperty("LastName") String lastName
) {
}
