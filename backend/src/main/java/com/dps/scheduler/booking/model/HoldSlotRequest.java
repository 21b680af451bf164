package com.dps.scheduler.booking.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HoldSlotRequest(
    @JsonProperty("DateOfBirth") String dateOfBirth,
    @JsonProperty("FirstName") String firstName,
    @JsonProperty("LastName") String lastName,
    @JsonProperty("Last4Ssn") String last4Ssn,
    @JsonProperty("SlotId") long slotId
) {
}
