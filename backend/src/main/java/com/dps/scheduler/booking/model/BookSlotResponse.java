package com.dps.scheduler.booking.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BookSlotResponse(
    @JsonProperty("Booking") Booking booking
) {
    public record Booking(
        @JsonProperty("ConfirmationNumber") String confirmationNumber
    ) {
    }
}
