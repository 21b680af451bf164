package com.dps.scheduler.booking.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ExistingBooking(
    @JsonProperty("ConfirmationNumber") String confirmationNumber,
    @JsonProperty("SiteName") String siteName,
    @JsonProperty("BookingDateTime") String bookingDateTime,
    @JsonProperty("ServiceTypeId") int serviceTypeId
) {
}
