package com.dps.scheduler.booking.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public record NewBookingRequest(
    @JsonProperty("AdaRequired") boolean adaRequired,
    @JsonProperty("BookingDateTime") String bookingDateTime,
    @JsonProperty("BookingDuration") int bookingDuration,
    @JsonProperty("CardNumber") String cardNumber,
    @JsonProperty("CellPhone") String cellPhone,
    @JsonProperty("DateOfBirth") String dateOfBirth,
    @JsonProperty("Email") String email,
    @JsonProperty("FirstName") String firstName,
    @JsonProperty("LastName") String lastName,
    @JsonProperty("HomePhone") String homePhone,
    @JsonProperty("Last4Ssn") String last4Ssn,
    @JsonProperty("ResponseId") JsonNode responseId,
    @JsonProperty("SendSms") boolean sendSms,
    @JsonProperty("ServiceTypeId") int serviceTypeId,
    @JsonProperty("SiteId") long siteId,
    @JsonProperty("SpanishLanguage") String spanishLanguage
) {
}
