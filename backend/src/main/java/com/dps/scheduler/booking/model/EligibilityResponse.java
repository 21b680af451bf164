package com.dps.scheduler.booking.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public record EligibilityResponse(
    @JsonProperty("ResponseId") JsonNode responseId
) {
}
