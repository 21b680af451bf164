package com.dps.scheduler.booking.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HoldSlotResponse(
    @JsonProperty("SlotHeldSuccessfully") Boolean slotHeldSuccessfully,
    @JsonProperty("ErrorMessage") String errorMessage
) {
    public boolean isHeld() {
        return Boolean.TRUE.equals(slotHeldSuccessfully);
    }
}
