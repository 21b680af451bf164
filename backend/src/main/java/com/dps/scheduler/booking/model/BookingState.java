package com.dps.scheduler.booking.model;

public enum BookingState {
    SCANNING,
    HOLDING,
    BOOKED,
    FAILED
}
