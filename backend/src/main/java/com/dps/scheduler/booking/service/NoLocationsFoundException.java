package com.dps.scheduler.booking.service;

public class NoLocationsFoundException extends FatalSchedulerException {
    public NoLocationsFoundException(String message) {
        super(message, 0);
    }
}
