package com.dps.scheduler.booking.model;

public record SchedulerRunResult(
    int exitCode,
    String message,
    BookingOutcome outcome
) {
    public static SchedulerRunResult fromOutcome(BookingOutcome outcome) {
        return new SchedulerRunResult(outcome.exitCode(), outcome.message(), outcome);
    }

    public static SchedulerRunResult fatal(int exitCode, String message) {
        return new SchedulerRunResult(exitCode, message, null);
    }

    public static SchedulerRunResult stopped() {
        return new SchedulerRunResult(0, "Scheduler stopped", null);
    }
}
