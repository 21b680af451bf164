package com.dps.scheduler.booking.model;

public record BookingOutcome(
    Status status,
    String confirmationNumber,
    String confirmationUrl,
    String message,
    int exitCode
) {
    public enum Status {
        BOOKED,
        FAILED,
        SKIPPED,
        FATAL
    }

    public static BookingOutcome booked(String confirmationNumber, String confirmationUrl) {
        return new BookingOutcome(Status.BOOKED, confirmationNumber, confirmationUrl, "Appointment booked", 0);
    }

    public static BookingOutcome failed(String message) {
        return new BookingOutcome(Status.FAILED, null, null, message, 0);
    }

    public static BookingOutcome skipped() {
        return new BookingOutcome(Status.SKIPPED, null, null, "Booking already in progress", 0);
    }

    public static BookingOutcome fatal(String message, int exitCode) {
        return new BookingOutcome(Status.FATAL, null, null, message, exitCode);
    }

    public boolean isTerminal() {
        return status == Status.BOOKED || status == Status.FATAL;
    }
}
