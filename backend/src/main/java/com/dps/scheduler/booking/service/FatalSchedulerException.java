package com.dps.scheduler.booking.service;

/**
 * Ends the current run. The exit code is handed to the process by the CLI runner.
 */
public class FatalSchedulerException extends RuntimeException {
    private final int exitCode;

    public FatalSchedulerException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public FatalSchedulerException(String message, int exitCode, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
