package com.dps.scheduler.config;

import com.dps.scheduler.booking.service.FatalSchedulerException;

import java.util.List;

public class InvalidConfigurationException extends FatalSchedulerException {
    private final List<String> problems;

    public InvalidConfigurationException(List<String> problems) {
        super("Invalid configuration: " + String.join("; ", problems), 1);
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
