package com.dps.scheduler.booking.service;

import com.dps.scheduler.booking.model.SchedulerRunResult;
import com.dps.scheduler.booking.model.SiteLocation;
import com.dps.scheduler.config.SchedulerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class SchedulerCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SchedulerCliRunner.class);

    private final SchedulerProperties properties;
    private final ExistingBookingGuard existingBookingGuard;
    private final LocationDirectoryService locationDirectoryService;
    private final PollScheduler pollScheduler;
    private final ConfigurableApplicationContext applicationContext;

    public SchedulerCliRunner(
        SchedulerProperties properties,
        ExistingBookingGuard existingBookingGuard,
        LocationDirectoryService locationDirectoryService,
        PollScheduler pollScheduler,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.existingBookingGuard = existingBookingGuard;
        this.locationDirectoryService = locationDirectoryService;
        this.pollScheduler = pollScheduler;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }
        SchedulerRunResult result = execute();
        log.info("Scheduler finished with exit code {}: {}", result.exitCode(), result.message());
        int exitCode = SpringApplication.exit(applicationContext, result::exitCode);
        System.exit(exitCode);
    }

    /**
     * Runs the whole sequence without touching the JVM: validate, look for an existing booking,
     * pick locations, then poll until a booking is made or a fatal condition is reached.
     */
    public SchedulerRunResult execute() {
        try {
            properties.validate();
            log.info("DPS appointment scheduler is starting...");
            existingBookingGuard.checkExisting();
            List<SiteLocation> locations = locationDirectoryService.resolveScanLocations();
            return pollScheduler.run(locations);
        } catch (FatalSchedulerException e) {
            log.error("{}", e.getMessage());
            return SchedulerRunResult.fatal(e.getExitCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Scheduler run failed unexpectedly", e);
            return SchedulerRunResult.fatal(1, "Unexpected failure: " + e.getMessage());
        }
    }
}
