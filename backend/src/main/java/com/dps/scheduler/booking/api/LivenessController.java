package com.dps.scheduler.booking.api;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@ConditionalOnProperty(prefix = "scheduler.app", name = "webserver", havingValue = "true")
public class LivenessController {
    static final String ALIVE_MESSAGE = "Bot is alive!";

    @GetMapping("/")
    public String alive() {
        return ALIVE_MESSAGE;
    }
}
