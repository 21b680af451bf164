package com.dps.scheduler;

import com.dps.scheduler.booking.api.LivenessController;
import com.dps.scheduler.booking.service.PollScheduler;
import com.dps.scheduler.config.SchedulerProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest
@ActiveProfiles("test")
class DpsSchedulerApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private SchedulerProperties properties;

    @Test
    void contextLoadsWithoutStartingTheEngine() {
        assertNotNull(context.getBean(PollScheduler.class));
        assertEquals(0, context.getBean(PollScheduler.class).getRoundsCompleted());
        assertThat(context.getBeansOfType(LivenessController.class)).isEmpty();
    }

    @Test
    void testProfileOverridesDefaults() {
        assertEquals("Test", properties.getPersonalInfo().getFirstName());
        assertEquals(1, properties.getApp().getMaxRetry());
        assertEquals(SchedulerProperties.DEFAULT_TYPE_ID, properties.getPersonalInfo().getTypeId());
        assertEquals("America/Chicago", properties.getApp().getTimeZone());
    }
}
