package io.github.drompincen.habitnotifier.gateway.config;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulerConfigTest {

    private final SchedulerConfig config = new SchedulerConfig();

    @Test
    void configuredZoneIsUsed() {
        assertThat(config.reminderZone("Europe/Madrid")).isEqualTo(ZoneId.of("Europe/Madrid"));
    }

    @Test
    void unknownZoneFallsBackToUtc() {
        assertThat(config.reminderZone("Mars/Olympus")).isEqualTo(ZoneOffset.UTC);
        assertThat(config.reminderZone("")).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    void taskSchedulerUsesConfiguredPool() {
        ThreadPoolTaskScheduler scheduler = config.taskScheduler(3);

        assertThat(scheduler.getPoolSize()).isEqualTo(3);
        assertThat(scheduler.getThreadNamePrefix()).isEqualTo("reminder-");
    }
}
