package io.github.drompincen.habitnotifier.gateway.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;

@Configuration
public class SchedulerConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    @Bean
    ThreadPoolTaskScheduler taskScheduler(@Value("${habitnotifier.scheduler.pool-size:4}") int poolSize) {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("reminder-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }

    @Bean
    ThreadPoolTaskExecutor deliveryExecutor(@Value("${habitnotifier.delivery.pool-size:4}") int poolSize) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("delivery-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    /**
     * The one zone every daily trigger is evaluated in. Per-user zones are not supported.
     */
    @Bean
    ZoneId reminderZone(@Value("${habitnotifier.timezone:UTC}") String timezone) {
        try {
            ZoneId zone = ZoneId.of(timezone);
            log.info("Reminder triggers use timezone {}", zone);
            return zone;
        } catch (DateTimeException e) {
            log.error("Invalid habitnotifier.timezone '{}', falling back to UTC", timezone);
            return ZoneOffset.UTC;
        }
    }
}
