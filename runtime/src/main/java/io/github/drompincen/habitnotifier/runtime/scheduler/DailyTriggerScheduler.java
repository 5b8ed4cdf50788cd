package io.github.drompincen.habitnotifier.runtime.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * Daily cron triggers on the shared {@link TaskScheduler}, evaluated in one zone for
 * every job. Fires missed while the process was down are not replayed.
 */
@Service
public class DailyTriggerScheduler implements JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(DailyTriggerScheduler.class);

    private final TaskScheduler taskScheduler;
    private final ZoneId zone;
    private final Map<String, Registration> registrations = new HashMap<>();

    public DailyTriggerScheduler(TaskScheduler taskScheduler, ZoneId reminderZone) {
        this.taskScheduler = taskScheduler;
        this.zone = reminderZone;
    }

    @Override
    public <T> boolean scheduleDaily(String jobId, LocalTime timeOfDay, Consumer<T> callback, T payload) {
        if (jobId == null || jobId.isBlank()) {
            log.error("Rejected daily job without id");
            return false;
        }
        if (timeOfDay == null || callback == null) {
            log.error("Rejected daily job {}: time={}, callback={}", jobId, timeOfDay, callback);
            return false;
        }
        String cron = cronFor(timeOfDay);
        synchronized (registrations) {
            cancelLocked(jobId);
            try {
                ScheduledFuture<?> future = taskScheduler.schedule(
                        () -> fire(jobId, callback, payload), new CronTrigger(cron, zone));
                if (future == null) {
                    log.error("Scheduler returned no handle for job {}", jobId);
                    return false;
                }
                registrations.put(jobId, new Registration(future, CronExpression.parse(cron), timeOfDay));
                log.debug("Scheduled job {} daily at {} {}", jobId, timeOfDay, zone);
                return true;
            } catch (IllegalArgumentException | IllegalStateException | TaskRejectedException e) {
                log.error("Failed to schedule job {} at {}: {}", jobId, timeOfDay, e.getMessage());
                return false;
            }
        }
    }

    @Override
    public boolean cancel(String jobId) {
        if (jobId == null) return false;
        synchronized (registrations) {
            return cancelLocked(jobId);
        }
    }

    @Override
    public boolean isScheduled(String jobId) {
        synchronized (registrations) {
            return registrations.containsKey(jobId);
        }
    }

    @Override
    public Set<String> scheduledJobIds() {
        synchronized (registrations) {
            return Set.copyOf(registrations.keySet());
        }
    }

    @Override
    public Optional<ZonedDateTime> nextFireTime(String jobId) {
        Registration registration;
        synchronized (registrations) {
            registration = registrations.get(jobId);
        }
        if (registration == null) return Optional.empty();
        return Optional.ofNullable(registration.cron().next(ZonedDateTime.now(zone)));
    }

    private boolean cancelLocked(String jobId) {
        Registration existing = registrations.remove(jobId);
        if (existing == null) return false;
        // A fire already running finishes its delivery.
        existing.future().cancel(false);
        log.debug("Cancelled job {} (was {})", jobId, existing.timeOfDay());
        return true;
    }

    private <T> void fire(String jobId, Consumer<T> callback, T payload) {
        try {
            callback.accept(payload);
        } catch (RuntimeException e) {
            log.error("Job {} failed", jobId, e);
        }
    }

    static String cronFor(LocalTime time) {
        return time.getSecond() + " " + time.getMinute() + " " + time.getHour() + " * * *";
    }

    private record Registration(ScheduledFuture<?> future, CronExpression cron, LocalTime timeOfDay) {}
}
