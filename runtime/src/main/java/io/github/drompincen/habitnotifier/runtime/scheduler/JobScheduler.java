package io.github.drompincen.habitnotifier.runtime.scheduler;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * In-process daily triggers, at most one per job id. Registrations are not persisted
 * and can be rebuilt from the reminder store at any time.
 */
public interface JobScheduler {

    /**
     * Replaces any trigger under {@code jobId} with one that calls
     * {@code callback.accept(payload)} every day at {@code timeOfDay}.
     *
     * @return false when the time is missing or the registration failed
     */
    <T> boolean scheduleDaily(String jobId, LocalTime timeOfDay, Consumer<T> callback, T payload);

    /**
     * @return false when nothing was registered under {@code jobId}
     */
    boolean cancel(String jobId);

    boolean isScheduled(String jobId);

    Set<String> scheduledJobIds();

    Optional<ZonedDateTime> nextFireTime(String jobId);
}
