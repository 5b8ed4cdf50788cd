package io.github.drompincen.habitnotifier.runtime.reminder;

import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

/**
 * Durable reminder rows keyed by habit. Implementations never throw: failures are
 * logged and reported as {@code false} or an empty result.
 */
public interface ReminderStore {

    /**
     * Inserts the reminder for {@code habitId} or replaces its time and job id.
     *
     * @return false when the habit is not owned by {@code userId} or the write failed
     */
    boolean upsert(long userId, long habitId, LocalTime timeOfDay, String jobId);

    Optional<Reminder> getByHabit(long habitId);

    List<Reminder> getAll();

    List<Reminder> getByUser(long userId);

    /**
     * @return the job id of the deleted row, empty when no row existed
     */
    Optional<String> removeByHabit(long habitId);

    /**
     * Tells an empty result apart from a failed call.
     *
     * @return false when the store cannot be reached within its timeout
     */
    boolean isAvailable();
}
