package io.github.drompincen.habitnotifier.runtime.reminder;

import io.github.drompincen.habitnotifier.runtime.scheduler.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Moves a reminder to REMOVED: deletes the stored row, then cancels the trigger
 * under the job id the row was stored with and under the id derived from
 * {@code (userId, habitId)}, which is where reconciliation registers it.
 */
@Service
public class ReminderRemovalService {

    private static final Logger log = LoggerFactory.getLogger(ReminderRemovalService.class);

    private final ReminderStore reminderStore;
    private final JobScheduler jobScheduler;

    public ReminderRemovalService(ReminderStore reminderStore, JobScheduler jobScheduler) {
        this.reminderStore = reminderStore;
        this.jobScheduler = jobScheduler;
    }

    /**
     * @return true when a stored reminder existed and was deleted
     */
    public boolean removeByHabit(long habitId) {
        String expectedJobId = reminderStore.getByHabit(habitId)
                .map(r -> r.expectedJobId().encode())
                .orElse(null);
        return removeByHabit(habitId, expectedJobId);
    }

    /**
     * Same as {@link #removeByHabit(long)} for callers that already know the expected
     * job id, such as a firing trigger.
     */
    public boolean removeByHabit(long habitId, String expectedJobId) {
        Optional<String> storedJobId = reminderStore.removeByHabit(habitId);
        boolean cancelled = expectedJobId != null && jobScheduler.cancel(expectedJobId);
        if (storedJobId.isEmpty()) {
            if (cancelled) {
                log.info("No stored reminder for habit {}, cancelled stray job {}", habitId, expectedJobId);
            } else {
                log.debug("No stored reminder for habit {}, nothing to cancel", habitId);
            }
            return false;
        }
        if (!storedJobId.get().equals(expectedJobId)) {
            cancelled |= jobScheduler.cancel(storedJobId.get());
        }
        if (!cancelled) {
            log.warn("Reminder for habit {} removed, but no live job {}", habitId, storedJobId.get());
        }
        return true;
    }
}
