package io.github.drompincen.habitnotifier.runtime.reconcile;

import io.github.drompincen.habitnotifier.protocol.api.ReconciliationReport;
import io.github.drompincen.habitnotifier.runtime.delivery.DeliveryWorker;
import io.github.drompincen.habitnotifier.runtime.habit.HabitLookup;
import io.github.drompincen.habitnotifier.runtime.reminder.Reminder;
import io.github.drompincen.habitnotifier.runtime.reminder.ReminderJobId;
import io.github.drompincen.habitnotifier.runtime.reminder.ReminderPayload;
import io.github.drompincen.habitnotifier.runtime.reminder.ReminderStore;
import io.github.drompincen.habitnotifier.runtime.scheduler.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rebuilds live triggers from stored reminders. Orphans (habit deleted behind our
 * back) are pruned from the store and the scheduler; every other row is registered
 * under its expected job id. Re-running with an unchanged store yields the same set
 * of job ids.
 */
@Service
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private enum RowResult { SCHEDULED, ORPHAN, FAILED }

    private final ReminderStore reminderStore;
    private final HabitLookup habitLookup;
    private final JobScheduler jobScheduler;
    private final DeliveryWorker deliveryWorker;

    public ReconciliationService(ReminderStore reminderStore,
                                 HabitLookup habitLookup,
                                 JobScheduler jobScheduler,
                                 DeliveryWorker deliveryWorker) {
        this.reminderStore = reminderStore;
        this.habitLookup = habitLookup;
        this.jobScheduler = jobScheduler;
        this.deliveryWorker = deliveryWorker;
    }

    public ReconciliationReport reconcile() {
        List<Reminder> reminders = reminderStore.getAll();
        if (reminders.isEmpty()) {
            if (!reminderStore.isAvailable()) {
                log.warn("Reminder store unavailable, triggers left as they are until the next reconciliation");
                return ReconciliationReport.empty();
            }
            log.info("No stored reminders to schedule");
        } else {
            log.info("Found {} stored reminders, reconciling triggers", reminders.size());
        }

        int scheduled = 0;
        int orphans = 0;
        int failed = 0;
        Set<Long> storedHabits = new HashSet<>();
        for (Reminder reminder : reminders) {
            storedHabits.add(reminder.habitId());
            RowResult result;
            try {
                result = reconcileOne(reminder);
            } catch (RuntimeException e) {
                log.error("Failed to reconcile reminder for habit {} (user {})",
                        reminder.habitId(), reminder.userId(), e);
                result = RowResult.FAILED;
            }
            switch (result) {
                case SCHEDULED -> scheduled++;
                case ORPHAN -> orphans++;
                case FAILED -> failed++;
            }
        }
        cancelStrayJobs(storedHabits);

        log.info("Reminder reconciliation done. scheduled={}, skippedOrphans={}, failed={}",
                scheduled, orphans, failed);
        return new ReconciliationReport(scheduled, orphans, failed);
    }

    /**
     * Reminder triggers whose row is gone, e.g. removed while the stored job id did
     * not match the one the trigger was registered under.
     */
    private void cancelStrayJobs(Set<Long> storedHabits) {
        for (String jobId : jobScheduler.scheduledJobIds()) {
            ReminderJobId.decode(jobId)
                    .filter(id -> !storedHabits.contains(id.habitId()))
                    .ifPresent(id -> {
                        log.warn("Job {} has no stored reminder, cancelling", jobId);
                        jobScheduler.cancel(jobId);
                    });
        }
    }

    private RowResult reconcileOne(Reminder reminder) {
        String expectedJobId = reminder.expectedJobId().encode();
        String storedJobId = reminder.jobId();
        boolean mismatch = storedJobId != null && !storedJobId.equals(expectedJobId);

        Optional<String> habitName = habitLookup.findHabitName(reminder.habitId());
        if (habitName.isEmpty()) {
            log.warn("Habit {} for reminder of user {} is gone, pruning orphan", reminder.habitId(), reminder.userId());
            boolean deleted = reminderStore.removeByHabit(reminder.habitId()).isPresent();
            jobScheduler.cancel(expectedJobId);
            if (mismatch) jobScheduler.cancel(storedJobId);
            if (!deleted && (!reminderStore.isAvailable() || reminderStore.getByHabit(reminder.habitId()).isPresent())) {
                log.error("Could not delete orphan reminder for habit {}, will retry on the next run", reminder.habitId());
                return RowResult.FAILED;
            }
            return RowResult.ORPHAN;
        }

        jobScheduler.cancel(expectedJobId);
        if (mismatch) {
            // Cause of historical mismatches is unknown; clear both slots.
            log.warn("Stored job id '{}' differs from expected '{}' for habit {}, cancelling both",
                    storedJobId, expectedJobId, reminder.habitId());
            jobScheduler.cancel(storedJobId);
        }

        ReminderPayload payload = new ReminderPayload(reminder.userId(), reminder.habitId(), habitName.get());
        if (!jobScheduler.scheduleDaily(expectedJobId, reminder.timeOfDay(), deliveryWorker::deliver, payload)) {
            log.error("Could not schedule job {} for habit {} at {}", expectedJobId, reminder.habitId(), reminder.timeOfDay());
            return RowResult.FAILED;
        }
        log.debug("Scheduled job {} for habit {} at {}", expectedJobId, reminder.habitId(), reminder.timeOfDay());
        return RowResult.SCHEDULED;
    }
}
