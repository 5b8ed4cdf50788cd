package io.github.drompincen.habitnotifier.runtime.reminder;

import io.github.drompincen.habitnotifier.runtime.delivery.DeliveryWorker;
import io.github.drompincen.habitnotifier.runtime.habit.HabitLookup;
import io.github.drompincen.habitnotifier.runtime.scheduler.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Explicit reminder actions requested by a user: set, view and delete.
 */
@Service
public class ReminderService {

    private static final Logger log = LoggerFactory.getLogger(ReminderService.class);

    private final ReminderStore reminderStore;
    private final HabitLookup habitLookup;
    private final JobScheduler jobScheduler;
    private final DeliveryWorker deliveryWorker;
    private final ReminderRemovalService removalService;

    public ReminderService(ReminderStore reminderStore,
                           HabitLookup habitLookup,
                           JobScheduler jobScheduler,
                           DeliveryWorker deliveryWorker,
                           ReminderRemovalService removalService) {
        this.reminderStore = reminderStore;
        this.habitLookup = habitLookup;
        this.jobScheduler = jobScheduler;
        this.deliveryWorker = deliveryWorker;
        this.removalService = removalService;
    }

    /**
     * Registers the trigger first, then persists. If the row cannot be saved the new
     * trigger is withdrawn and the previously stored time, if any, is put back.
     */
    public Optional<Reminder> setReminder(long userId, long habitId, LocalTime timeOfDay) {
        if (timeOfDay == null) return Optional.empty();
        Optional<String> habitName;
        try {
            habitName = habitLookup.findHabitName(habitId);
        } catch (RuntimeException e) {
            log.error("Could not look up habit {} for user {}", habitId, userId, e);
            return Optional.empty();
        }
        if (habitName.isEmpty()) {
            log.warn("User {} tried to set a reminder on missing habit {}", userId, habitId);
            return Optional.empty();
        }

        String jobId = ReminderJobId.of(userId, habitId).encode();
        Optional<Reminder> previous = reminderStore.getByHabit(habitId);
        ReminderPayload payload = new ReminderPayload(userId, habitId, habitName.get());
        log.info("User {} sets reminder {} for habit {} ('{}')", userId, ReminderTimes.format(timeOfDay), habitId, habitName.get());

        if (!jobScheduler.scheduleDaily(jobId, timeOfDay, deliveryWorker::deliver, payload)) {
            return Optional.empty();
        }
        if (!reminderStore.upsert(userId, habitId, timeOfDay, jobId)) {
            log.error("Reminder for habit {} not saved, withdrawing job {}", habitId, jobId);
            jobScheduler.cancel(jobId);
            previous.filter(p -> p.userId() == userId)
                    .ifPresent(p -> jobScheduler.scheduleDaily(jobId, p.timeOfDay(), deliveryWorker::deliver, payload));
            return Optional.empty();
        }
        return reminderStore.getByHabit(habitId)
                .or(() -> Optional.of(new Reminder(null, userId, habitId, timeOfDay, jobId)));
    }

    public boolean removeReminder(long habitId) {
        log.info("Removing reminder for habit {}", habitId);
        return removalService.removeByHabit(habitId);
    }

    /**
     * Cascade for a habit deleted through the habit flows.
     */
    public void habitDeleted(long habitId) {
        if (removalService.removeByHabit(habitId)) {
            log.info("Removed reminder of deleted habit {}", habitId);
        }
    }

    public List<ReminderView> listReminders(long userId) {
        List<ReminderView> views = new ArrayList<>();
        for (Reminder reminder : reminderStore.getByUser(userId)) {
            String name;
            try {
                Optional<String> found = habitLookup.findHabitName(reminder.habitId());
                if (found.isEmpty()) {
                    log.warn("Reminder for deleted habit {} (user {}), skipping", reminder.habitId(), userId);
                    continue;
                }
                name = found.get();
            } catch (RuntimeException e) {
                log.error("Could not look up habit {} for user {}: {}", reminder.habitId(), userId, e.getMessage());
                continue;
            }
            views.add(new ReminderView(reminder, name,
                    jobScheduler.nextFireTime(reminder.expectedJobId().encode()).orElse(null)));
        }
        return views;
    }
}
