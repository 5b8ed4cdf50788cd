package io.github.drompincen.habitnotifier.runtime.delivery;

import io.github.drompincen.habitnotifier.runtime.habit.HabitLookup;
import io.github.drompincen.habitnotifier.runtime.notification.DeliveryResult;
import io.github.drompincen.habitnotifier.runtime.notification.NotificationChannel;
import io.github.drompincen.habitnotifier.runtime.reminder.ReminderJobId;
import io.github.drompincen.habitnotifier.runtime.reminder.ReminderPayload;
import io.github.drompincen.habitnotifier.runtime.reminder.ReminderRemovalService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Body of a reminder trigger. Sends one notification per fire and removes the
 * reminder when the habit is gone or the recipient can never be reached.
 */
@Service
public class DeliveryWorker {

    private static final Logger log = LoggerFactory.getLogger(DeliveryWorker.class);

    static final String DEFAULT_HABIT_NAME = "this habit";
    static final String MESSAGE_TEMPLATE = "🔔 Reminder: time for '%s'!";

    private final HabitLookup habitLookup;
    private final NotificationChannel notificationChannel;
    private final ReminderRemovalService removalService;
    private final Executor deliveryExecutor;
    private final long timeoutMs;

    public DeliveryWorker(HabitLookup habitLookup,
                          NotificationChannel notificationChannel,
                          ReminderRemovalService removalService,
                          @Qualifier("deliveryExecutor") Executor deliveryExecutor,
                          @Value("${habitnotifier.delivery.timeout-ms:10000}") long timeoutMs) {
        this.habitLookup = habitLookup;
        this.notificationChannel = notificationChannel;
        this.removalService = removalService;
        this.deliveryExecutor = deliveryExecutor;
        this.timeoutMs = timeoutMs;
    }

    public DeliveryOutcome deliver(ReminderPayload payload) {
        if (payload == null) {
            log.error("Reminder fired without payload");
            return DeliveryOutcome.REJECTED;
        }
        String jobId = ReminderJobId.of(payload.userId(), payload.habitId()).encode();

        String habitName = payload.habitName();
        if (habitName == null || habitName.isBlank()) {
            try {
                Optional<String> found = habitLookup.findHabitName(payload.habitId());
                if (found.isEmpty()) {
                    log.warn("Habit {} not found for job {}, removing reminder", payload.habitId(), jobId);
                    removalService.removeByHabit(payload.habitId(), jobId);
                    return DeliveryOutcome.REMOVED_ORPHAN;
                }
                habitName = found.get();
            } catch (RuntimeException e) {
                log.error("Could not look up habit {} for job {}, using default name: {}",
                        payload.habitId(), jobId, e.getMessage());
                habitName = DEFAULT_HABIT_NAME;
            }
        }

        log.info("Running reminder job {} for user {} habit {} ('{}')",
                jobId, payload.userId(), payload.habitId(), habitName);
        DeliveryResult result = sendWithTimeout(payload.userId(), String.format(MESSAGE_TEMPLATE, habitName));

        return switch (result.status()) {
            case SUCCESS -> {
                log.info("Reminder sent for job {}", jobId);
                yield DeliveryOutcome.SENT;
            }
            case PERMANENT_FAILURE -> {
                log.warn("User {} cannot receive reminders ({}), removing job {}",
                        payload.userId(), result.detail(), jobId);
                removalService.removeByHabit(payload.habitId(), jobId);
                yield DeliveryOutcome.REMOVED_UNDELIVERABLE;
            }
            default -> {
                log.error("Reminder for job {} not delivered to user {}: {}",
                        jobId, payload.userId(), result.detail());
                yield DeliveryOutcome.FAILED_TRANSIENT;
            }
        };
    }

    private DeliveryResult sendWithTimeout(long userId, String text) {
        CompletableFuture<DeliveryResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> notificationChannel.send(userId, text), deliveryExecutor);
        } catch (RuntimeException e) {
            return DeliveryResult.transientFailure("delivery executor rejected send: " + e.getMessage());
        }
        try {
            DeliveryResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return result != null ? result : DeliveryResult.transientFailure("channel returned no result");
        } catch (TimeoutException e) {
            future.cancel(true);
            return DeliveryResult.transientFailure("timed out after " + timeoutMs + " ms");
        } catch (ExecutionException e) {
            log.error("Notification channel failed for user {}", userId, e.getCause());
            return DeliveryResult.transientFailure(String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeliveryResult.transientFailure("interrupted");
        }
    }
}
