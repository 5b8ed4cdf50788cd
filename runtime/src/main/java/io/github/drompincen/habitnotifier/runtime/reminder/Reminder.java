package io.github.drompincen.habitnotifier.runtime.reminder;

import java.time.LocalTime;

public record Reminder(
        String reminderId,
        long userId,
        long habitId,
        LocalTime timeOfDay,
        String jobId
) {
    public ReminderJobId expectedJobId() {
        return ReminderJobId.of(userId, habitId);
    }
}
