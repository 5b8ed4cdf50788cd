package io.github.drompincen.habitnotifier.runtime.reminder;

import java.time.ZonedDateTime;

public record ReminderView(Reminder reminder, String habitName, ZonedDateTime nextFireAt) {}
