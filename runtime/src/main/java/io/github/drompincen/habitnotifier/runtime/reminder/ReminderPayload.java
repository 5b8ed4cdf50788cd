package io.github.drompincen.habitnotifier.runtime.reminder;

/**
 * Data handed to the delivery callback when a trigger fires. {@code habitName} may be
 * null, in which case it is looked up at fire time.
 */
public record ReminderPayload(long userId, long habitId, String habitName) {}
