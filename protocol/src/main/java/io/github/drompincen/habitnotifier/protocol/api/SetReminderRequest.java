package io.github.drompincen.habitnotifier.protocol.api;

/**
 * Body of a set-reminder call. {@code time} is a wall-clock time such as
 * {@code 08:30} or {@code 08:30:00}.
 */
public record SetReminderRequest(String time) {}
