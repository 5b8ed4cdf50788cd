package io.github.drompincen.habitnotifier.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReminderDto(
        long habitId,
        long userId,
        String habitName,
        String reminderTime,
        String jobId,
        Instant nextFireAt
) {}
