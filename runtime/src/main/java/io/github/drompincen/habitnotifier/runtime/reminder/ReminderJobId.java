package io.github.drompincen.habitnotifier.runtime.reminder;

import java.util.Optional;

/**
 * Scheduler slot of a habit reminder. Encodes as {@code reminder_<userId>_<habitId>},
 * so the same pair always maps to the same slot across restarts.
 */
public record ReminderJobId(long userId, long habitId) {

    public static final String PREFIX = "reminder_";

    public static ReminderJobId of(long userId, long habitId) {
        return new ReminderJobId(userId, habitId);
    }

    public String encode() {
        return PREFIX + userId + "_" + habitId;
    }

    public static Optional<ReminderJobId> decode(String jobId) {
        if (jobId == null || !jobId.startsWith(PREFIX)) return Optional.empty();
        String[] parts = jobId.substring(PREFIX.length()).split("_", -1);
        if (parts.length != 2) return Optional.empty();
        try {
            return Optional.of(new ReminderJobId(Long.parseLong(parts[0]), Long.parseLong(parts[1])));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return encode();
    }
}
