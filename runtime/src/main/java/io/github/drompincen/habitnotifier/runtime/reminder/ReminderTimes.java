package io.github.drompincen.habitnotifier.runtime.reminder;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Naive wall-clock times of day as users type them and as they are stored.
 */
public final class ReminderTimes {

    public static final DateTimeFormatter STORAGE_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private static final Pattern TIME_PATTERN = Pattern.compile("(\\d{1,2}):(\\d{2})(?::(\\d{2}))?");

    private ReminderTimes() {}

    public static Optional<LocalTime> of(int hour, int minute, int second) {
        if (hour < 0 || hour > 23 || minute < 0 || minute > 59 || second < 0 || second > 59) {
            return Optional.empty();
        }
        return Optional.of(LocalTime.of(hour, minute, second));
    }

    /** Accepts {@code H:mm}, {@code HH:mm} and {@code HH:mm:ss}. */
    public static Optional<LocalTime> parse(String text) {
        if (text == null) return Optional.empty();
        Matcher m = TIME_PATTERN.matcher(text.trim());
        if (!m.matches()) return Optional.empty();
        int second = m.group(3) != null ? Integer.parseInt(m.group(3)) : 0;
        return of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), second);
    }

    public static String format(LocalTime time) {
        return time.withNano(0).format(STORAGE_FORMAT);
    }
}
