package io.github.drompincen.habitnotifier.runtime.habit;

import java.util.Optional;

public interface HabitLookup {

    /**
     * @return the display name, empty when the habit does not exist
     */
    Optional<String> findHabitName(long habitId);
}
