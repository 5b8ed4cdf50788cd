package io.github.drompincen.habitnotifier.runtime.habit;

import io.github.drompincen.habitnotifier.persistence.document.HabitDocument;
import io.github.drompincen.habitnotifier.persistence.repository.HabitRepository;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class MongoHabitLookup implements HabitLookup {

    private final HabitRepository habitRepository;

    public MongoHabitLookup(HabitRepository habitRepository) {
        this.habitRepository = habitRepository;
    }

    @Override
    public Optional<String> findHabitName(long habitId) {
        // An unnamed habit still exists; only a missing document means deleted.
        return habitRepository.findById(habitId).map(h -> nameOf(h, habitId));
    }

    private static String nameOf(HabitDocument habit, long habitId) {
        String name = habit.getName();
        return name == null || name.isBlank() ? "Habit #" + habitId : name;
    }
}
