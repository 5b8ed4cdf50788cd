package io.github.drompincen.habitnotifier.runtime.habit;

import io.github.drompincen.habitnotifier.persistence.document.HabitDocument;
import io.github.drompincen.habitnotifier.persistence.repository.HabitRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoHabitLookupTest {

    @Mock private HabitRepository habitRepository;
    @InjectMocks private MongoHabitLookup habitLookup;

    @Test
    void returnsNameOfExistingHabit() {
        when(habitRepository.findById(7L)).thenReturn(Optional.of(habit(7L, "Drink water")));

        assertThat(habitLookup.findHabitName(7)).contains("Drink water");
    }

    @Test
    void unnamedHabitStillExists() {
        when(habitRepository.findById(7L)).thenReturn(Optional.of(habit(7L, null)));

        assertThat(habitLookup.findHabitName(7)).contains("Habit #7");
    }

    @Test
    void deletedHabitIsEmpty() {
        when(habitRepository.findById(7L)).thenReturn(Optional.empty());

        assertThat(habitLookup.findHabitName(7)).isEmpty();
    }

    private HabitDocument habit(Long id, String name) {
        HabitDocument doc = new HabitDocument();
        doc.setHabitId(id);
        doc.setUserId(42L);
        doc.setName(name);
        return doc;
    }
}
