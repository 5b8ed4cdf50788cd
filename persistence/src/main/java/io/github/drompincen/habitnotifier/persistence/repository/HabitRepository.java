package io.github.drompincen.habitnotifier.persistence.repository;

import io.github.drompincen.habitnotifier.persistence.document.HabitDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface HabitRepository extends MongoRepository<HabitDocument, Long> {
    boolean existsByHabitIdAndUserId(Long habitId, Long userId);
}
