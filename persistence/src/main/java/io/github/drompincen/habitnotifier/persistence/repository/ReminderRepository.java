package io.github.drompincen.habitnotifier.persistence.repository;

import io.github.drompincen.habitnotifier.persistence.document.ReminderDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface ReminderRepository extends MongoRepository<ReminderDocument, String> {
    Optional<ReminderDocument> findByHabitId(Long habitId);
    List<ReminderDocument> findByUserIdOrderByReminderTimeAsc(Long userId);
    List<ReminderDocument> findAllByOrderByUserIdAscReminderTimeAsc();
    long deleteByHabitId(Long habitId);
}
