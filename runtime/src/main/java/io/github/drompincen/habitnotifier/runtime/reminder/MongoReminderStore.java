package io.github.drompincen.habitnotifier.runtime.reminder;

import io.github.drompincen.habitnotifier.persistence.document.ReminderDocument;
import io.github.drompincen.habitnotifier.persistence.document.UserDocument;
import io.github.drompincen.habitnotifier.persistence.repository.HabitRepository;
import io.github.drompincen.habitnotifier.persistence.repository.ReminderRepository;
import io.github.drompincen.habitnotifier.persistence.repository.UserRepository;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

@Service
public class MongoReminderStore implements ReminderStore {

    private static final Logger log = LoggerFactory.getLogger(MongoReminderStore.class);

    private final ReminderRepository reminderRepository;
    private final UserRepository userRepository;
    private final HabitRepository habitRepository;
    private final MongoTemplate mongoTemplate;
    private final long timeoutMs;

    // One caller at a time against the connection.
    private final ReentrantLock lock = new ReentrantLock(true);

    public MongoReminderStore(ReminderRepository reminderRepository,
                              UserRepository userRepository,
                              HabitRepository habitRepository,
                              MongoTemplate mongoTemplate,
                              @Value("${habitnotifier.store.timeout-ms:5000}") long timeoutMs) {
        this.reminderRepository = reminderRepository;
        this.userRepository = userRepository;
        this.habitRepository = habitRepository;
        this.mongoTemplate = mongoTemplate;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public boolean upsert(long userId, long habitId, LocalTime timeOfDay, String jobId) {
        if (timeOfDay == null || jobId == null) {
            log.error("Refusing reminder for habit {}: time={}, jobId={}", habitId, timeOfDay, jobId);
            return false;
        }
        String time = ReminderTimes.format(timeOfDay);
        return withStore("upsert habit " + habitId, false, () -> {
            ensureUser(userId);
            if (!habitRepository.existsByHabitIdAndUserId(habitId, userId)) {
                log.warn("Habit {} is not owned by user {} (or no longer exists), reminder not saved", habitId, userId);
                return false;
            }
            Instant now = Instant.now();
            Update update = new Update()
                    .set("userId", userId)
                    .set("reminderTime", time)
                    .set("jobId", jobId)
                    .set("updatedAt", now)
                    .setOnInsert("createdAt", now);
            mongoTemplate.upsert(query(where("habitId").is(habitId)), update, ReminderDocument.class);
            log.info("Saved reminder for habit {} (job {}) user {} at {}", habitId, jobId, userId, time);
            return true;
        });
    }

    @Override
    public Optional<Reminder> getByHabit(long habitId) {
        return withStore("get habit " + habitId, Optional.<Reminder>empty(),
                () -> reminderRepository.findByHabitId(habitId).flatMap(this::toReminder));
    }

    @Override
    public List<Reminder> getAll() {
        return withStore("get all", List.<Reminder>of(), () ->
                reminderRepository.findAllByOrderByUserIdAscReminderTimeAsc().stream()
                        .map(this::toReminder)
                        .flatMap(Optional::stream)
                        .toList());
    }

    @Override
    public List<Reminder> getByUser(long userId) {
        return withStore("get user " + userId, List.<Reminder>of(), () ->
                reminderRepository.findByUserIdOrderByReminderTimeAsc(userId).stream()
                        .map(this::toReminder)
                        .flatMap(Optional::stream)
                        .toList());
    }

    @Override
    public Optional<String> removeByHabit(long habitId) {
        return withStore("remove habit " + habitId, Optional.<String>empty(), () -> {
            Optional<ReminderDocument> existing = reminderRepository.findByHabitId(habitId);
            if (existing.isEmpty()) {
                log.debug("No reminder stored for habit {}", habitId);
                return Optional.empty();
            }
            String jobId = existing.get().getJobId();
            long deleted = reminderRepository.deleteByHabitId(habitId);
            if (deleted == 0) {
                log.warn("Reminder for habit {} (job {}) vanished before delete", habitId, jobId);
                return Optional.empty();
            }
            log.info("Removed reminder for habit {} (job {})", habitId, jobId);
            return Optional.ofNullable(jobId);
        });
    }

    @Override
    public boolean isAvailable() {
        return withStore("ping", false, () -> {
            mongoTemplate.executeCommand(new Document("ping", 1));
            return true;
        });
    }

    private void ensureUser(long userId) {
        if (!userRepository.existsById(userId)) {
            userRepository.save(new UserDocument(userId, Instant.now()));
            log.info("New user {}", userId);
        }
    }

    private Optional<Reminder> toReminder(ReminderDocument doc) {
        if (doc.getHabitId() == null || doc.getUserId() == null) {
            log.warn("Skipping reminder {} without habit or user id", doc.getReminderId());
            return Optional.empty();
        }
        Optional<LocalTime> time = ReminderTimes.parse(doc.getReminderTime());
        if (time.isEmpty()) {
            log.warn("Skipping reminder for habit {}: invalid stored time '{}'", doc.getHabitId(), doc.getReminderTime());
            return Optional.empty();
        }
        return Optional.of(new Reminder(doc.getReminderId(), doc.getUserId(), doc.getHabitId(),
                time.get(), doc.getJobId()));
    }

    private <T> T withStore(String operation, T fallback, Supplier<T> action) {
        try {
            if (!lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.error("Store {} timed out after {} ms waiting for the connection", operation, timeoutMs);
                return fallback;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Store {} interrupted while waiting for the connection", operation);
            return fallback;
        }
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Store {} failed: {}", operation, e.getMessage(), e);
            return fallback;
        } catch (RuntimeException e) {
            log.error("Unexpected error during store {}", operation, e);
            return fallback;
        } finally {
            lock.unlock();
        }
    }
}
