package io.github.drompincen.habitnotifier.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Habits are written by the habit CRUD flows; the reminder subsystem only reads them.
 */
@Document(collection = "habits")
public class HabitDocument {

    @Id
    private Long habitId;

    @Indexed
    private Long userId;

    private String name;
    private Instant createdAt;

    public HabitDocument() {}

    public Long getHabitId() { return habitId; }
    public void setHabitId(Long habitId) { this.habitId = habitId; }

    public Long getUserId() { return userId; }
    public void setUserId(Long userId) { this.userId = userId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
