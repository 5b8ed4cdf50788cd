package io.github.drompincen.habitnotifier.persistence.document;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class HabitDocumentTest {

    @Test
    void habitFieldsPreserved() {
        HabitDocument doc = new HabitDocument();
        doc.setHabitId(7L);
        doc.setUserId(42L);
        doc.setName("Read 20 pages");
        doc.setCreatedAt(Instant.EPOCH);

        assertThat(doc.getHabitId()).isEqualTo(7L);
        assertThat(doc.getUserId()).isEqualTo(42L);
        assertThat(doc.getName()).isEqualTo("Read 20 pages");
        assertThat(doc.getCreatedAt()).isEqualTo(Instant.EPOCH);
    }

    @Test
    void userConstructorSetsFields() {
        UserDocument user = new UserDocument(42L, Instant.EPOCH);

        assertThat(user.getUserId()).isEqualTo(42L);
        assertThat(user.getCreatedAt()).isEqualTo(Instant.EPOCH);
    }
}
