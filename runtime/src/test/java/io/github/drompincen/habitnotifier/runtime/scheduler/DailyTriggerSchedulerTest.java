package io.github.drompincen.habitnotifier.runtime.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DailyTriggerSchedulerTest {

    private static final ZoneId ZONE = ZoneId.of("Europe/Berlin");

    private ThreadPoolTaskScheduler taskScheduler;
    private DailyTriggerScheduler scheduler;

    @BeforeEach
    void setUp() {
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(2);
        taskScheduler.setThreadNamePrefix("test-reminder-");
        taskScheduler.initialize();
        scheduler = new DailyTriggerScheduler(taskScheduler, ZONE);
    }

    @AfterEach
    void tearDown() {
        taskScheduler.shutdown();
    }

    @Test
    void cronExpressionCarriesSecondMinuteHour() {
        assertThat(DailyTriggerScheduler.cronFor(LocalTime.of(8, 30))).isEqualTo("0 30 8 * * *");
        assertThat(DailyTriggerScheduler.cronFor(LocalTime.of(21, 5, 7))).isEqualTo("7 5 21 * * *");
    }

    @Test
    void scheduleRegistersJobWithNextFireInZone() {
        boolean ok = scheduler.scheduleDaily("reminder_42_7", LocalTime.of(8, 30), p -> {}, "payload");

        assertThat(ok).isTrue();
        assertThat(scheduler.isScheduled("reminder_42_7")).isTrue();
        Optional<ZonedDateTime> next = scheduler.nextFireTime("reminder_42_7");
        assertThat(next).isPresent();
        assertThat(next.get().getZone()).isEqualTo(ZONE);
        assertThat(next.get().toLocalTime()).isEqualTo(LocalTime.of(8, 30));
        assertThat(next.get()).isAfter(ZonedDateTime.now(ZONE));
        assertThat(next.get()).isBefore(ZonedDateTime.now(ZONE).plusDays(1).plusHours(1));
    }

    @Test
    void reschedulingSameIdReplacesTrigger() {
        scheduler.scheduleDaily("reminder_42_7", LocalTime.of(8, 30), p -> {}, "a");
        scheduler.scheduleDaily("reminder_42_7", LocalTime.of(9, 15), p -> {}, "b");

        assertThat(scheduler.scheduledJobIds()).containsExactly("reminder_42_7");
        assertThat(scheduler.nextFireTime("reminder_42_7")).get()
                .extracting(ZonedDateTime::toLocalTime).isEqualTo(LocalTime.of(9, 15));
    }

    @Test
    void nullTimeIsRejected() {
        assertThat(scheduler.scheduleDaily("reminder_42_7", null, p -> {}, "a")).isFalse();
        assertThat(scheduler.isScheduled("reminder_42_7")).isFalse();
    }

    @Test
    void blankIdIsRejected() {
        assertThat(scheduler.scheduleDaily(" ", LocalTime.NOON, p -> {}, "a")).isFalse();
        assertThat(scheduler.scheduledJobIds()).isEmpty();
    }

    @Test
    void cancelRemovesTriggerAndIsSafeOnUnknownIds() {
        scheduler.scheduleDaily("reminder_42_7", LocalTime.of(8, 30), p -> {}, "a");

        assertThat(scheduler.cancel("reminder_42_7")).isTrue();
        assertThat(scheduler.cancel("reminder_42_7")).isFalse();
        assertThat(scheduler.cancel("reminder_1_1")).isFalse();
        assertThat(scheduler.cancel(null)).isFalse();
        assertThat(scheduler.nextFireTime("reminder_42_7")).isEmpty();
    }

    @Test
    void registrationAfterShutdownReturnsFalse() {
        taskScheduler.shutdown();

        assertThat(scheduler.scheduleDaily("reminder_42_7", LocalTime.of(8, 30), p -> {}, "a")).isFalse();
        assertThat(scheduler.isScheduled("reminder_42_7")).isFalse();
    }

    @Test
    void triggerFiresCallbackWithPayload() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);
        List<String> received = new CopyOnWriteArrayList<>();
        LocalTime soon = LocalTime.now(ZONE).plusSeconds(2).withNano(0);

        scheduler.scheduleDaily("reminder_42_7", soon, (String p) -> {
            received.add(p);
            fired.countDown();
        }, "habit-7");

        assertThat(fired.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(received).containsExactly("habit-7");
    }

    @Test
    void failingCallbackDoesNotUnregisterJob() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);
        LocalTime soon = LocalTime.now(ZONE).plusSeconds(2).withNano(0);

        scheduler.scheduleDaily("reminder_42_7", soon, p -> {
            fired.countDown();
            throw new IllegalStateException("boom");
        }, "a");

        assertThat(fired.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(scheduler.isScheduled("reminder_42_7")).isTrue();
    }
}
