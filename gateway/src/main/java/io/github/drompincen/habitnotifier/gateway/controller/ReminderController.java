package io.github.drompincen.habitnotifier.gateway.controller;

import io.github.drompincen.habitnotifier.protocol.api.ReconciliationReport;
import io.github.drompincen.habitnotifier.protocol.api.ReminderDto;
import io.github.drompincen.habitnotifier.protocol.api.SetReminderRequest;
import io.github.drompincen.habitnotifier.runtime.reconcile.ReconciliationService;
import io.github.drompincen.habitnotifier.runtime.reminder.Reminder;
import io.github.drompincen.habitnotifier.runtime.reminder.ReminderService;
import io.github.drompincen.habitnotifier.runtime.reminder.ReminderTimes;
import io.github.drompincen.habitnotifier.runtime.reminder.ReminderView;
import io.github.drompincen.habitnotifier.runtime.scheduler.JobScheduler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

@RestController
public class ReminderController {

    private final ReminderService reminderService;
    private final ReconciliationService reconciliationService;
    private final JobScheduler jobScheduler;

    public ReminderController(ReminderService reminderService,
                              ReconciliationService reconciliationService,
                              JobScheduler jobScheduler) {
        this.reminderService = reminderService;
        this.reconciliationService = reconciliationService;
        this.jobScheduler = jobScheduler;
    }

    @PutMapping("/api/users/{userId}/habits/{habitId}/reminder")
    public ResponseEntity<ReminderDto> set(@PathVariable long userId,
                                           @PathVariable long habitId,
                                           @RequestBody SetReminderRequest req) {
        Optional<LocalTime> time = ReminderTimes.parse(req != null ? req.time() : null);
        if (time.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        return reminderService.setReminder(userId, habitId, time.get())
                .map(r -> ResponseEntity.ok(toDto(r, null)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.CONFLICT).build());
    }

    @GetMapping("/api/users/{userId}/reminders")
    public List<ReminderDto> list(@PathVariable long userId) {
        return reminderService.listReminders(userId).stream()
                .map(this::toDto)
                .toList();
    }

    @DeleteMapping("/api/habits/{habitId}/reminder")
    public ResponseEntity<Void> delete(@PathVariable long habitId) {
        if (reminderService.removeReminder(habitId)) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.notFound().build();
    }

    @PostMapping("/api/habits/{habitId}/deleted")
    public ResponseEntity<Void> habitDeleted(@PathVariable long habitId) {
        reminderService.habitDeleted(habitId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/api/reminders/reconcile")
    public ReconciliationReport reconcile() {
        return reconciliationService.reconcile();
    }

    private ReminderDto toDto(ReminderView view) {
        Reminder r = view.reminder();
        return new ReminderDto(r.habitId(), r.userId(), view.habitName(), ReminderTimes.format(r.timeOfDay()),
                r.expectedJobId().encode(), view.nextFireAt() != null ? view.nextFireAt().toInstant() : null);
    }

    private ReminderDto toDto(Reminder r, String habitName) {
        String jobId = r.expectedJobId().encode();
        return new ReminderDto(r.habitId(), r.userId(), habitName, ReminderTimes.format(r.timeOfDay()), jobId,
                jobScheduler.nextFireTime(jobId).map(ZonedDateTime::toInstant).orElse(null));
    }
}
