package io.github.drompincen.habitnotifier.gateway.bootstrap;

import io.github.drompincen.habitnotifier.protocol.api.ReconciliationReport;
import io.github.drompincen.habitnotifier.runtime.reconcile.ReconciliationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Rebuilds reminder triggers once the application is up. Triggers live only in
 * memory, so without this pass no reminder would fire after a restart.
 */
@Component
public class ReminderBootstrap {

    private static final Logger log = LoggerFactory.getLogger(ReminderBootstrap.class);

    private final ReconciliationService reconciliationService;
    private final boolean enabled;

    public ReminderBootstrap(ReconciliationService reconciliationService,
                             @Value("${habitnotifier.reconcile-on-startup:true}") boolean enabled) {
        this.reconciliationService = reconciliationService;
        this.enabled = enabled;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!enabled) {
            log.info("Startup reconciliation disabled");
            return;
        }
        try {
            ReconciliationReport report = reconciliationService.reconcile();
            log.info("Startup reconciliation: {} scheduled, {} orphans pruned, {} failed",
                    report.scheduled(), report.skippedOrphans(), report.failed());
        } catch (RuntimeException e) {
            log.error("Startup reconciliation failed, reminders will not fire until it is re-run", e);
        }
    }
}
