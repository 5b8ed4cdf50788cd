package io.github.drompincen.habitnotifier.protocol.api;

public record ReconciliationReport(
        int scheduled,
        int skippedOrphans,
        int failed
) {
    public static ReconciliationReport empty() {
        return new ReconciliationReport(0, 0, 0);
    }

    public int total() {
        return scheduled + skippedOrphans + failed;
    }
}
