package com.repopulse.syncer.orchestrator;

import java.util.List;

/**
 * Aggregated summary of a synchronization run. Provides convenience methods
 * for querying results by phase and computing overall success/failure counts.
 *
 * @param discoveryStopped {@code true} if new-repository discovery ended on a
 *                         listing failure rather than exhaustion or the limit
 */
public record SyncSummary(
        List<SyncResult> results,
        boolean discoveryStopped,
        long totalDurationMs
) {

    public int successCount() {
        return (int) results.stream().filter(SyncResult::success).count();
    }

    public int failureCount() {
        return (int) results.stream().filter(r -> !r.success()).count();
    }

    public boolean hasFailures() {
        return results.stream().anyMatch(r -> !r.success());
    }

    public int totalRowsWritten() {
        return results.stream().mapToInt(SyncResult::rowsWritten).sum();
    }

    public int rowsWrittenForPhase(String phase) {
        return results.stream()
                .filter(r -> r.phase().equals(phase) && r.success())
                .mapToInt(SyncResult::rowsWritten)
                .sum();
    }

    public long countForPhase(String phase, boolean success) {
        return results.stream()
                .filter(r -> r.phase().equals(phase) && r.success() == success)
                .count();
    }
}
