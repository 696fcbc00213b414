package com.repopulse.syncer.orchestrator;

/**
 * Holds the result of one unit of work of a run: the rank snapshot, or one
 * repository refreshed or ingested. Tracks rows written, errors and duration
 * for summary reporting.
 */
public record SyncResult(
        String phase,
        String repoFullName,
        int rowsWritten,
        boolean success,
        String errorMessage,
        long durationMs
) {

    public static SyncResult success(String phase, String repoFullName, int rowsWritten, long durationMs) {
        return new SyncResult(phase, repoFullName, rowsWritten, true, null, durationMs);
    }

    public static SyncResult failure(String phase, String repoFullName, String error, long durationMs) {
        return new SyncResult(phase, repoFullName, 0, false, error, durationMs);
    }
}
