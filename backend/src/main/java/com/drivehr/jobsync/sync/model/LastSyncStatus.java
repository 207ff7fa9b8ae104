package com.drivehr.jobsync.sync.model;

import java.time.Instant;

public record LastSyncStatus(
    Instant finishedAt,
    boolean succeeded,
    int created,
    int updated,
    int skipped,
    int removed,
    int errorCount,
    String failureMessage
) {
}
