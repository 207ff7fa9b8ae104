package com.drivehr.jobsync.sync.model;

public record SyncStatusResponse(
    boolean dbConnectivity,
    boolean webhookEnabled,
    boolean secretConfigured,
    boolean triggerConfigured,
    String webhookPath,
    long activeListings,
    LastSyncStatus lastSync
) {
}
