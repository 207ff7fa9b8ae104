package com.drivehr.jobsync.sync.service;

import com.drivehr.jobsync.sync.model.LastSyncStatus;
import com.drivehr.jobsync.sync.model.ReconciliationResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Remembers the outcome of the most recent reconciliation for the status endpoint.
 */
@Component
public class SyncStatusTracker implements ListingSyncListener {
    private final Clock clock;
    private final AtomicReference<LastSyncStatus> last = new AtomicReference<>();

    public SyncStatusTracker(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void syncCompleted(ReconciliationResult result) {
        last.set(new LastSyncStatus(
            clock.instant(),
            true,
            result.created(),
            result.updated(),
            result.skipped(),
            result.removed(),
            result.errors().size(),
            null
        ));
    }

    @Override
    public void syncFailed(Exception failure) {
        last.set(new LastSyncStatus(clock.instant(), false, 0, 0, 0, 0, 0, failure.getMessage()));
    }

    public LastSyncStatus lastSync() {
        return last.get();
    }
}
