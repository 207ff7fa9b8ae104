package com.drivehr.jobsync.sync.service;

import com.drivehr.jobsync.sync.model.IncomingListing;
import com.drivehr.jobsync.sync.model.ListingRecordRef;
import com.drivehr.jobsync.sync.model.ReconciliationResult;

/**
 * Synchronous hooks into a reconciliation run. Callbacks run on the request thread, inside the
 * transaction of the phase that triggers them; an exception thrown here fails that phase.
 */
public interface ListingSyncListener {

    /**
     * @param existingRecordId the record about to be overwritten, or {@code null} for an insert
     */
    default void beforeUpsert(IncomingListing listing, Long existingRecordId) {
    }

    default void beforeDelete(ListingRecordRef ref) {
    }

    default void afterDelete(ListingRecordRef ref) {
    }

    default void syncCompleted(ReconciliationResult result) {
    }

    default void syncFailed(Exception failure) {
    }
}
