package com.drivehr.jobsync.sync.persistence;

import com.drivehr.jobsync.sync.model.JobListingView;
import com.drivehr.jobsync.sync.model.ListingRecord;
import com.drivehr.jobsync.sync.model.ListingRecordRef;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent job listings keyed by the upstream job id. Trashed records are invisible to every
 * lookup here. Callers demarcate transactions; implementations join whatever transaction is
 * active on the calling thread.
 */
public interface ListingStore {

    /**
     * Record ids of the non-trashed listings holding any of the given job ids, in one query. When a
     * job id has several records the lowest record id wins.
     */
    Map<String, Long> findRecordIdsByJobIds(Collection<String> jobIds);

    /**
     * Inserts a listing when {@code existingRecordId} is null, otherwise overwrites every field of
     * that record in place.
     *
     * @return the record id written
     */
    long upsert(ListingRecord listing, Long existingRecordId);

    /**
     * Every non-trashed record, ordered by record id.
     */
    List<ListingRecordRef> findAllActiveRefs();

    /**
     * Permanently removes the record.
     *
     * @return {@code true} when a row was deleted
     */
    boolean hardDelete(long recordId);

    List<JobListingView> findListings(String department, String location, int limit);

    Optional<JobListingView> findByJobId(String jobId);

    long countActive();

    boolean isDbReachable();
}
