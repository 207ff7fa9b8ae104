package com.drivehr.jobsync.sync.service;

import com.drivehr.jobsync.config.JobSyncProperties;
import com.drivehr.jobsync.sync.model.IncomingListing;
import com.drivehr.jobsync.sync.model.ListingRecord;
import com.drivehr.jobsync.sync.model.ListingRecordRef;
import com.drivehr.jobsync.sync.model.ReconciliationResult;
import com.drivehr.jobsync.sync.persistence.ListingStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.NonTransientDataAccessException;
import org.springframework.dao.NonTransientDataAccessResourceException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reconciles a full snapshot of upstream listings against the listing store.
 *
 * <p>Upserts run in one READ_COMMITTED transaction with a savepoint per item, so a bad item is
 * rolled back alone while a resource or commit failure rolls back the whole batch. Stale records
 * are then hard-deleted in a second, independent transaction.
 */
@Service
public class ListingReconciliationService {
    private static final Logger log = LoggerFactory.getLogger(ListingReconciliationService.class);
    static final String MSG_STORE_FAILED = "Failed to store listing";

    private final ListingStore store;
    private final ListingSanitizer sanitizer;
    private final JobSyncProperties properties;
    private final Clock clock;
    private final List<ListingSyncListener> listeners;
    private final TransactionTemplate batchTransaction;
    private final TransactionTemplate itemTransaction;
    private final TransactionTemplate removalTransaction;

    public ListingReconciliationService(
        ListingStore store,
        ListingSanitizer sanitizer,
        JobSyncProperties properties,
        Clock clock,
        PlatformTransactionManager transactionManager,
        ObjectProvider<ListingSyncListener> listeners
    ) {
        this.store = store;
        this.sanitizer = sanitizer;
        this.properties = properties;
        this.clock = clock;
        this.listeners = listeners.orderedStream().toList();

        this.batchTransaction = new TransactionTemplate(transactionManager);
        this.batchTransaction.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.batchTransaction.setName("listing-sync-upsert");

        this.itemTransaction = new TransactionTemplate(transactionManager);
        this.itemTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);

        this.removalTransaction = new TransactionTemplate(transactionManager);
        this.removalTransaction.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.removalTransaction.setName("listing-sync-removal");
    }

    public ReconciliationResult reconcile(List<JsonNode> items) {
        Instant syncedAt = clock.instant();
        List<JsonNode> batch = items == null ? List.of() : items;
        activity("Listing sync started: {} item(s)", batch.size());
        try {
            ReconciliationResult result = runPhases(batch, syncedAt);
            activity(
                "Listing sync finished: created={} updated={} skipped={} removed={} errors={}",
                result.created(),
                result.updated(),
                result.skipped(),
                result.removed(),
                result.errors().size()
            );
            if (!result.removedJobIds().isEmpty()) {
                activity("Removed stale listings: {}", result.removedJobIds());
            }
            listeners.forEach(listener -> listener.syncCompleted(result));
            return result;
        } catch (ListingSyncException e) {
            log.error("Listing sync failed during {} phase: {}", e.getPhase(), e.getMessage(), e);
            listeners.forEach(listener -> listener.syncFailed(e));
            throw e;
        }
    }

    private ReconciliationResult runPhases(List<JsonNode> batch, Instant syncedAt) {
        Set<String> currentJobIds = new LinkedHashSet<>();
        for (JsonNode node : batch) {
            if (node != null && node.isObject()) {
                String jobId = validJobId(IncomingListing.from((ObjectNode) node));
                if (jobId != null) {
                    currentJobIds.add(jobId);
                }
            }
        }

        UpsertTally tally;
        try {
            tally = batchTransaction.execute(status -> upsertAll(batch, currentJobIds, syncedAt));
        } catch (DataAccessException | TransactionException e) {
            throw new ListingSyncException(
                ListingSyncException.Phase.UPSERT,
                "Listing upserts rolled back: " + e.getMessage(),
                e
            );
        }
        if (tally == null) {
            tally = new UpsertTally();
        }

        List<String> removedJobIds;
        try {
            removedJobIds = removalTransaction.execute(status -> removeStale(currentJobIds));
        } catch (DataAccessException | TransactionException e) {
            throw new ListingSyncException(
                ListingSyncException.Phase.REMOVAL,
                "Stale listing removal rolled back: " + e.getMessage(),
                e
            );
        }

        return new ReconciliationResult(
            tally.created,
            tally.updated,
            tally.skipped,
            batch.size(),
            List.copyOf(tally.errors),
            removedJobIds == null ? List.of() : List.copyOf(removedJobIds),
            OffsetDateTime.now(clock),
            properties.getSyncSourceTag()
        );
    }

    private UpsertTally upsertAll(List<JsonNode> batch, Set<String> currentJobIds, Instant syncedAt) {
        UpsertTally tally = new UpsertTally();
        // job id -> record id; grows as this batch creates records so duplicates update them
        Map<String, Long> known = new HashMap<>(store.findRecordIdsByJobIds(currentJobIds));

        for (int index = 0; index < batch.size(); index++) {
            JsonNode node = batch.get(index);
            if (node == null || !node.isObject()) {
                tally.skipped++;
                tally.errors.add("Job at index " + index + ": Invalid job data format");
                continue;
            }
            IncomingListing listing = IncomingListing.from((ObjectNode) node);
            String jobId = validJobId(listing);
            if (jobId == null) {
                tally.errors.add("Job '" + listing.idOrUnknown()
                    + "': Missing required fields: id and title are required");
                continue;
            }

            Long existingRecordId = known.get(jobId);
            try {
                Long written = itemTransaction.execute(status -> {
                    listeners.forEach(listener -> listener.beforeUpsert(listing, existingRecordId));
                    ListingRecord record = sanitizer.sanitize(listing, syncedAt);
                    return store.upsert(record, existingRecordId);
                });
                if (existingRecordId == null) {
                    tally.created++;
                    if (written != null) {
                        known.put(jobId, written);
                    }
                } else {
                    tally.updated++;
                }
            } catch (NonTransientDataAccessResourceException e) {
                throw e;
            } catch (NonTransientDataAccessException e) {
                log.warn("Listing {} rolled back to its savepoint: {}", jobId, e.getMessage(), e);
                tally.errors.add("Job '" + listing.idOrUnknown() + "': " + MSG_STORE_FAILED);
            }
        }
        return tally;
    }

    private List<String> removeStale(Set<String> currentJobIds) {
        List<String> removed = new ArrayList<>();
        // refs arrive in record id order, so the first one seen per job id is the canonical record
        Set<String> kept = new HashSet<>();
        for (ListingRecordRef ref : store.findAllActiveRefs()) {
            if (currentJobIds.contains(ref.jobId())) {
                if (kept.add(ref.jobId())) {
                    continue;
                }
                log.warn("Removing duplicate record {} for listing {}", ref.recordId(), ref.jobId());
                delete(ref);
                continue;
            }
            if (delete(ref)) {
                removed.add(ref.jobId());
            }
        }
        return removed;
    }

    private boolean delete(ListingRecordRef ref) {
        listeners.forEach(listener -> listener.beforeDelete(ref));
        if (!store.hardDelete(ref.recordId())) {
            return false;
        }
        listeners.forEach(listener -> listener.afterDelete(ref));
        return true;
    }

    /**
     * Sanitized job id of a listing that carries both an id and a title, otherwise {@code null}.
     */
    private String validJobId(IncomingListing listing) {
        if (!listing.hasRequiredFields() || sanitizer.plainText(listing.title()) == null) {
            return null;
        }
        return sanitizer.plainText(listing.id());
    }

    private void activity(String format, Object... args) {
        if (properties.isDebugLogging()) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }

    private static final class UpsertTally {
        private int created;
        private int updated;
        private int skipped;
        private final List<String> errors = new ArrayList<>();
    }
}
