package com.drivehr.jobsync.sync.service;

import com.drivehr.jobsync.config.JobSyncProperties;
import com.drivehr.jobsync.sync.model.JobListingView;
import com.drivehr.jobsync.sync.model.SyncStatusResponse;
import com.drivehr.jobsync.sync.persistence.ListingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@Service
public class SyncStatusService {
    private static final Logger log = LoggerFactory.getLogger(SyncStatusService.class);

    private final ListingStore store;
    private final JobSyncProperties properties;
    private final SyncStatusTracker tracker;

    public SyncStatusService(ListingStore store, JobSyncProperties properties, SyncStatusTracker tracker) {
        this.store = store;
        this.properties = properties;
        this.tracker = tracker;
    }

    public SyncStatusResponse getStatus() {
        boolean dbConnected;
        long active = 0L;
        try {
            dbConnected = store.isDbReachable();
            if (dbConnected) {
                active = store.countActive();
            }
        } catch (DataAccessException e) {
            log.warn("Listing store unreachable: {}", e.getMessage());
            dbConnected = false;
        }
        return new SyncStatusResponse(
            dbConnected,
            properties.isEnabled(),
            properties.isSecretConfigured(),
            properties.getTrigger().isConfigured(),
            properties.getWebhookPath(),
            active,
            tracker.lastSync()
        );
    }

    public List<JobListingView> getListings(String department, String location, Integer limit) {
        JobSyncProperties.Api api = properties.getApi();
        if (limit != null && limit < 1) {
            throw new ResponseStatusException(BAD_REQUEST, "limit must be positive");
        }
        int safeLimit = limit == null ? api.getDefaultLimit() : Math.min(limit, api.getMaxLimit());
        return store.findListings(department, location, safeLimit);
    }

    public JobListingView getListing(String jobId) {
        return store.findByJobId(jobId)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Job listing not found"));
    }
}
