package com.drivehr.jobsync.sync.model;

public record ListingRecordRef(long recordId, String jobId) {
}
