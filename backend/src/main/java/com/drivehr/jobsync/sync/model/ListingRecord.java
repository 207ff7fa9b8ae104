package com.drivehr.jobsync.sync.model;

import java.time.Instant;

/**
 * Sanitized field set written to the listing store. Every write overwrites all of these columns.
 */
public record ListingRecord(
    String jobId,
    String title,
    String description,
    String summary,
    String department,
    String location,
    String jobType,
    String employmentType,
    String salaryRange,
    String applyUrl,
    String sourceUrl,
    String postedDate,
    String expiryDate,
    Instant postedAt,
    Instant expiresAt,
    String source,
    String rawData,
    Instant lastUpdated,
    String syncVersion
) {
}
