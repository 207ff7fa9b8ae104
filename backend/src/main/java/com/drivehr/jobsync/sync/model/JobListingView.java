package com.drivehr.jobsync.sync.model;

import java.time.Instant;

public record JobListingView(
    long recordId,
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
    Instant postedAt,
    Instant expiresAt,
    Instant lastUpdated,
    String syncVersion
) {
}
