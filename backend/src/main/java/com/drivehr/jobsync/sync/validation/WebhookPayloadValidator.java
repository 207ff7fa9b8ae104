package com.drivehr.jobsync.sync.validation;

import com.drivehr.jobsync.config.JobSyncProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

/**
 * Structural checks on a decoded webhook body. Individual listings are validated later, one by
 * one, during reconciliation.
 */
@Component
public class WebhookPayloadValidator {
    public static final String JOBS_FIELD = "jobs";

    private final JobSyncProperties properties;

    public WebhookPayloadValidator(JobSyncProperties properties) {
        this.properties = properties;
    }

    public ValidationOutcome validate(JsonNode decoded) {
        if (decoded == null || !decoded.isObject()) {
            return ValidationOutcome.failed("payload is not a JSON object");
        }
        JsonNode jobs = decoded.get(JOBS_FIELD);
        if (jobs == null || !jobs.isArray()) {
            return ValidationOutcome.failed("'" + JOBS_FIELD + "' is missing or not an array");
        }
        int max = properties.getMaxJobsPerRequest();
        if (jobs.size() > max) {
            return ValidationOutcome.failed("'" + JOBS_FIELD + "' holds " + jobs.size() + " entries, limit is " + max);
        }
        if (!jobs.isEmpty()) {
            JsonNode first = jobs.get(0);
            if (!first.isObject() || !first.hasNonNull("id") || !first.hasNonNull("title")) {
                return ValidationOutcome.failed("first job lacks 'id' or 'title'");
            }
        }
        return ValidationOutcome.passed();
    }
}
