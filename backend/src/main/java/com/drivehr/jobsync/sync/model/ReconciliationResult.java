package com.drivehr.jobsync.sync.model;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ReconciliationResult(
    int created,
    int updated,
    int skipped,
    int total,
    List<String> errors,
    List<String> removedJobIds,
    OffsetDateTime timestamp,
    String source
) {

    public int removed() {
        return removedJobIds.size();
    }

    /**
     * Wire shape of a successful sync; {@code processed} counts newly created listings.
     */
    public Map<String, Object> toResponseBody() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("processed", created);
        body.put("updated", updated);
        body.put("skipped", skipped);
        body.put("total", total);
        body.put("errors", errors);
        body.put("removed", removed());
        body.put("removed_job_ids", removedJobIds);
        body.put("timestamp", timestamp);
        body.put("source", source);
        return body;
    }
}
