package com.drivehr.jobsync.sync.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SyncTriggerResult(
    boolean success,
    String message,
    @JsonProperty("request_id") String requestId
) {
}
