package com.drivehr.jobsync.sync.http;

import org.springframework.http.HttpStatus;

public class SyncTriggerException extends RuntimeException {
    private final HttpStatus status;

    public SyncTriggerException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public SyncTriggerException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
