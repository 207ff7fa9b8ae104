package com.drivehr.jobsync.sync.api;

import com.drivehr.jobsync.sync.http.SyncTriggerClient;
import com.drivehr.jobsync.sync.model.SyncTriggerResult;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sync")
public class SyncTriggerController {
    private final SyncTriggerClient triggerClient;

    public SyncTriggerController(SyncTriggerClient triggerClient) {
        this.triggerClient = triggerClient;
    }

    @PostMapping("/trigger")
    public SyncTriggerResult trigger(
        @RequestParam(name = "force", required = false, defaultValue = "false") boolean force
    ) {
        return triggerClient.trigger(force);
    }
}
