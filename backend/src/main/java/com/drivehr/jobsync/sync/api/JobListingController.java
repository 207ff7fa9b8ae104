package com.drivehr.jobsync.sync.api;

import com.drivehr.jobsync.sync.model.JobListingView;
import com.drivehr.jobsync.sync.model.SyncStatusResponse;
import com.drivehr.jobsync.sync.service.SyncStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class JobListingController {
    private final SyncStatusService statusService;

    public JobListingController(SyncStatusService statusService) {
        this.statusService = statusService;
    }

    @GetMapping("/status")
    public SyncStatusResponse status() {
        return statusService.getStatus();
    }

    @GetMapping("/jobs")
    public List<JobListingView> jobs(
        @RequestParam(name = "department", required = false) String department,
        @RequestParam(name = "location", required = false) String location,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return statusService.getListings(department, location, limit);
    }

    @GetMapping("/jobs/{jobId}")
    public JobListingView job(@PathVariable("jobId") String jobId) {
        return statusService.getListing(jobId);
    }
}
