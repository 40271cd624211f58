package com.verityngn.orchestrator.api.dto;

import java.util.List;

/** Response body for GET /jobs: a tenant's jobs, oldest first. */
public record JobListResponse(List<JobStatusResponse> jobs, int count) {

    public static JobListResponse of(List<JobStatusResponse> jobs) {
        return new JobListResponse(jobs, jobs.size());
    }
}
