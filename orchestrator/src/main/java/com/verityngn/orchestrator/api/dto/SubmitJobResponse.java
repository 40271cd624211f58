package com.verityngn.orchestrator.api.dto;

import com.verityngn.orchestrator.model.Job;
import com.verityngn.orchestrator.model.JobStatus;

import java.util.UUID;

/** Response body for POST /jobs. */
public record SubmitJobResponse(UUID jobId, JobStatus status) {

    public static SubmitJobResponse from(Job job) {
        return new SubmitJobResponse(job.getId(), job.getStatus());
    }
}
