package com.verityngn.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.verityngn.orchestrator.model.Job;
import com.verityngn.orchestrator.model.JobStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Poll view returned by GET /jobs/{id}, POST /jobs/{id}/cancel and each entry of GET /jobs.
 * error is present only for FAILED jobs; reportReference once a report exists.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
        UUID         jobId,
        String       tenantId,
        JobStatus    status,
        String       currentStage,
        int          progressPercent,
        String       message,
        JobErrorView error,
        String       reportReference,
        Instant      createdAt,
        Instant      updatedAt
) {
    public static JobStatusResponse from(Job job, String currentStage) {
        JobErrorView error = job.getStatus() == JobStatus.FAILED
                ? new JobErrorView(job.getErrorKind(), job.getErrorStage(), job.getErrorMessage())
                : null;
        return new JobStatusResponse(
                job.getId(),
                job.getTenantId(),
                job.getStatus(),
                currentStage,
                job.getProgressPercent(),
                job.getMessage(),
                error,
                job.getReportReference(),
                job.getCreatedAt(),
                job.getUpdatedAt()
        );
    }
}
