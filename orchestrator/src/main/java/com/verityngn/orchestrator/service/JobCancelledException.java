package com.verityngn.orchestrator.service;

import java.util.UUID;

/** Raised at a cancellation checkpoint; unwinds the worker to the executor loop. */
public class JobCancelledException extends RuntimeException {

    private final UUID jobId;

    public JobCancelledException(UUID jobId) {
        super("Job " + jobId + " was cancelled");
        this.jobId = jobId;
    }

    public UUID getJobId() { return jobId; }
}
