package com.verityngn.orchestrator.repository;

import java.util.UUID;

/**
 * The job was written by someone else since the caller read it.
 * Internal signal only: the writer re-reads and tries again.
 */
public class VersionConflictException extends RuntimeException {

    private final UUID jobId;

    public VersionConflictException(UUID jobId, long expected, long actual) {
        super("Version conflict on job " + jobId + ": expected " + expected + " but found " + actual);
        this.jobId = jobId;
    }

    public UUID getJobId() { return jobId; }
}
