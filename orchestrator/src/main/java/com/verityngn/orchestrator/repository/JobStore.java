package com.verityngn.orchestrator.repository;

import com.verityngn.orchestrator.model.Job;
import com.verityngn.orchestrator.model.JobStatus;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Durable record of job state and stage results; the single source of truth.
 *
 * Every change goes through {@link #compareAndUpdate}: the caller names the
 * version it read, and the write is rejected with {@link VersionConflictException}
 * if anyone else wrote in between. Reads return snapshots that later writes
 * do not affect.
 */
public interface JobStore {

    /** Persist a new job and return its id. */
    UUID create(Job job);

    Optional<Job> find(UUID jobId);

    /** @throws JobNotFoundException if no job has this id */
    default Job get(UUID jobId) {
        return find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * Apply {@code mutation} if the stored version still equals {@code expectedVersion}.
     *
     * @return the new version
     * @throws VersionConflictException if the stored version moved on
     * @throws JobNotFoundException     if the job does not exist
     */
    long compareAndUpdate(UUID jobId, long expectedVersion, JobMutation mutation);

    /** Snapshot of a tenant's jobs in the given statuses, oldest first. */
    List<Job> listByTenantAndStatus(String tenantId, Set<JobStatus> statuses);

    /** Snapshot of all jobs in the given statuses, oldest first. */
    List<Job> listByStatus(Set<JobStatus> statuses);
}
