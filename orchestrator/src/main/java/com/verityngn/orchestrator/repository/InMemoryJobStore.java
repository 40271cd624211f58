package com.verityngn.orchestrator.repository;

import com.verityngn.orchestrator.model.Job;
import com.verityngn.orchestrator.model.JobStatus;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Job Store kept in process memory, for local runs without a database and
 * for tests. Reads and writes work on copies, so a caller can never change
 * stored state except through compareAndUpdate.
 */
public class InMemoryJobStore implements JobStore {

    private static final Comparator<Job> OLDEST_FIRST =
            Comparator.comparing(Job::getCreatedAt).thenComparing(j -> j.getId().toString());

    private final ConcurrentMap<UUID, Job> jobs = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryJobStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public UUID create(Job job) {
        if (jobs.putIfAbsent(job.getId(), job.copy()) != null) {
            throw new IllegalStateException("Job " + job.getId() + " already exists");
        }
        return job.getId();
    }

    @Override
    public Optional<Job> find(UUID jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(Job::copy);
    }

    @Override
    public long compareAndUpdate(UUID jobId, long expectedVersion, JobMutation mutation) {
        Job updated = jobs.compute(jobId, (id, current) -> {
            if (current == null) {
                throw new JobNotFoundException(jobId);
            }
            if (current.getVersion() != expectedVersion) {
                throw new VersionConflictException(jobId, expectedVersion, current.getVersion());
            }
            Job draft = current.copy();
            mutation.apply(draft);
            draft.markPersisted(clock.instant());
            return draft;
        });
        return updated.getVersion();
    }

    @Override
    public List<Job> listByTenantAndStatus(String tenantId, Set<JobStatus> statuses) {
        return jobs.values().stream()
                .filter(j -> j.getTenantId().equals(tenantId) && statuses.contains(j.getStatus()))
                .sorted(OLDEST_FIRST)
                .map(Job::copy)
                .toList();
    }

    @Override
    public List<Job> listByStatus(Set<JobStatus> statuses) {
        return jobs.values().stream()
                .filter(j -> statuses.contains(j.getStatus()))
                .sorted(OLDEST_FIRST)
                .map(Job::copy)
                .toList();
    }
}
