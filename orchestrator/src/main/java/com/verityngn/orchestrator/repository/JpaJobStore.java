package com.verityngn.orchestrator.repository;

import com.verityngn.orchestrator.model.Job;
import com.verityngn.orchestrator.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * PostgreSQL-backed Job Store.
 *
 * compareAndUpdate runs in one transaction: SELECT ... FOR UPDATE, compare
 * the version, apply the mutation, bump the version, UPDATE. A mutation that
 * throws rolls the whole write back.
 */
public class JpaJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JpaJobStore.class);

    private final JobRepository jobRepo;
    private final Clock         clock;

    public JpaJobStore(JobRepository jobRepo, Clock clock) {
        this.jobRepo = jobRepo;
        this.clock   = clock;
    }

    @Override
    @Transactional
    public UUID create(Job job) {
        Job saved = jobRepo.save(job);
        log.debug("Created job {} for tenant {}", saved.getId(), saved.getTenantId());
        return saved.getId();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Job> find(UUID jobId) {
        return jobRepo.findById(jobId);
    }

    @Override
    @Transactional
    public long compareAndUpdate(UUID jobId, long expectedVersion, JobMutation mutation) {
        Job job = jobRepo.findByIdForUpdate(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (job.getVersion() != expectedVersion) {
            throw new VersionConflictException(jobId, expectedVersion, job.getVersion());
        }
        mutation.apply(job);
        job.markPersisted(clock.instant());
        jobRepo.save(job);
        return job.getVersion();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Job> listByTenantAndStatus(String tenantId, Set<JobStatus> statuses) {
        return jobRepo.findByTenantIdAndStatusInOrderByCreatedAtAsc(tenantId, statuses);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Job> listByStatus(Set<JobStatus> statuses) {
        return jobRepo.findByStatusInOrderByCreatedAtAsc(statuses);
    }
}
