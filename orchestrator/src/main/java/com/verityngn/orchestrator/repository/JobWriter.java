package com.verityngn.orchestrator.repository;

import com.verityngn.orchestrator.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Read-check-write loop on top of {@link JobStore#compareAndUpdate}.
 *
 * Every writer (dispatcher, executor, progress reporter, cancel requests)
 * goes through here so a losing writer re-reads the job and re-applies its
 * intended mutation instead of overwriting the winner.
 */
@Component
public class JobWriter {

    private static final Logger log = LoggerFactory.getLogger(JobWriter.class);

    static final int MAX_ATTEMPTS = 20;

    private final JobStore store;

    public JobWriter(JobStore store) {
        this.store = store;
    }

    /**
     * Apply {@code mutation} to the latest version of the job.
     *
     * @return the job as stored after the mutation
     * @throws VersionConflictException if every attempt lost the race
     */
    public Job update(UUID jobId, JobMutation mutation) {
        VersionConflictException last = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            Job current = store.get(jobId);
            try {
                store.compareAndUpdate(jobId, current.getVersion(), mutation);
                return store.get(jobId);
            } catch (VersionConflictException e) {
                last = e;
                log.debug("Version conflict on job {} (attempt {}/{}), re-reading",
                        jobId, attempt, MAX_ATTEMPTS);
                Thread.onSpinWait();
            }
        }
        log.warn("Giving up on job {} after {} version conflicts", jobId, MAX_ATTEMPTS);
        throw last;
    }
}
