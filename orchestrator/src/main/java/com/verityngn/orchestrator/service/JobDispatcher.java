package com.verityngn.orchestrator.service;

import com.verityngn.orchestrator.admission.AdmissionController;
import com.verityngn.orchestrator.model.IllegalJobTransitionException;
import com.verityngn.orchestrator.model.Job;
import com.verityngn.orchestrator.model.JobStatus;
import com.verityngn.orchestrator.repository.JobNotFoundException;
import com.verityngn.orchestrator.repository.JobStore;
import com.verityngn.orchestrator.repository.JobWriter;
import com.verityngn.orchestrator.repository.VersionConflictException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Background loop that moves admitted jobs onto worker threads.
 *
 * The store is the queue: every tick asks the admission controller to
 * promote whatever fits under the caps, and each promoted job is handed to
 * the fixed worker pool. A worker that finishes a job triggers another
 * dispatch right away, so a queued job does not wait for the next tick once
 * a slot frees up.
 *
 * Three more duties run on their own schedules:
 *   heartbeat  - refresh heartbeat_at of the jobs running here and pick up
 *                cancel requests written by other processes
 *   recovery   - reclaim RUNNING jobs whose worker stopped heartbeating
 *   startup    - with resume-on-startup, reclaim every RUNNING job
 */
@Component
@EnableScheduling
public class JobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final AdmissionController  admission;
    private final PipelineExecutor     executor;
    private final JobStore             store;
    private final JobWriter            writer;
    private final CancellationRegistry cancellations;
    private final ExecutionSettings    settings;
    private final Clock                clock;
    private final ExecutorService      workers;

    @Autowired
    public JobDispatcher(AdmissionController admission, PipelineExecutor executor, JobStore store,
                         JobWriter writer, CancellationRegistry cancellations,
                         ExecutionSettings settings, Clock clock) {
        this(admission, executor, store, writer, cancellations, settings, clock,
                Executors.newFixedThreadPool(settings.workerCount()));
    }

    JobDispatcher(AdmissionController admission, PipelineExecutor executor, JobStore store,
                  JobWriter writer, CancellationRegistry cancellations,
                  ExecutionSettings settings, Clock clock, ExecutorService workers) {
        this.admission     = admission;
        this.executor      = executor;
        this.store         = store;
        this.writer        = writer;
        this.cancellations = cancellations;
        this.settings      = settings;
        this.clock         = clock;
        this.workers       = workers;
    }

    // ------------------------------------------------------------------
    // Dispatch
    // ------------------------------------------------------------------

    @Scheduled(fixedDelayString = "${verity.orchestrator.admission.dispatch-interval:PT1S}")
    public void tick() {
        dispatchNow();
    }

    /** Promote what fits and start it; safe to call from any thread. */
    public List<UUID> dispatchNow() {
        List<UUID> promoted = admission.promoteEligible(settings.workerId());
        promoted.forEach(this::start);
        return promoted;
    }

    private void start(UUID jobId) {
        workers.submit(() -> {
            try {
                executor.run(jobId);
            } catch (Exception e) {
                log.error("Unhandled error in pipeline for job {}: {}", jobId, e.getMessage(), e);
            } finally {
                redispatch();
            }
        });
    }

    private void redispatch() {
        try {
            dispatchNow();
        } catch (RuntimeException e) {
            log.warn("Dispatch after job completion failed, next tick will retry: {}", e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Liveness
    // ------------------------------------------------------------------

    @Scheduled(fixedDelayString = "${verity.orchestrator.execution.heartbeat-interval:PT10S}")
    public void heartbeat() {
        Instant now = clock.instant();
        for (UUID jobId : cancellations.runningJobIds()) {
            try {
                Job job = writer.update(jobId, j -> j.heartbeat(now));
                if (job.isCancelRequested()) {
                    cancellations.signal(jobId);
                }
            } catch (IllegalJobTransitionException | JobNotFoundException e) {
                log.debug("No heartbeat for job {}: {}", jobId, e.getMessage());
            }
        }
    }

    /**
     * Reclaim RUNNING jobs whose heartbeat is older than the stall timeout
     * and resume them from their current stage.
     */
    @Scheduled(fixedDelayString = "${verity.orchestrator.execution.recovery-interval:PT60S}")
    public void recoverStalled() {
        Instant cutoff = clock.instant().minus(settings.stallTimeout());
        for (Job job : store.listByStatus(Set.of(JobStatus.RUNNING))) {
            if (job.getHeartbeatAt() != null && job.getHeartbeatAt().isBefore(cutoff)) {
                log.warn("Recovering stalled job {} (worker={}, last heartbeat={})",
                        job.getId(), job.getWorkerId(), job.getHeartbeatAt());
                reclaim(job);
            }
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void resumeOnStartup() {
        if (!settings.resumeOnStartup()) {
            return;
        }
        List<Job> running = store.listByStatus(Set.of(JobStatus.RUNNING));
        if (!running.isEmpty()) {
            log.info("Resuming {} RUNNING job(s) left by a previous process", running.size());
        }
        running.forEach(this::reclaim);
    }

    /** @return true when this process took ownership of the job */
    boolean reclaim(Job job) {
        if (cancellations.find(job.getId()).isPresent()) {
            return false;
        }
        try {
            store.compareAndUpdate(job.getId(), job.getVersion(),
                    j -> j.claim(settings.workerId(), clock.instant()));
        } catch (VersionConflictException | IllegalJobTransitionException e) {
            log.info("Job {} changed while reclaiming, leaving it: {}", job.getId(), e.getMessage());
            return false;
        }
        log.info("Job {} reclaimed by worker '{}' at stage index {}",
                job.getId(), settings.workerId(), job.getCurrentStageIndex());
        start(job.getId());
        return true;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping job workers; running jobs stay RUNNING for recovery");
        workers.shutdownNow();
    }
}
