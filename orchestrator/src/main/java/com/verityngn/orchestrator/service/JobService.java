package com.verityngn.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.verityngn.orchestrator.admission.AdmissionController;
import com.verityngn.orchestrator.admission.ValidationException;
import com.verityngn.orchestrator.model.Job;
import com.verityngn.orchestrator.model.JobStatus;
import com.verityngn.orchestrator.model.PipelineDefinition;
import com.verityngn.orchestrator.model.StageResult;
import com.verityngn.orchestrator.model.SubmissionOptions;
import com.verityngn.orchestrator.report.ReportPublisher;
import com.verityngn.orchestrator.repository.JobStore;
import com.verityngn.orchestrator.repository.JobWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Entry point for the API: submit, poll, cancel and read results.
 *
 * Polling methods only read the store and never write.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final AdmissionController  admission;
    private final JobDispatcher        dispatcher;
    private final JobStore             store;
    private final JobWriter            writer;
    private final CancellationRegistry cancellations;
    private final ReportPublisher      reports;
    private final PipelineDefinition   pipeline;

    public JobService(AdmissionController admission, JobDispatcher dispatcher, JobStore store,
                      JobWriter writer, CancellationRegistry cancellations,
                      ReportPublisher reports, PipelineDefinition pipeline) {
        this.admission     = admission;
        this.dispatcher    = dispatcher;
        this.store         = store;
        this.writer        = writer;
        this.cancellations = cancellations;
        this.reports       = reports;
        this.pipeline      = pipeline;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Admit a new job and try to start it immediately.
     *
     * @return the job as stored after the dispatch attempt (QUEUED or RUNNING)
     */
    public Job submit(String tenantId, String videoReference, SubmissionOptions options) {
        UUID id = admission.submit(tenantId, videoReference, options);
        try {
            dispatcher.dispatchNow();
        } catch (RuntimeException e) {
            log.warn("Immediate dispatch after submitting job {} failed, the next tick will retry: {}",
                    id, e.getMessage(), e);
        }
        return store.get(id);
    }

    // ------------------------------------------------------------------
    // Polling
    // ------------------------------------------------------------------

    /** @throws com.verityngn.orchestrator.repository.JobNotFoundException for an unknown id */
    public Job get(UUID jobId) {
        return store.get(jobId);
    }

    /**
     * A tenant's jobs in the given statuses, oldest first. An empty status set
     * means every status.
     *
     * @throws ValidationException when tenantId is missing
     */
    public List<Job> list(String tenantId, Set<JobStatus> statuses) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new ValidationException("tenantId is required");
        }
        Set<JobStatus> wanted = statuses == null || statuses.isEmpty()
                ? EnumSet.allOf(JobStatus.class)
                : statuses;
        return store.listByTenantAndStatus(tenantId, wanted);
    }

    /** Recorded stage results in pipeline order. */
    public List<StageResult> stages(UUID jobId) {
        return store.get(jobId).getStageResults();
    }

    /** Name of the stage the job is on, or the last stage for finished jobs. */
    public String currentStage(Job job) {
        if (job.getErrorStage() != null) {
            return job.getErrorStage();
        }
        int index = Math.min(job.getCurrentStageIndex(), pipeline.size() - 1);
        return pipeline.stage(index).name();
    }

    /** The job's report, once one was published. */
    public Optional<JsonNode> report(UUID jobId) {
        Job job = store.get(jobId);
        if (job.getReportReference() == null) {
            return Optional.empty();
        }
        return Optional.of(reports.read(job.getReportReference()));
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /**
     * Request cancellation. QUEUED jobs are cancelled at once; RUNNING jobs
     * stop at their worker's next checkpoint. Terminal jobs are returned as is.
     */
    public Job cancel(UUID jobId) {
        Job current = store.get(jobId);
        if (current.getStatus().isTerminal()) {
            return current;
        }
        Job job = writer.update(jobId, Job::requestCancel);
        if (job.getStatus() == JobStatus.RUNNING) {
            boolean local = cancellations.signal(jobId);
            log.info("Cancellation requested for RUNNING job {} ({})",
                    jobId, local ? "signalled worker" : "flag picked up by owning worker");
        } else {
            log.info("Cancel for job {} left it {}", jobId, job.getStatus());
        }
        return job;
    }
}
