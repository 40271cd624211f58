package com.verityngn.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.verityngn.orchestrator.model.ErrorKind;
import com.verityngn.orchestrator.model.IllegalJobTransitionException;
import com.verityngn.orchestrator.model.Job;
import com.verityngn.orchestrator.model.JobStatus;
import com.verityngn.orchestrator.model.PipelineDefinition;
import com.verityngn.orchestrator.model.Stage;
import com.verityngn.orchestrator.model.StageKind;
import com.verityngn.orchestrator.model.StageOutcome;
import com.verityngn.orchestrator.model.StageResult;
import com.verityngn.orchestrator.model.SubmissionOptions;
import com.verityngn.orchestrator.progress.ProgressCalculator;
import com.verityngn.orchestrator.progress.ProgressReporter;
import com.verityngn.orchestrator.report.IncompleteInputException;
import com.verityngn.orchestrator.report.Report;
import com.verityngn.orchestrator.report.ReportAssembler;
import com.verityngn.orchestrator.report.ReportPublisher;
import com.verityngn.orchestrator.repository.JobMutation;
import com.verityngn.orchestrator.repository.JobStore;
import com.verityngn.orchestrator.repository.JobWriter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Drives one RUNNING job through its stages, strictly in pipeline order.
 *
 * The store is authoritative: a run starts at the job's persisted
 * current_stage_index, so the same method serves fresh jobs, resumed jobs
 * after a restart and jobs reclaimed from a stalled worker. Stage results and
 * the index advance are written in one compare-and-update.
 *
 * Terminal paths:
 * <pre>
 *   last stage done      → assemble + publish report → COMPLETED
 *   required stage FAILED → FAILED(STAGE_FAILED), optional partial report
 *   cancel observed      → CANCELLED
 *   IncompleteInput      → FAILED(INCOMPLETE_INPUT), logged at ERROR
 *   anything unexpected  → FAILED(INTERNAL)
 *   worker interrupted   → left RUNNING for recovery
 * </pre>
 */
public class PipelineExecutor {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

    private final JobStore                      store;
    private final JobWriter                     writer;
    private final PipelineDefinition            pipeline;
    private final StageRunner                   runner;
    private final Map<StageKind, StageTask<?>>  tasks;
    private final ProgressReporter              progress;
    private final ReportAssembler               assembler;
    private final ReportPublisher               publisher;
    private final CancellationRegistry          cancellations;
    private final MeterRegistry                 meterRegistry;
    private final ObjectMapper                  json;
    private final boolean                       allowPartial;

    public PipelineExecutor(JobStore store, JobWriter writer, PipelineDefinition pipeline,
                            StageRunner runner, Map<StageKind, StageTask<?>> tasks,
                            ProgressReporter progress, ReportAssembler assembler,
                            ReportPublisher publisher, CancellationRegistry cancellations,
                            MeterRegistry meterRegistry, ObjectMapper json, boolean allowPartial) {
        for (Stage s : pipeline.stages()) {
            if (!tasks.containsKey(s.kind())) {
                throw new IllegalArgumentException("No stage task for kind " + s.kind());
            }
        }
        this.store         = store;
        this.writer        = writer;
        this.pipeline      = pipeline;
        this.runner        = runner;
        this.tasks         = Map.copyOf(tasks);
        this.progress      = progress;
        this.assembler     = assembler;
        this.publisher     = publisher;
        this.cancellations = cancellations;
        this.meterRegistry = meterRegistry;
        this.json          = json;
        this.allowPartial  = allowPartial;
    }

    /**
     * Run the job from its current stage to a terminal status.
     *
     * @return the status the job was left in
     */
    public JobStatus run(UUID jobId) {
        Job job = store.get(jobId);
        if (job.getStatus() != JobStatus.RUNNING) {
            log.debug("Job {} is {}, nothing to run", jobId, job.getStatus());
            return job.getStatus();
        }
        CancellationToken token = cancellations.register(jobId);
        MDC.put("jobId", jobId.toString());
        MDC.put("tenantId", job.getTenantId());
        try {
            if (job.isCancelRequested()) {
                token.cancel();
            }
            SubmissionOptions options = readOptions(job);
            PipelineDefinition effective = pipeline.withOverrides(options.stageOverrides());

            for (int i = job.getCurrentStageIndex(); i < effective.size(); i++) {
                Stage stage = effective.stage(i);
                MDC.put("stage", stage.name());
                job = store.get(jobId);
                if (token.isCancelled() || job.isCancelRequested()) {
                    throw new JobCancelledException(jobId);
                }
                log.info("Job {} starting stage {} ({}/{})", jobId, stage.name(), i + 1, effective.size());
                progress.reportBoundary(jobId, stage.name(), 0.0, "Running stage " + stage.name());

                StageContext ctx = new StageContext(job, stage, i, options, priorResults(job),
                        token, store, writer, progress, json);
                StageResult result = runner.run(ctx, tasks.get(stage.kind()));

                int index = i;
                if (result.getOutcome() == StageOutcome.FAILED) {
                    writer.update(jobId, j -> {
                        j.recordStageResult(index, result, 0);
                        j.fail(ErrorKind.STAGE_FAILED, stage.name(), result.getMessage());
                    });
                    log.info("Job {} FAILED at stage {}: {}", jobId, stage.name(), result.getMessage());
                    if (allowPartial) {
                        publishPartial(jobId);
                    }
                    return finished(JobStatus.FAILED);
                }
                int floor = ProgressCalculator.stageFloor(index + 1, effective.size());
                writer.update(jobId, j -> j.recordStageResult(index, result, floor));
                log.info("Job {} stage {} {} (provider={}, attempts={})", jobId, stage.name(),
                        result.getOutcome(), result.getProviderUsed(), result.getAttemptCount());
            }
            MDC.remove("stage");

            job = store.get(jobId);
            if (token.isCancelled() || job.isCancelRequested()) {
                throw new JobCancelledException(jobId);
            }
            Report report = assembler.assemble(jobId, job.getStageResults());
            String reference = publisher.publish(report);
            writer.update(jobId, j -> j.complete(reference));
            log.info("Job {} COMPLETED, report at {}", jobId, reference);
            return finished(JobStatus.COMPLETED);

        } catch (JobCancelledException e) {
            terminate(jobId, Job::cancel);
            log.info("Job {} CANCELLED", jobId);
            return finished(JobStatus.CANCELLED);
        } catch (IncompleteInputException e) {
            log.error("Job {} cannot be reported, missing {}; this is an orchestration bug",
                    jobId, e.getMissingStages(), e);
            terminate(jobId, j -> j.fail(ErrorKind.INCOMPLETE_INPUT, null, e.getMessage()));
            return finished(JobStatus.FAILED);
        } catch (WorkerInterruptedException e) {
            log.warn("Worker interrupted while running job {}; leaving it RUNNING for recovery", jobId);
            Thread.currentThread().interrupt();
            return JobStatus.RUNNING;
        } catch (RuntimeException e) {
            log.error("Unexpected error running job {}: {}", jobId, e.getMessage(), e);
            terminate(jobId, j -> j.fail(ErrorKind.INTERNAL, MDC.get("stage"),
                    "Internal error while running the pipeline"));
            return finished(JobStatus.FAILED);
        } finally {
            cancellations.unregister(jobId);
            progress.forget(jobId);
            MDC.clear();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void publishPartial(UUID jobId) {
        try {
            Job failed = store.get(jobId);
            Report partial = assembler.assemblePartial(jobId, failed.getStageResults());
            String reference = publisher.publish(partial);
            writer.update(jobId, j -> j.attachPartialReport(reference));
            log.info("Job {} partial report at {}", jobId, reference);
        } catch (RuntimeException e) {
            log.warn("Could not publish partial report for job {}: {}", jobId, e.getMessage(), e);
        }
    }

    /** Apply a terminal transition unless another writer already finished the job. */
    private void terminate(UUID jobId, JobMutation mutation) {
        try {
            writer.update(jobId, mutation);
        } catch (IllegalJobTransitionException e) {
            log.warn("Job {} already terminal, keeping stored outcome: {}", jobId, e.getMessage());
        }
    }

    private JobStatus finished(JobStatus status) {
        meterRegistry.counter("verity.jobs.finished", "status", status.name()).increment();
        return status;
    }

    private Map<String, JsonNode> priorResults(Job job) {
        Map<String, JsonNode> prior = new LinkedHashMap<>();
        for (StageResult r : job.getStageResults()) {
            if (r.getOutcome() == StageOutcome.SUCCEEDED && r.getPayload() != null) {
                prior.put(r.getStageName(), readTree(r));
            }
        }
        return prior;
    }

    private JsonNode readTree(StageResult r) {
        try {
            return json.readTree(r.getPayload());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stage " + r.getStageName() + " has a corrupt payload", e);
        }
    }

    private SubmissionOptions readOptions(Job job) {
        if (job.getOptionsJson() == null) {
            return SubmissionOptions.defaults();
        }
        try {
            return json.readValue(job.getOptionsJson(), SubmissionOptions.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Job " + job.getId() + " has unreadable options", e);
        }
    }
}
