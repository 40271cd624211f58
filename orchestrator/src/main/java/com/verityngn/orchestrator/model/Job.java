package com.verityngn.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * One video verification request and its persisted pipeline state.
 *
 * A Job is only ever changed through the Job Store's compare-and-update,
 * which hands the mutation a private copy (in-memory store) or a row locked
 * for the duration of the write (JPA store). The transition methods below
 * enforce the state machine and the write-once rule for stage results; the
 * store bumps {@code version} after every successful mutation.
 *
 * DB tables: jobs, job_stage_results, job_segment_checkpoints (Flyway V1)
 */
@Entity
@Table(name = "jobs")
public class Job {

    @Id
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "video_reference", nullable = false, columnDefinition = "TEXT")
    private String videoReference;

    // SubmissionOptions serialised as JSON at submission time.
    @Column(name = "options_json", columnDefinition = "TEXT")
    private String optionsJson;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.QUEUED;

    @Column(name = "total_stages", nullable = false)
    private int totalStages;

    @Column(name = "current_stage_index", nullable = false)
    private int currentStageIndex = 0;

    // Attempts made so far on the stage at current_stage_index; reset on advance.
    @Column(name = "current_stage_attempts", nullable = false)
    private int currentStageAttempts = 0;

    @Column(name = "progress_percent", nullable = false)
    private int progressPercent = 0;

    @Column(columnDefinition = "TEXT")
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind")
    private ErrorKind errorKind;

    @Column(name = "error_stage")
    private String errorStage;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "cancel_requested", nullable = false)
    private boolean cancelRequested = false;

    // Worker that currently owns the RUNNING job, and its last liveness signal.
    @Column(name = "worker_id")
    private String workerId;

    @Column(name = "heartbeat_at")
    private Instant heartbeatAt;

    @Column(name = "report_reference", columnDefinition = "TEXT")
    private String reportReference;

    @Column(nullable = false)
    private long version = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "job_stage_results", joinColumns = @JoinColumn(name = "job_id"))
    @OrderColumn(name = "position")
    private List<StageResult> stageResults = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "job_segment_checkpoints", joinColumns = @JoinColumn(name = "job_id"))
    @OrderColumn(name = "position")
    private List<SegmentCheckpoint> segmentCheckpoints = new ArrayList<>();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(String tenantId, String videoReference, String optionsJson, int totalStages, Instant now) {
        this.id             = UUID.randomUUID();
        this.tenantId       = tenantId;
        this.videoReference = videoReference;
        this.optionsJson    = optionsJson;
        this.totalStages    = totalStages;
        this.createdAt      = now;
        this.updatedAt      = now;
        this.message        = "Queued, waiting for a free slot";
    }

    /** Deep enough copy for snapshot reads: embedded values are never mutated in place. */
    public Job copy() {
        Job c = new Job();
        c.id                   = id;
        c.tenantId             = tenantId;
        c.videoReference       = videoReference;
        c.optionsJson          = optionsJson;
        c.status               = status;
        c.totalStages          = totalStages;
        c.currentStageIndex    = currentStageIndex;
        c.currentStageAttempts = currentStageAttempts;
        c.progressPercent      = progressPercent;
        c.message              = message;
        c.errorKind            = errorKind;
        c.errorStage           = errorStage;
        c.errorMessage         = errorMessage;
        c.cancelRequested      = cancelRequested;
        c.workerId             = workerId;
        c.heartbeatAt          = heartbeatAt;
        c.reportReference      = reportReference;
        c.version              = version;
        c.createdAt            = createdAt;
        c.updatedAt            = updatedAt;
        c.stageResults         = new ArrayList<>(stageResults);
        c.segmentCheckpoints   = new ArrayList<>(segmentCheckpoints);
        return c;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    /** QUEUED → RUNNING: the dispatcher acquired a slot for this job. */
    public void promote(String workerId, Instant now) {
        transitionTo(JobStatus.RUNNING);
        this.workerId    = workerId;
        this.heartbeatAt = now;
        this.message     = "Started";
    }

    /** Take ownership of an already RUNNING job (resume after restart or stall). */
    public void claim(String workerId, Instant now) {
        requireStatus(JobStatus.RUNNING, "claim");
        this.workerId    = workerId;
        this.heartbeatAt = now;
    }

    public void heartbeat(Instant now) {
        requireStatus(JobStatus.RUNNING, "heartbeat");
        this.heartbeatAt = now;
    }

    /** Count one real provider attempt against the stage currently executing. */
    public void recordAttempt(int stageIndex) {
        requireCurrentStage(stageIndex);
        this.currentStageAttempts++;
    }

    /**
     * Record the outcome of the current stage. SUCCEEDED and SKIPPED results
     * advance current_stage_index in the same write so readers never see one
     * without the other; a FAILED result leaves the index on the failed stage.
     */
    public void recordStageResult(int stageIndex, StageResult result, int progressFloor) {
        requireCurrentStage(stageIndex);
        if (stageResult(result.getStageName()).isPresent()) {
            throw new IllegalJobTransitionException(id,
                    "stage result for '" + result.getStageName() + "' is already recorded");
        }
        stageResults.add(result);
        segmentCheckpoints.removeIf(c -> c.getStageName().equals(result.getStageName()));
        if (result.getOutcome() != StageOutcome.FAILED) {
            currentStageIndex++;
            currentStageAttempts = 0;
            raiseProgress(progressFloor, null);
        }
    }

    /** Store one completed segment of a long stage; duplicates are ignored. */
    public void checkpointSegment(int stageIndex, SegmentCheckpoint checkpoint) {
        requireCurrentStage(stageIndex);
        boolean exists = segmentCheckpoints.stream().anyMatch(c ->
                c.getStageName().equals(checkpoint.getStageName())
                        && c.getSegmentIndex() == checkpoint.getSegmentIndex());
        if (!exists) {
            segmentCheckpoints.add(checkpoint);
        }
    }

    /** Progress never decreases; a lower value only refreshes the message. */
    public void raiseProgress(int percent, String message) {
        requireStatus(JobStatus.RUNNING, "report progress");
        int clamped = Math.max(0, Math.min(100, percent));
        if (clamped > progressPercent) {
            progressPercent = clamped;
        }
        if (message != null) {
            this.message = message;
        }
    }

    /**
     * Ask for cancellation. A QUEUED job holds no slot and is cancelled on the
     * spot; a RUNNING job is flagged and stopped by its worker at the next
     * checkpoint. Returns false when the job is already terminal.
     */
    public boolean requestCancel() {
        if (status == JobStatus.QUEUED) {
            transitionTo(JobStatus.CANCELLED);
            message = "Cancelled before start";
            return true;
        }
        if (status == JobStatus.RUNNING) {
            cancelRequested = true;
            message = "Cancellation requested";
            return true;
        }
        return false;
    }

    public void complete(String reportReference) {
        transitionTo(JobStatus.COMPLETED);
        this.reportReference = reportReference;
        this.progressPercent = 100;
        this.message         = "Verification complete";
        this.workerId        = null;
    }

    public void fail(ErrorKind kind, String stageName, String errorMessage) {
        transitionTo(JobStatus.FAILED);
        this.errorKind    = kind;
        this.errorStage   = stageName;
        this.errorMessage = errorMessage;
        this.message      = stageName == null
                ? "Verification failed"
                : "Verification failed at stage " + stageName;
        this.workerId     = null;
    }

    public void cancel() {
        transitionTo(JobStatus.CANCELLED);
        this.message  = "Cancelled";
        this.workerId = null;
    }

    /** Attach a partial report to a job that has already FAILED. */
    public void attachPartialReport(String reportReference) {
        requireStatus(JobStatus.FAILED, "attach a partial report");
        if (this.reportReference == null) {
            this.reportReference = reportReference;
        }
    }

    /** Called by the store after a successful compare-and-update. */
    public void markPersisted(Instant now) {
        this.version++;
        this.updatedAt = now;
    }

    private void transitionTo(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalJobTransitionException(id, status + " → " + next + " is not allowed");
        }
        this.status = next;
    }

    private void requireStatus(JobStatus expected, String action) {
        if (status != expected) {
            throw new IllegalJobTransitionException(id, "cannot " + action + " while " + status);
        }
    }

    private void requireCurrentStage(int stageIndex) {
        requireStatus(JobStatus.RUNNING, "change stage state");
        if (stageIndex != currentStageIndex) {
            throw new IllegalJobTransitionException(id,
                    "stage " + stageIndex + " is not current (current=" + currentStageIndex + ")");
        }
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Optional<StageResult> stageResult(String stageName) {
        return stageResults.stream().filter(r -> r.getStageName().equals(stageName)).findFirst();
    }

    public List<SegmentCheckpoint> checkpointsFor(String stageName) {
        return segmentCheckpoints.stream().filter(c -> c.getStageName().equals(stageName)).toList();
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID      getId()                   { return id; }
    public String    getTenantId()             { return tenantId; }
    public String    getVideoReference()       { return videoReference; }
    public String    getOptionsJson()          { return optionsJson; }
    public JobStatus getStatus()               { return status; }
    public int       getTotalStages()          { return totalStages; }
    public int       getCurrentStageIndex()    { return currentStageIndex; }
    public int       getCurrentStageAttempts() { return currentStageAttempts; }
    public int       getProgressPercent()      { return progressPercent; }
    public String    getMessage()              { return message; }
    public ErrorKind getErrorKind()            { return errorKind; }
    public String    getErrorStage()           { return errorStage; }
    public String    getErrorMessage()         { return errorMessage; }
    public boolean   isCancelRequested()       { return cancelRequested; }
    public String    getWorkerId()             { return workerId; }
    public Instant   getHeartbeatAt()          { return heartbeatAt; }
    public String    getReportReference()      { return reportReference; }
    public long      getVersion()              { return version; }
    public Instant   getCreatedAt()            { return createdAt; }
    public Instant   getUpdatedAt()            { return updatedAt; }

    public List<StageResult> getStageResults() {
        return Collections.unmodifiableList(stageResults);
    }
}
