package com.verityngn.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.verityngn.orchestrator.model.Job;
import com.verityngn.orchestrator.model.SegmentCheckpoint;
import com.verityngn.orchestrator.model.Stage;
import com.verityngn.orchestrator.model.SubmissionOptions;
import com.verityngn.orchestrator.progress.ProgressReporter;
import com.verityngn.orchestrator.provider.StageInput;
import com.verityngn.orchestrator.repository.JobStore;
import com.verityngn.orchestrator.repository.JobWriter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Everything a stage task may touch while one stage of one job runs.
 *
 * Writes go straight to the store (attempt counter, segment checkpoints,
 * progress) so a crash mid-stage loses at most the in-flight call.
 */
public class StageContext {

    private final UUID                  jobId;
    private final String                videoReference;
    private final SubmissionOptions     options;
    private final Stage                 stage;
    private final int                   stageIndex;
    private final int                   priorAttempts;
    private final Map<String, JsonNode> priorResults;
    private final CancellationToken     token;
    private final JobStore              store;
    private final JobWriter             writer;
    private final ProgressReporter      progress;
    private final ObjectMapper          json;

    public StageContext(Job job, Stage stage, int stageIndex, SubmissionOptions options,
                        Map<String, JsonNode> priorResults, CancellationToken token,
                        JobStore store, JobWriter writer, ProgressReporter progress, ObjectMapper json) {
        this.jobId          = job.getId();
        this.videoReference = job.getVideoReference();
        this.options        = options;
        this.stage          = stage;
        this.stageIndex     = stageIndex;
        this.priorAttempts  = job.getCurrentStageIndex() == stageIndex ? job.getCurrentStageAttempts() : 0;
        this.priorResults   = Collections.unmodifiableMap(new LinkedHashMap<>(priorResults));
        this.token          = token;
        this.store          = store;
        this.writer         = writer;
        this.progress       = progress;
        this.json           = json;
    }

    public UUID              jobId()          { return jobId; }
    public String            videoReference() { return videoReference; }
    public SubmissionOptions options()        { return options; }
    public Stage             stage()          { return stage; }
    public int               stageIndex()     { return stageIndex; }
    public int               priorAttempts()  { return priorAttempts; }
    public CancellationToken token()          { return token; }
    public ObjectMapper      json()           { return json; }

    /** Payloads of earlier SUCCEEDED stages, in pipeline order. */
    public Map<String, JsonNode> priorResults() {
        return priorResults;
    }

    public Optional<JsonNode> priorResult(String stageName) {
        return Optional.ofNullable(priorResults.get(stageName));
    }

    public StageInput stageInput() {
        return new StageInput(jobId, stage.name(), videoReference, options, priorResults);
    }

    /** Cancellation checkpoint. */
    public void checkpoint() {
        token.throwIfCancelled();
    }

    /** Persist one failed attempt against the current stage. */
    public void recordAttempt() {
        writer.update(jobId, job -> job.recordAttempt(stageIndex));
    }

    public void reportProgress(double fraction, String message) {
        progress.report(jobId, stage.name(), fraction, message);
    }

    public void reportBoundary(double fraction, String message) {
        progress.reportBoundary(jobId, stage.name(), fraction, message);
    }

    /** Flush one finished sub-unit of this stage; a later attempt will skip it. */
    public void checkpointSegment(int index, JsonNode payload) {
        String body = write(payload);
        writer.update(jobId, job -> job.checkpointSegment(stageIndex,
                new SegmentCheckpoint(stage.name(), index, body)));
    }

    /** Sub-units already flushed for this stage, keyed and ordered by index. */
    public SortedMap<Integer, JsonNode> completedSegments() {
        SortedMap<Integer, JsonNode> done = new TreeMap<>();
        for (SegmentCheckpoint c : store.get(jobId).checkpointsFor(stage.name())) {
            done.put(c.getSegmentIndex(), read(c.getPayload()));
        }
        return done;
    }

    private String write(JsonNode node) {
        try {
            return json.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise checkpoint for stage " + stage.name(), e);
        }
    }

    private JsonNode read(String body) {
        try {
            return json.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt checkpoint for stage " + stage.name(), e);
        }
    }
}
