package com.verityngn.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.verityngn.orchestrator.admission.AdmissionPolicy;
import com.verityngn.orchestrator.model.ErrorKind;
import com.verityngn.orchestrator.model.Job;
import com.verityngn.orchestrator.model.JobStatus;
import com.verityngn.orchestrator.model.PipelineDefinition;
import com.verityngn.orchestrator.model.Stage;
import com.verityngn.orchestrator.model.StageKind;
import com.verityngn.orchestrator.model.StageOutcome;
import com.verityngn.orchestrator.model.StageOverride;
import com.verityngn.orchestrator.model.StageResult;
import com.verityngn.orchestrator.model.SubmissionOptions;
import com.verityngn.orchestrator.provider.Provider;
import com.verityngn.orchestrator.provider.ProviderException.Kind;
import com.verityngn.orchestrator.support.FakeAnalysisProvider;
import com.verityngn.orchestrator.support.FakeEvidenceProvider;
import com.verityngn.orchestrator.support.ScriptedStageProvider;
import com.verityngn.orchestrator.support.TestOrchestrator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static com.verityngn.orchestrator.support.TestOrchestrator.direct;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end runs of the four-stage verification pipeline over the real
 * runner, tasks, assembler and publisher with fake providers.
 */
class PipelineExecutorTest {

    @TempDir Path artifacts;

    ScriptedStageProvider ingest;
    FakeAnalysisProvider  analysis;
    FakeEvidenceProvider  search;
    ScriptedStageProvider verifier;

    TestOrchestrator env;

    @BeforeEach
    void setUp() {
        ingest   = new ScriptedStageProvider("ingest");
        analysis = new FakeAnalysisProvider("analysis");
        search   = new FakeEvidenceProvider("search");
        verifier = new ScriptedStageProvider("verifier");

        ObjectNode meta = new ObjectMapper().createObjectNode();
        meta.put("durationSeconds", 700);
        meta.put("title", "demo");
        ingest.returning(meta);
    }

    @AfterEach
    void tearDown() {
        if (env != null) env.close();
    }

    static PipelineDefinition verificationPipeline() {
        return new PipelineDefinition(List.of(
                direct("ingestion", 0, "ingest"),
                new Stage("claim_extraction", 1, StageKind.SEGMENTED_ANALYSIS, Duration.ofSeconds(10), 2,
                        List.of("analysis"), false, null),
                new Stage("evidence_search", 2, StageKind.EVIDENCE_SEARCH, Duration.ofSeconds(10), 1,
                        List.of("search"), false, "claim_extraction"),
                direct("claim_verification", 3, 1, Duration.ofSeconds(5), "verifier")));
    }

    void start(boolean allowPartial) {
        List<Provider> providers = List.of(ingest, analysis, search, verifier);
        env = new TestOrchestrator(verificationPipeline(), providers, artifacts, allowPartial);
    }

    UUID runningJob(SubmissionOptions options) {
        UUID id = env.admission(new AdmissionPolicy(10, 10, Map.of(), 0))
                .submit("tenant-a", "https://video.example/watch?v=1", options);
        env.writer.update(id, j -> j.promote("w1", env.clock.instant()));
        return id;
    }

    UUID runningJob() {
        return runningJob(null);
    }

    // ------------------------------------------------------------------
    // Happy path
    // ------------------------------------------------------------------

    @Test
    void run_allStagesSucceed_completesWithPublishedReport() {
        start(false);
        verifier.returning(env.json.createObjectNode().set("claims", env.json.createArrayNode()
                .add(env.json.createObjectNode()
                        .put("claim", "claim from segment 0")
                        .put("verdict", "Likely False")
                        .put("explanation", "The footage predates the event it claims to show by several years."))));
        UUID id = runningJob();

        JobStatus status = env.executor.run(id);

        Job job = env.store.get(id);
        assertThat(status).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getProgressPercent()).isEqualTo(100);
        assertThat(job.getStageResults()).extracting(StageResult::getStageName)
                .containsExactly("ingestion", "claim_extraction", "evidence_search", "claim_verification");
        assertThat(job.getReportReference()).endsWith(id + ".json");

        JsonNode report = env.publisher.read(job.getReportReference());
        assertThat(report.path("partial").asBoolean()).isFalse();
        assertThat(report.path("claims").get(0).path("verdict").asText()).isEqualTo("LIKELY_FALSE");
        assertThat(report.path("claims").get(0).path("evidence").get(0).path("source").asText())
                .startsWith("https://source.example/search/");
        assertThat(env.meters.counter("verity.jobs.finished", "status", "COMPLETED").count()).isEqualTo(1.0);
    }

    @Test
    void run_passesPriorPayloadsToLaterStages() {
        start(false);
        UUID id = runningJob();

        env.executor.run(id);

        assertThat(verifier.inputs()).hasSize(1);
        assertThat(verifier.inputs().get(0).priorResults())
                .containsOnlyKeys("ingestion", "claim_extraction", "evidence_search");
        assertThat(search.queries()).extracting(q -> q.claimText())
                .containsExactly("claim from segment 0", "claim from segment 1", "claim from segment 2");
    }

    @Test
    void run_jobNotRunning_doesNothing() {
        start(false);
        UUID id = env.admission(new AdmissionPolicy(10, 10, Map.of(), 0))
                .submit("t", "https://video.example/v", null);

        assertThat(env.executor.run(id)).isEqualTo(JobStatus.QUEUED);
        assertThat(ingest.calls()).isZero();
    }

    // ------------------------------------------------------------------
    // Failure
    // ------------------------------------------------------------------

    @Test
    void requiredStageFails_jobFailsAndKeepsEarlierResults() {
        start(false);
        verifier.thenFail(Kind.TRANSIENT, 10);
        search.alwaysFailing(Kind.TRANSIENT);
        UUID id = runningJob();

        JobStatus status = env.executor.run(id);

        Job job = env.store.get(id);
        assertThat(status).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorKind()).isEqualTo(ErrorKind.STAGE_FAILED);
        assertThat(job.getErrorStage()).isEqualTo("evidence_search");
        assertThat(job.getCurrentStageIndex()).isEqualTo(2);
        assertThat(job.getStageResults()).extracting(StageResult::getOutcome)
                .containsExactly(StageOutcome.SUCCEEDED, StageOutcome.SUCCEEDED, StageOutcome.FAILED);
        assertThat(job.getProgressPercent()).isGreaterThanOrEqualTo(50);
        assertThat(job.getReportReference()).isNull();
        assertThat(verifier.calls()).isZero();
    }

    @Test
    void requiredStageFails_withPartialReportsEnabled_attachesPartialReport() {
        start(true);
        verifier.thenFail(Kind.TRANSIENT, 10);
        UUID id = runningJob();

        env.executor.run(id);

        Job job = env.store.get(id);
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getReportReference()).endsWith("-partial.json");
        JsonNode partial = env.publisher.read(job.getReportReference());
        assertThat(partial.path("partial").asBoolean()).isTrue();
        assertThat(partial.path("missingStages").get(0).asText()).isEqualTo("claim_verification");
    }

    @Test
    void stageOverride_fromSubmission_limitsRetries() {
        start(false);
        verifier.thenFail(Kind.TRANSIENT, 10);
        UUID id = runningJob(new SubmissionOptions(3600,
                Map.of("claim_verification", new StageOverride(null, 0))));

        env.executor.run(id);

        assertThat(verifier.calls()).isEqualTo(1);
        assertThat(env.store.get(id).getStatus()).isEqualTo(JobStatus.FAILED);
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    @Test
    void cancelDuringStage_endsCancelledAndRunsNoLaterStage() throws Exception {
        start(false);
        ingest.thenHang(Duration.ofSeconds(30), 1);
        UUID id = runningJob();

        CompletableFuture<JobStatus> running = CompletableFuture.supplyAsync(() -> env.executor.run(id));
        while (ingest.calls() == 0) {
            Thread.sleep(5);
        }
        env.writer.update(id, Job::requestCancel);
        env.cancellations.signal(id);

        assertThat(running.get(5, TimeUnit.SECONDS)).isEqualTo(JobStatus.CANCELLED);
        Job job = env.store.get(id);
        assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(job.getStageResults()).isEmpty();
        assertThat(analysis.analysed()).isEmpty();
        assertThat(env.cancellations.find(id)).isEmpty();
    }

    @Test
    void persistedCancelFlag_isHonouredBeforeFirstStage() {
        start(false);
        UUID id = runningJob();
        env.writer.update(id, Job::requestCancel);

        assertThat(env.executor.run(id)).isEqualTo(JobStatus.CANCELLED);
        assertThat(ingest.calls()).isZero();
    }

    // ------------------------------------------------------------------
    // Resume
    // ------------------------------------------------------------------

    @Test
    void resumedJob_startsAtPersistedStageIndex() {
        start(false);
        UUID id = runningJob();
        String meta = "{\"durationSeconds\":300}";
        env.writer.update(id, j -> j.recordStageResult(0,
                StageResult.succeeded("ingestion", 1, "ingest", meta, env.clock.instant()), 25));

        JobStatus status = env.executor.run(id);

        assertThat(status).isEqualTo(JobStatus.COMPLETED);
        assertThat(ingest.calls()).isZero();
        assertThat(analysis.analysed()).containsExactly(0);
        assertThat(env.store.get(id).stageResult("ingestion").orElseThrow().getPayload()).isEqualTo(meta);
    }

    @Test
    void resumedJob_withRecordedAttempts_keepsItsRetryBudget() {
        start(false);
        ingest.thenFail(Kind.TRANSIENT, 10);
        UUID id = runningJob();
        env.writer.update(id, j -> j.recordAttempt(0));
        env.writer.update(id, j -> j.recordAttempt(0));

        JobStatus status = env.executor.run(id);

        assertThat(status).isEqualTo(JobStatus.FAILED);
        assertThat(ingest.calls()).isEqualTo(1);
        assertThat(env.store.get(id).stageResult("ingestion").orElseThrow().getAttemptCount()).isEqualTo(3);
    }

    @Test
    void optionalStageSkipped_jobStillCompletes() {
        ScriptedStageProvider extra = new ScriptedStageProvider("extra").unavailable("not configured");
        PipelineDefinition p = new PipelineDefinition(List.of(
                direct("ingestion", 0, "ingest"),
                new Stage("enrichment", 1, StageKind.DIRECT, Duration.ofSeconds(5), 0,
                        List.of("extra"), true, null),
                direct("claim_verification", 2, "verifier")));
        env = new TestOrchestrator(p, List.of(ingest, extra, verifier), artifacts, false);
        UUID id = runningJob();

        assertThat(env.executor.run(id)).isEqualTo(JobStatus.COMPLETED);
        Job job = env.store.get(id);
        assertThat(job.stageResult("enrichment").orElseThrow().getOutcome()).isEqualTo(StageOutcome.SKIPPED);
        assertThat(verifier.inputs().get(0).priorResults()).containsOnlyKeys("ingestion");
    }
}
