package com.verityngn.orchestrator.service;

import com.verityngn.orchestrator.model.Job;
import com.verityngn.orchestrator.model.Stage;
import com.verityngn.orchestrator.model.StageKind;
import com.verityngn.orchestrator.model.StageOutcome;
import com.verityngn.orchestrator.model.StageResult;
import com.verityngn.orchestrator.model.SubmissionOptions;
import com.verityngn.orchestrator.provider.ProviderException;
import com.verityngn.orchestrator.provider.ProviderException.Kind;
import com.verityngn.orchestrator.support.ScriptedStageProvider;
import com.verityngn.orchestrator.support.TestOrchestrator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static com.verityngn.orchestrator.support.TestOrchestrator.direct;
import static com.verityngn.orchestrator.support.TestOrchestrator.pipeline;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Retry, timeout, fallback and cancellation of a single stage, run against
 * the in-memory store so persisted attempt counts can be checked.
 */
class StageRunnerTest {

    @TempDir Path artifacts;

    TestOrchestrator env;

    @AfterEach
    void tearDown() {
        if (env != null) env.close();
    }

    /** One-stage pipeline; returns the context for a promoted job. */
    StageContext contextFor(Stage stage, ScriptedStageProvider... providers) {
        env = new TestOrchestrator(pipeline(stage), List.of(providers), artifacts, false, Duration.ofMillis(100));
        Job job = new Job("t", "https://video.example/v", null, 1, env.clock.instant());
        env.store.create(job);
        env.writer.update(job.getId(), j -> j.promote("w1", env.clock.instant()));
        return new StageContext(env.store.get(job.getId()), stage, 0, SubmissionOptions.defaults(), Map.of(),
                new CancellationToken(job.getId()), env.store, env.writer, env.progress, env.json);
    }

    /** Same as {@link #contextFor} but with attempts already persisted, as after a restart. */
    StageContext resumedContextFor(Stage stage, int priorAttempts, ScriptedStageProvider... providers) {
        StageContext fresh = contextFor(stage, providers);
        for (int i = 0; i < priorAttempts; i++) {
            env.writer.update(fresh.jobId(), j -> j.recordAttempt(0));
        }
        return new StageContext(env.store.get(fresh.jobId()), stage, 0, SubmissionOptions.defaults(), Map.of(),
                fresh.token(), env.store, env.writer, env.progress, env.json);
    }

    StageResult run(StageContext ctx) {
        StageRunner runner = new StageRunner(env.registry, BackoffPolicy.none(), env.callPool,
                Duration.ofMillis(100), env.json, env.clock);
        return runner.run(ctx, new DirectStageTask(env.registry));
    }

    int persistedAttempts(StageContext ctx) {
        return env.store.get(ctx.jobId()).getCurrentStageAttempts();
    }

    // ------------------------------------------------------------------
    // Retry budget
    // ------------------------------------------------------------------

    @Test
    void success_firstAttempt() {
        ScriptedStageProvider p = new ScriptedStageProvider("p");
        StageContext ctx = contextFor(direct("s", 0, "p"), p);

        StageResult result = run(ctx);

        assertThat(result.getOutcome()).isEqualTo(StageOutcome.SUCCEEDED);
        assertThat(result.getAttemptCount()).isEqualTo(1);
        assertThat(result.getProviderUsed()).isEqualTo("p");
        assertThat(result.getPayload()).contains("\"provider\":\"p\"");
    }

    @Test
    void alwaysTransient_makesExactlyRetriesPlusOneAttempts() {
        ScriptedStageProvider p = new ScriptedStageProvider("p").thenFail(Kind.TRANSIENT, 10);
        StageContext ctx = contextFor(direct("s", 0, 3, Duration.ofSeconds(5), "p"), p);

        StageResult result = run(ctx);

        assertThat(p.calls()).isEqualTo(4);
        assertThat(result.getOutcome()).isEqualTo(StageOutcome.FAILED);
        assertThat(result.getAttemptCount()).isEqualTo(4);
        assertThat(result.getMessage()).contains("TRANSIENT");
        assertThat(persistedAttempts(ctx)).isEqualTo(4);
    }

    @Test
    void rateLimited_countsAgainstBudget() {
        ScriptedStageProvider p = new ScriptedStageProvider("p")
                .thenThrow(ProviderException.rateLimited("slow down", Duration.ZERO));
        StageContext ctx = contextFor(direct("s", 0, 1, Duration.ofSeconds(5), "p"), p);

        StageResult result = run(ctx);

        assertThat(result.getOutcome()).isEqualTo(StageOutcome.SUCCEEDED);
        assertThat(result.getAttemptCount()).isEqualTo(2);
    }

    @Test
    void unexpectedException_isTreatedAsTransient() {
        ScriptedStageProvider p = new ScriptedStageProvider("p").thenThrow(new IllegalStateException("bug"));
        StageContext ctx = contextFor(direct("s", 0, 1, Duration.ofSeconds(5), "p"), p);

        StageResult result = run(ctx);

        assertThat(result.getOutcome()).isEqualTo(StageOutcome.SUCCEEDED);
        assertThat(result.getAttemptCount()).isEqualTo(2);
    }

    // ------------------------------------------------------------------
    // Resumed stages
    // ------------------------------------------------------------------

    @Test
    void resumedStage_onlyUsesRemainingBudget() {
        ScriptedStageProvider p = new ScriptedStageProvider("p").thenFail(Kind.TRANSIENT, 10);
        StageContext ctx = resumedContextFor(direct("s", 0, 2, Duration.ofSeconds(5), "p"), 2, p);

        StageResult result = run(ctx);

        assertThat(p.calls()).isEqualTo(1);
        assertThat(result.getOutcome()).isEqualTo(StageOutcome.FAILED);
        assertThat(result.getAttemptCount()).isEqualTo(3);
        assertThat(persistedAttempts(ctx)).isEqualTo(3);
    }

    @Test
    void resumedStage_spentPrimary_goesStraightToFallback() {
        ScriptedStageProvider a = new ScriptedStageProvider("a");
        ScriptedStageProvider b = new ScriptedStageProvider("b");
        StageContext ctx = resumedContextFor(direct("s", 0, 1, Duration.ofSeconds(5), "a", "b"), 2, a, b);

        StageResult result = run(ctx);

        assertThat(a.calls()).isZero();
        assertThat(b.calls()).isEqualTo(1);
        assertThat(result.getProviderUsed()).isEqualTo("b");
        assertThat(result.getAttemptCount()).isEqualTo(3);
    }

    @Test
    void resumedStage_withoutRecordedAttempts_getsFullBudget() {
        ScriptedStageProvider p = new ScriptedStageProvider("p").thenFail(Kind.TRANSIENT, 2);
        StageContext ctx = resumedContextFor(direct("s", 0, 2, Duration.ofSeconds(5), "p"), 0, p);

        StageResult result = run(ctx);

        assertThat(p.calls()).isEqualTo(3);
        assertThat(result.getOutcome()).isEqualTo(StageOutcome.SUCCEEDED);
    }

    // ------------------------------------------------------------------
    // Timeouts
    // ------------------------------------------------------------------

    @Test
    void deadline_saturatesForHugeTimeouts() {
        long before = System.nanoTime();

        long deadline = StageRunner.deadline(Duration.ofSeconds(Long.MAX_VALUE));

        assertThat(deadline - before).isPositive();
        assertThat(StageRunner.deadline(Duration.ofMillis(100)) - before)
                .isBetween(TimeUnit.MILLISECONDS.toNanos(100), TimeUnit.SECONDS.toNanos(10));
    }

    @Test
    void longestAllowedTimeout_runsNormally() {
        ScriptedStageProvider p = new ScriptedStageProvider("p");
        StageContext ctx = contextFor(direct("s", 0, 0, Stage.MAX_TIMEOUT, "p"), p);

        assertThat(run(ctx).getOutcome()).isEqualTo(StageOutcome.SUCCEEDED);
    }

    @Test
    void twoTimeoutsThenSuccess_recordsThreeAttempts() {
        ScriptedStageProvider p = new ScriptedStageProvider("p").thenHang(Duration.ofSeconds(3), 2);
        StageContext ctx = contextFor(direct("s", 0, 2, Duration.ofMillis(150), "p"), p);

        StageResult result = run(ctx);

        assertThat(result.getOutcome()).isEqualTo(StageOutcome.SUCCEEDED);
        assertThat(result.getAttemptCount()).isEqualTo(3);
        assertThat(p.calls()).isEqualTo(3);
    }

    @Test
    void timeoutsExhaustBudget_stageFails() {
        ScriptedStageProvider p = new ScriptedStageProvider("p").thenHang(Duration.ofSeconds(3), 5);
        StageContext ctx = contextFor(direct("s", 0, 1, Duration.ofMillis(100), "p"), p);

        StageResult result = run(ctx);

        assertThat(result.getOutcome()).isEqualTo(StageOutcome.FAILED);
        assertThat(result.getMessage()).contains("TIMEOUT");
        assertThat(result.getAttemptCount()).isEqualTo(2);
    }

    // ------------------------------------------------------------------
    // Fallback
    // ------------------------------------------------------------------

    @Test
    void unavailablePrimary_fallsBackWithoutCountingAttempts() {
        ScriptedStageProvider a = new ScriptedStageProvider("a").unavailable("no key");
        ScriptedStageProvider b = new ScriptedStageProvider("b");
        StageContext ctx = contextFor(direct("s", 0, "a", "b"), a, b);

        StageResult result = run(ctx);

        assertThat(a.calls()).isZero();
        assertThat(result.getProviderUsed()).isEqualTo("b");
        assertThat(result.getAttemptCount()).isEqualTo(1);
    }

    @Test
    void unavailableAtCallTime_fallsBackImmediately() {
        ScriptedStageProvider a = new ScriptedStageProvider("a").thenFail(Kind.UNAVAILABLE, 1);
        ScriptedStageProvider b = new ScriptedStageProvider("b");
        StageContext ctx = contextFor(direct("s", 0, "a", "b"), a, b);

        StageResult result = run(ctx);

        assertThat(a.calls()).isEqualTo(1);
        assertThat(result.getProviderUsed()).isEqualTo("b");
        assertThat(result.getAttemptCount()).isEqualTo(1);
        assertThat(persistedAttempts(ctx)).isZero();
    }

    @Test
    void exhaustedPrimary_fallsBackWithFreshBudget() {
        ScriptedStageProvider a = new ScriptedStageProvider("a").thenFail(Kind.TRANSIENT, 3);
        ScriptedStageProvider b = new ScriptedStageProvider("b").thenFail(Kind.TRANSIENT, 2);
        StageContext ctx = contextFor(direct("s", 0, 2, Duration.ofSeconds(5), "a", "b"), a, b);

        StageResult result = run(ctx);

        assertThat(a.calls()).isEqualTo(3);
        assertThat(b.calls()).isEqualTo(3);
        assertThat(result.getOutcome()).isEqualTo(StageOutcome.SUCCEEDED);
        assertThat(result.getProviderUsed()).isEqualTo("b");
        assertThat(result.getAttemptCount()).isEqualTo(6);
    }

    @Test
    void unknownProviderName_isSkipped() {
        ScriptedStageProvider b = new ScriptedStageProvider("b");
        StageContext ctx = contextFor(direct("s", 0, "not-installed", "b"), b);

        assertThat(run(ctx).getProviderUsed()).isEqualTo("b");
    }

    @Test
    void noProviderAvailable_requiredStageFails() {
        ScriptedStageProvider a = new ScriptedStageProvider("a").unavailable("down");
        StageContext ctx = contextFor(direct("s", 0, "a"), a);

        StageResult result = run(ctx);

        assertThat(result.getOutcome()).isEqualTo(StageOutcome.FAILED);
        assertThat(result.getAttemptCount()).isZero();
        assertThat(result.getMessage()).contains("unavailable");
    }

    @Test
    void optionalStage_isSkippedWhenChainExhausted() {
        Stage optional = new Stage("extra", 0, StageKind.DIRECT, Duration.ofSeconds(5), 1,
                List.of("a"), true, null);
        ScriptedStageProvider a = new ScriptedStageProvider("a").thenFail(Kind.TRANSIENT, 5);
        StageContext ctx = contextFor(optional, a);

        StageResult result = run(ctx);

        assertThat(result.getOutcome()).isEqualTo(StageOutcome.SKIPPED);
        assertThat(result.getAttemptCount()).isEqualTo(2);
        assertThat(result.getPayload()).isNull();
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    @Test
    void cancelledBeforeStart_throwsWithoutCallingProvider() {
        ScriptedStageProvider p = new ScriptedStageProvider("p");
        StageContext ctx = contextFor(direct("s", 0, "p"), p);
        ctx.token().cancel();

        assertThatThrownBy(() -> run(ctx)).isInstanceOf(JobCancelledException.class);
        assertThat(p.calls()).isZero();
    }

    @Test
    void cancelDuringHangingCall_abortsWithinGrace() throws Exception {
        ScriptedStageProvider p = new ScriptedStageProvider("p").thenHang(Duration.ofSeconds(30), 1);
        StageContext ctx = contextFor(direct("s", 0, 0, Duration.ofSeconds(60), "p"), p);

        CompletableFuture<StageResult> running = CompletableFuture.supplyAsync(() -> run(ctx));
        while (p.calls() == 0) {
            Thread.sleep(5);
        }
        long start = System.nanoTime();
        ctx.token().cancel();

        assertThatThrownBy(() -> running.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(JobCancelledException.class);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(3));
    }

    @Test
    void cancelDuringBackoff_wakesImmediately() throws Exception {
        ScriptedStageProvider p = new ScriptedStageProvider("p").thenFail(Kind.TRANSIENT, 5);
        Stage stage = direct("s", 0, 3, Duration.ofSeconds(5), "p");
        StageContext ctx = contextFor(stage, p);
        StageRunner slow = new StageRunner(env.registry,
                new BackoffPolicy(Duration.ofSeconds(30), Duration.ofSeconds(30)),
                env.callPool, Duration.ofMillis(100), env.json, env.clock);

        CompletableFuture<StageResult> running = CompletableFuture.supplyAsync(
                () -> slow.run(ctx, new DirectStageTask(env.registry)));
        while (p.calls() == 0) {
            Thread.sleep(5);
        }
        ctx.token().cancel();

        assertThatThrownBy(() -> running.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(JobCancelledException.class);
        assertThat(p.calls()).isEqualTo(1);
    }
}
