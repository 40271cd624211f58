package com.verityngn.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.verityngn.orchestrator.model.Stage;
import com.verityngn.orchestrator.model.StageAttemptState;
import com.verityngn.orchestrator.model.StageResult;
import com.verityngn.orchestrator.provider.Provider;
import com.verityngn.orchestrator.provider.ProviderException;
import com.verityngn.orchestrator.provider.ProviderException.Kind;
import com.verityngn.orchestrator.provider.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one stage to a terminal outcome: retry, backoff and fallback.
 *
 * <pre>
 *   for provider in fallback chain:
 *     unavailable / not installed     → next provider, no attempt counted
 *     up to max_retries + 1 attempts:
 *       ATTEMPTING → SUCCEEDED          → StageResult(SUCCEEDED)
 *                  → RETRYING           (transient, rate limited, timeout; backoff)
 *                  → FALLING_BACK       (budget spent or provider went away)
 *   chain exhausted: optional → SKIPPED, required → FAILED with last error
 * </pre>
 *
 * Attempts already persisted for the stage (a run resumed after a restart or
 * stall recovery) are charged to the chain in order before any new call, so
 * a resumed stage never gets a fresh budget.
 *
 * Every attempt runs on the provider-call pool and is bounded by the stage
 * timeout here, not by the provider. While waiting, the runner watches the
 * job's cancellation token; a cancelled attempt gets the grace period to
 * finish before it is interrupted.
 */
public class StageRunner {

    private static final Logger log = LoggerFactory.getLogger(StageRunner.class);

    private static final long POLL_MILLIS = 25;

    private final ProviderRegistry registry;
    private final BackoffPolicy    backoff;
    private final ExecutorService  callPool;
    private final Duration         cancelGrace;
    private final ObjectMapper     json;
    private final Clock            clock;

    public StageRunner(ProviderRegistry registry, BackoffPolicy backoff, ExecutorService callPool,
                       Duration cancelGrace, ObjectMapper json, Clock clock) {
        this.registry    = registry;
        this.backoff     = backoff;
        this.callPool    = callPool;
        this.cancelGrace = cancelGrace;
        this.json        = json;
        this.clock       = clock;
    }

    /**
     * @throws JobCancelledException      when the job is cancelled mid-stage
     * @throws WorkerInterruptedException when the worker thread is interrupted
     */
    public <P extends Provider> StageResult run(StageContext ctx, StageTask<P> task) {
        Stage stage = ctx.stage();
        int budget = stage.maxRetries() + 1;
        int carried = ctx.priorAttempts();
        int attempts = carried;
        String lastProvider = null;
        String lastError = "no provider in the fallback chain is available";
        if (carried > 0) {
            log.info("Stage {} resumed with {} attempt(s) already made", stage.name(), carried);
        }

        for (String providerName : stage.fallbackChain()) {
            Optional<P> resolved = registry.resolve(providerName, task.providerType());
            if (resolved.isEmpty()) {
                log.warn("Stage {}: provider '{}' unavailable, falling back", stage.name(), providerName);
                lastError = "provider '" + providerName + "' unavailable";
                continue;
            }
            P provider = resolved.get();
            lastProvider = providerName;
            int spent = Math.min(carried, budget);
            carried -= spent;
            if (spent == budget) {
                log.warn("Stage {}: provider '{}' used its {} attempt(s) before resume, {}", stage.name(),
                        providerName, budget, StageAttemptState.FALLING_BACK);
                lastError = "provider '" + providerName + "' exhausted its attempts before resume";
                continue;
            }

            for (int attempt = spent; attempt <= stage.maxRetries(); attempt++) {
                ctx.checkpoint();
                MDC.put("attempt", String.valueOf(attempts + 1));
                log.debug("Stage {} {} via '{}' (attempt {}/{})", stage.name(), StageAttemptState.ATTEMPTING,
                        providerName, attempt + 1, budget);
                try {
                    JsonNode payload = attempt(() -> task.execute(provider, ctx), stage.timeout(), ctx);
                    attempts++;
                    log.info("Stage {} {} via '{}' after {} attempt(s)",
                            stage.name(), StageAttemptState.SUCCEEDED, providerName, attempts);
                    return StageResult.succeeded(stage.name(), attempts, providerName,
                            write(payload), clock.instant());
                } catch (ProviderException e) {
                    lastError = e.getMessage();
                    if (e.getKind() == Kind.UNAVAILABLE) {
                        log.warn("Stage {}: provider '{}' became unavailable, falling back: {}",
                                stage.name(), providerName, e.getMessage());
                        break;
                    }
                    attempts++;
                    ctx.recordAttempt();
                    if (attempt < stage.maxRetries()) {
                        Duration delay = backoff.delayFor(attempt, e.getRetryAfter());
                        log.warn("Stage {} {} '{}' in {} ms after: {}", stage.name(),
                                StageAttemptState.RETRYING, providerName, delay.toMillis(), e.getMessage());
                        ctx.token().sleep(delay);
                    } else {
                        log.warn("Stage {}: provider '{}' exhausted {} attempt(s), {}", stage.name(),
                                providerName, budget, StageAttemptState.FALLING_BACK);
                    }
                } finally {
                    MDC.remove("attempt");
                }
            }
        }

        if (stage.optional()) {
            log.warn("Optional stage {} skipped: {}", stage.name(), lastError);
            return StageResult.skipped(stage.name(), attempts, lastError, clock.instant());
        }
        log.warn("Stage {} {}: {}", stage.name(), StageAttemptState.FAILED, lastError);
        return StageResult.failed(stage.name(), attempts, lastProvider, lastError, clock.instant());
    }

    // ------------------------------------------------------------------
    // One bounded attempt
    // ------------------------------------------------------------------

    private JsonNode attempt(Callable<JsonNode> call, Duration timeout, StageContext ctx) {
        long deadline = deadline(timeout);
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<JsonNode> future = callPool.submit(() -> {
            if (mdc != null) MDC.setContextMap(mdc);
            try {
                return call.call();
            } finally {
                MDC.clear();
            }
        });
        try {
            while (true) {
                if (ctx.token().isCancelled()) {
                    throw abort(future, ctx);
                }
                long remaining = deadline - System.nanoTime();
                try {
                    return future.get(Math.max(1, Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(POLL_MILLIS))),
                            TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    if (System.nanoTime() - deadline >= 0) {
                        future.cancel(true);
                        throw new ProviderException(Kind.TIMEOUT,
                                "stage " + ctx.stage().name() + " attempt exceeded " + timeout, e);
                    }
                }
            }
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new WorkerInterruptedException("Interrupted while waiting for a provider", e);
        }
    }

    /** Saturates instead of overflowing for very long timeouts. */
    static long deadline(Duration timeout) {
        long now = System.nanoTime();
        long nanos;
        try {
            nanos = timeout.toNanos();
        } catch (ArithmeticException e) {
            nanos = Long.MAX_VALUE;
        }
        return now + Math.min(nanos, Long.MAX_VALUE - Math.max(now, 0));
    }

    /** Give the in-flight call the grace period, then interrupt it. */
    private JobCancelledException abort(Future<JsonNode> future, StageContext ctx) throws InterruptedException {
        try {
            future.get(cancelGrace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.info("Provider call still running after {} ms grace, interrupting", cancelGrace.toMillis());
            future.cancel(true);
        } catch (ExecutionException e) {
            log.debug("Provider call ended with {} during cancellation", e.getCause().toString());
        }
        return new JobCancelledException(ctx.jobId());
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof ProviderException
                || cause instanceof JobCancelledException
                || cause instanceof WorkerInterruptedException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error err) {
            throw err;
        }
        return new ProviderException(Kind.TRANSIENT, String.valueOf(cause.getMessage()), cause);
    }

    private String write(JsonNode payload) {
        try {
            return json.writeValueAsString(payload == null ? json.nullNode() : payload);
        } catch (JsonProcessingException e) {
            throw new ProviderException(Kind.TRANSIENT, "provider returned an unserialisable payload", e);
        }
    }
}
