package com.verityngn.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.verityngn.orchestrator.provider.AnalysisProvider;
import com.verityngn.orchestrator.provider.AnalysisResult;
import com.verityngn.orchestrator.provider.ProviderRegistry;
import com.verityngn.orchestrator.provider.VideoSegment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.SortedMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * SEGMENTED_ANALYSIS stages: split the video into time windows and analyse
 * them with a fixed fan-out limit.
 *
 * Each finished segment is checkpointed to the store, so a retry or a resumed
 * job only analyses the segments still missing. The aggregated payload is
 * built from the checkpoints ordered by segment index, never from completion
 * order.
 *
 * The video duration comes from the first earlier stage payload carrying a
 * numeric {@code durationSeconds} (normally ingestion).
 */
public class SegmentedAnalysisTask implements StageTask<AnalysisProvider> {

    private static final Logger log = LoggerFactory.getLogger(SegmentedAnalysisTask.class);

    private final ProviderRegistry registry;
    private final SegmentPlanner   planner;
    private final ExecutorService  segmentPool;
    private final int              fanOut;

    public SegmentedAnalysisTask(ProviderRegistry registry, SegmentPlanner planner,
                                 ExecutorService segmentPool, int fanOut) {
        if (fanOut < 1) {
            throw new IllegalArgumentException("segment-concurrency must be >= 1");
        }
        this.registry    = registry;
        this.planner     = planner;
        this.segmentPool = segmentPool;
        this.fanOut      = fanOut;
    }

    @Override
    public Class<AnalysisProvider> providerType() {
        return AnalysisProvider.class;
    }

    @Override
    public JsonNode execute(AnalysisProvider provider, StageContext ctx) {
        long duration = videoDuration(ctx).orElseThrow(() ->
                new IllegalStateException("No earlier stage reported durationSeconds"));
        List<VideoSegment> segments = planner.plan(
                ctx.videoReference(), duration, ctx.options().maxVideoDurationSeconds());
        Set<Integer> done = ctx.completedSegments().keySet();
        int total = segments.size();
        if (!done.isEmpty()) {
            log.info("Resuming {}: {}/{} segments already checkpointed", ctx.stage().name(), done.size(), total);
        }

        AtomicInteger finished = new AtomicInteger(done.size());
        Semaphore slots = new Semaphore(fanOut);
        List<Future<?>> inFlight = new ArrayList<>();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        try {
            for (VideoSegment segment : segments) {
                if (done.contains(segment.index())) {
                    continue;
                }
                ctx.checkpoint();
                slots.acquire();
                rethrowFirstFailure(inFlight);
                inFlight.add(segmentPool.submit(() -> {
                    if (mdc != null) MDC.setContextMap(mdc);
                    try {
                        AnalysisResult result = registry.call(provider, () -> provider.analyze(segment));
                        ctx.checkpointSegment(segment.index(), toJson(ctx, segment, result));
                        int n = finished.incrementAndGet();
                        ctx.reportBoundary((double) n / total,
                                "Analysed segment " + n + " of " + total);
                    } finally {
                        slots.release();
                        MDC.clear();
                    }
                }));
            }
            for (Future<?> f : inFlight) {
                f.get();
            }
        } catch (InterruptedException e) {
            inFlight.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new WorkerInterruptedException("Segment analysis interrupted", e);
        } catch (ExecutionException e) {
            inFlight.forEach(f -> f.cancel(true));
            throw asRuntime(e.getCause());
        } catch (RuntimeException e) {
            inFlight.forEach(f -> f.cancel(true));
            throw e;
        }
        return aggregate(ctx, ctx.completedSegments(), total, duration);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static OptionalLong videoDuration(StageContext ctx) {
        for (JsonNode payload : ctx.priorResults().values()) {
            JsonNode d = payload.path("durationSeconds");
            if (d.isNumber()) {
                return OptionalLong.of(d.asLong());
            }
        }
        return OptionalLong.empty();
    }

    private static void rethrowFirstFailure(List<Future<?>> inFlight)
            throws InterruptedException, ExecutionException {
        for (Future<?> f : inFlight) {
            if (f.isDone() && !f.isCancelled()) {
                f.get();
            }
        }
    }

    private static RuntimeException asRuntime(Throwable cause) {
        if (cause instanceof RuntimeException re) {
            return re;
        }
        if (cause instanceof Error err) {
            throw err;
        }
        return new IllegalStateException(cause);
    }

    private static JsonNode toJson(StageContext ctx, VideoSegment segment, AnalysisResult result) {
        ObjectNode node = ctx.json().createObjectNode();
        node.put("index", segment.index());
        node.put("startSeconds", segment.startSeconds());
        node.put("endSeconds", segment.endSeconds());
        ArrayNode claims = node.putArray("claims");
        result.claims().forEach(claims::add);
        if (result.details() != null) {
            node.set("details", result.details());
        }
        return node;
    }

    private static JsonNode aggregate(StageContext ctx, SortedMap<Integer, JsonNode> segments,
                                      int total, long duration) {
        ObjectNode out = ctx.json().createObjectNode();
        out.put("durationSeconds", duration);
        out.put("analysedSeconds", Math.min(duration, ctx.options().maxVideoDurationSeconds()));
        out.put("segmentCount", total);
        ArrayNode segs = out.putArray("segments");
        ArrayNode claims = out.putArray("claims");
        segments.forEach((index, payload) -> {
            segs.add(payload);
            for (JsonNode c : payload.path("claims")) {
                ObjectNode claim = claims.addObject();
                claim.put("text", c.asText());
                claim.put("segment", index);
            }
        });
        return out;
    }
}
