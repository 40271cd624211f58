package com.verityngn.orchestrator.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.verityngn.orchestrator.model.PipelineDefinition;
import com.verityngn.orchestrator.model.Stage;
import com.verityngn.orchestrator.model.StageOutcome;
import com.verityngn.orchestrator.model.StageResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Pure function from recorded stage results to a {@link Report}.
 *
 * Reads the claim list from the verdict stage payload:
 * <pre>
 *   {"claims": [{"claim"|"text": ..., "verdict"?: label,
 *                "probabilities"?: {"TRUE": p, "FALSE": p, "UNCERTAIN": p},
 *                "explanation"?: ..., "evidence"?: [{"source"|"url": ..., "relevance": r}]}]}
 * </pre>
 * An explicit verdict label wins over the probabilities. Claims without their
 * own evidence list borrow it from the evidence stage payload by claim text.
 * Evidence is ordered by relevance (desc) then source, so the output does not
 * depend on provider ordering quirks.
 */
public class ReportAssembler {

    private static final int MAX_CONCERNS          = 3;
    private static final int MIN_CONCERN_LENGTH    = 50;
    private static final int MAX_CONCERN_LENGTH    = 300;

    private final PipelineDefinition pipeline;
    private final String             verdictStage;
    private final String             evidenceStage;
    private final ObjectMapper       json;

    public ReportAssembler(PipelineDefinition pipeline, String verdictStage, String evidenceStage,
                           ObjectMapper json) {
        if (!pipeline.contains(verdictStage)) {
            throw new IllegalArgumentException("verdict-stage '" + verdictStage + "' is not a configured stage");
        }
        this.pipeline      = pipeline;
        this.verdictStage  = verdictStage;
        this.evidenceStage = evidenceStage;
        this.json          = json;
    }

    /**
     * @throws IncompleteInputException when a required stage has no SUCCEEDED result
     */
    public Report assemble(UUID jobId, List<StageResult> results) {
        List<String> missing = missingRequired(results);
        if (!missing.isEmpty()) {
            throw new IncompleteInputException(missing);
        }
        return build(jobId, results, false, List.of());
    }

    /** Best-effort report for a FAILED job; never throws for missing stages. */
    public Report assemblePartial(UUID jobId, List<StageResult> results) {
        return build(jobId, results, true, missingRequired(results));
    }

    // ------------------------------------------------------------------
    // Assembly
    // ------------------------------------------------------------------

    private Report build(UUID jobId, List<StageResult> results, boolean partial, List<String> missing) {
        Map<String, StageResult> byName = new HashMap<>();
        results.forEach(r -> byName.put(r.getStageName(), r));

        List<StageSummary> stages = new ArrayList<>();
        for (Stage s : pipeline.stages()) {
            StageResult r = byName.get(s.name());
            if (r != null) {
                stages.add(new StageSummary(s.name(), r.getOutcome(), r.getProviderUsed(), r.getAttemptCount()));
            }
        }

        Map<String, List<EvidenceReference>> evidenceByClaim = evidenceIndex(byName.get(evidenceStage));
        List<ClaimVerdict> claims = new ArrayList<>();
        JsonNode verdicts = payloadOf(byName.get(verdictStage));
        for (JsonNode c : verdicts.path("claims")) {
            claims.add(claim(c, evidenceByClaim));
        }
        return new Report(jobId, partial, missing, claims, summarise(claims), stages);
    }

    private ClaimVerdict claim(JsonNode node, Map<String, List<EvidenceReference>> evidenceByClaim) {
        String text = node.isTextual() ? node.asText() : node.path("claim").asText(node.path("text").asText(""));
        String explanation = node.path("explanation").isTextual() ? node.path("explanation").asText() : null;

        Probabilities probabilities = null;
        JsonNode p = node.path("probabilities");
        if (p.isObject()) {
            probabilities = new Probabilities(
                    p.path("TRUE").asDouble(0.0),
                    p.path("FALSE").asDouble(0.0),
                    p.path("UNCERTAIN").asDouble(0.0));
        }
        Probabilities dist = probabilities;
        Verdict verdict = Verdict.fromLabel(node.path("verdict").asText(null))
                .orElseGet(() -> dist == null
                        ? Verdict.UNCERTAIN
                        : Verdict.fromProbabilities(dist.trueProbability(), dist.falseProbability(),
                                                    dist.uncertainProbability()));

        List<EvidenceReference> evidence = node.path("evidence").isArray()
                ? references(node.path("evidence"))
                : evidenceByClaim.getOrDefault(text, List.of());
        return new ClaimVerdict(text, verdict, explanation, probabilities, evidence);
    }

    private Map<String, List<EvidenceReference>> evidenceIndex(StageResult evidence) {
        Map<String, List<EvidenceReference>> index = new HashMap<>();
        for (JsonNode entry : payloadOf(evidence).path("claims")) {
            index.put(entry.path("claim").asText(""), references(entry.path("evidence")));
        }
        return index;
    }

    private static List<EvidenceReference> references(JsonNode items) {
        List<EvidenceReference> refs = new ArrayList<>();
        for (JsonNode e : items) {
            String source = e.path("source").asText(e.path("url").asText(""));
            if (!source.isBlank()) {
                refs.add(new EvidenceReference(source, e.path("relevance").asDouble(0.0)));
            }
        }
        refs.sort(Comparator.comparingDouble(EvidenceReference::relevance).reversed()
                .thenComparing(EvidenceReference::source));
        return refs;
    }

    // ------------------------------------------------------------------
    // Summary
    // ------------------------------------------------------------------

    static ReportSummary summarise(List<ClaimVerdict> claims) {
        Map<Verdict, Integer> counts = new EnumMap<>(Verdict.class);
        for (Verdict v : Verdict.values()) {
            counts.put(v, 0);
        }
        List<String> concerns = new ArrayList<>();
        int trueCount = 0;
        int falseCount = 0;
        for (ClaimVerdict c : claims) {
            counts.merge(c.verdict(), 1, Integer::sum);
            if (c.verdict().countsAsTrue()) trueCount++;
            if (c.verdict().countsAsFalse()) {
                falseCount++;
                String e = c.explanation();
                if (e != null && e.length() > MIN_CONCERN_LENGTH && concerns.size() < MAX_CONCERNS) {
                    concerns.add(e.length() > MAX_CONCERN_LENGTH ? e.substring(0, MAX_CONCERN_LENGTH) + "..." : e);
                }
            }
        }
        int total = claims.size();
        if (total == 0) {
            return new ReportSummary(AssessmentLevel.UNABLE_TO_DETERMINE, 0, counts,
                    "No claims could be verified.", concerns);
        }

        double falsePct     = falseCount * 100.0 / total;
        double truePct      = trueCount * 100.0 / total;
        double uncertainPct = counts.get(Verdict.UNCERTAIN) * 100.0 / total;

        AssessmentLevel level;
        String keyIssue;
        if (falsePct >= 60) {
            level = AssessmentLevel.LIKELY_FALSE;
            keyIssue = format("This video contains predominantly false or misleading claims. "
                    + "%.1f%% of claims appear false or likely false, while %.1f%% appear true or likely true.",
                    falsePct, truePct);
        } else if (truePct >= 60) {
            level = AssessmentLevel.LIKELY_TRUE;
            keyIssue = format("This video contains predominantly accurate claims. "
                    + "%.1f%% of claims appear true or likely true, while %.1f%% appear false or likely false.",
                    truePct, falsePct);
        } else if (uncertainPct >= 50) {
            level = AssessmentLevel.MIXED;
            keyIssue = format("This video contains claims that require additional verification. "
                    + "%.1f%% of claims are uncertain due to insufficient evidence.", uncertainPct);
        } else if (falsePct > truePct) {
            level = AssessmentLevel.LIKELY_FALSE;
            keyIssue = format("This video contains a mix of claims with varying credibility levels. "
                    + "%.1f%% of claims appear false or likely false, while %.1f%% appear true or likely true.",
                    falsePct, truePct);
        } else {
            level = AssessmentLevel.MIXED;
            keyIssue = format("This content contains a mix of true and false claims "
                    + "(%.1f%% false, %.1f%% true), requiring careful evaluation.", falsePct, truePct);
        }
        return new ReportSummary(level, total, counts, keyIssue, concerns);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private List<String> missingRequired(List<StageResult> results) {
        List<String> missing = new ArrayList<>();
        for (String name : pipeline.requiredStageNames()) {
            boolean ok = results.stream().anyMatch(r ->
                    r.getStageName().equals(name) && r.getOutcome() == StageOutcome.SUCCEEDED);
            if (!ok) {
                missing.add(name);
            }
        }
        return missing;
    }

    private JsonNode payloadOf(StageResult result) {
        if (result == null || result.getOutcome() != StageOutcome.SUCCEEDED || result.getPayload() == null) {
            return json.missingNode();
        }
        try {
            return json.readTree(result.getPayload());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stage " + result.getStageName() + " has a corrupt payload", e);
        }
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
