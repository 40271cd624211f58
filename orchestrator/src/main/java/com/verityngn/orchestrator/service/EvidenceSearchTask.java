package com.verityngn.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.verityngn.orchestrator.provider.EvidenceItem;
import com.verityngn.orchestrator.provider.EvidenceProvider;
import com.verityngn.orchestrator.provider.EvidenceQuery;
import com.verityngn.orchestrator.provider.EvidenceResult;
import com.verityngn.orchestrator.provider.ProviderRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;

/**
 * EVIDENCE_SEARCH stages: one provider query per claim of the input stage.
 *
 * Claims are read from {@code claims[]} of the input stage payload, either as
 * plain strings or as objects with a {@code text} (or {@code claim}) field.
 * Each answered claim is checkpointed like a segment, so retries only query
 * the claims still missing.
 */
public class EvidenceSearchTask implements StageTask<EvidenceProvider> {

    private final ProviderRegistry registry;

    public EvidenceSearchTask(ProviderRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Class<EvidenceProvider> providerType() {
        return EvidenceProvider.class;
    }

    @Override
    public JsonNode execute(EvidenceProvider provider, StageContext ctx) {
        List<String> claims = ctx.priorResult(ctx.stage().inputStage())
                .map(EvidenceSearchTask::claimsOf)
                .orElse(List.of());
        SortedMap<Integer, JsonNode> done = ctx.completedSegments();

        for (int i = 0; i < claims.size(); i++) {
            if (done.containsKey(i)) {
                continue;
            }
            ctx.checkpoint();
            String claim = claims.get(i);
            EvidenceResult result = registry.call(provider,
                    () -> provider.query(new EvidenceQuery(claim, ctx.videoReference())));
            ctx.checkpointSegment(i, toJson(ctx, claim, result));
            ctx.reportProgress((double) (i + 1) / claims.size(),
                    "Searched evidence for claim " + (i + 1) + " of " + claims.size());
        }

        ObjectNode out = ctx.json().createObjectNode();
        ArrayNode results = out.putArray("claims");
        ctx.completedSegments().values().forEach(results::add);
        return out;
    }

    static List<String> claimsOf(JsonNode payload) {
        List<String> claims = new ArrayList<>();
        for (JsonNode c : payload.path("claims")) {
            String text = c.isTextual() ? c.asText() : c.path("text").asText(c.path("claim").asText(""));
            if (!text.isBlank()) {
                claims.add(text);
            }
        }
        return claims;
    }

    private static JsonNode toJson(StageContext ctx, String claim, EvidenceResult result) {
        ObjectNode node = ctx.json().createObjectNode();
        node.put("claim", claim);
        ArrayNode evidence = node.putArray("evidence");
        for (EvidenceItem item : result.items()) {
            ObjectNode e = evidence.addObject();
            e.put("source", item.sourceReference());
            e.put("content", item.content());
            e.put("relevance", item.relevance());
        }
        return node;
    }
}
