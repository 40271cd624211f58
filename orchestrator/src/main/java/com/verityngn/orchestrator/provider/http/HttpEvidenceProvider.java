package com.verityngn.orchestrator.provider.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.verityngn.orchestrator.provider.EvidenceItem;
import com.verityngn.orchestrator.provider.EvidenceProvider;
import com.verityngn.orchestrator.provider.EvidenceQuery;
import com.verityngn.orchestrator.provider.EvidenceResult;
import com.verityngn.orchestrator.provider.ProviderAvailability;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Remote evidence search (web search, video search, fact-check lookups).
 * POST {base-url}/query; expects {"results": [{"source", "content", "relevance"}]}.
 */
public class HttpEvidenceProvider implements EvidenceProvider {

    private final String             name;
    private final boolean            enabled;
    private final String             healthPath;
    private final HttpProviderClient client;

    public HttpEvidenceProvider(String name, boolean enabled, String healthPath, HttpProviderClient client) {
        this.name       = name;
        this.enabled    = enabled;
        this.healthPath = healthPath;
        this.client     = client;
    }

    @Override public String name() { return name; }

    @Override
    public ProviderAvailability probe() {
        return enabled ? client.health(healthPath) : ProviderAvailability.down("disabled");
    }

    @Override
    public EvidenceResult query(EvidenceQuery query) {
        JsonNode resp = client.post("/query", Map.of(
                "claim",   query.claimText(),
                "context", query.context() == null ? "" : query.context()));
        List<EvidenceItem> items = new ArrayList<>();
        for (JsonNode r : resp.path("results")) {
            items.add(new EvidenceItem(
                    r.path("source").asText(),
                    r.path("content").asText(""),
                    r.path("relevance").asDouble(0.0)));
        }
        return new EvidenceResult(items);
    }
}
