package com.verityngn.orchestrator.provider.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.verityngn.orchestrator.provider.AnalysisProvider;
import com.verityngn.orchestrator.provider.AnalysisResult;
import com.verityngn.orchestrator.provider.ProviderAvailability;
import com.verityngn.orchestrator.provider.VideoSegment;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Remote multimodal analysis service.
 * POST {base-url}/analyze with one segment; expects {"claims": [...], ...}.
 */
public class HttpAnalysisProvider implements AnalysisProvider {

    private final String             name;
    private final boolean            enabled;
    private final String             healthPath;
    private final HttpProviderClient client;

    public HttpAnalysisProvider(String name, boolean enabled, String healthPath, HttpProviderClient client) {
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
    public AnalysisResult analyze(VideoSegment segment) {
        JsonNode resp = client.post("/analyze", Map.of(
                "video_reference", segment.videoReference(),
                "segment_index",   segment.index(),
                "start_seconds",   segment.startSeconds(),
                "end_seconds",     segment.endSeconds()));
        List<String> claims = new ArrayList<>();
        resp.path("claims").forEach(c -> claims.add(c.isTextual() ? c.asText() : c.path("text").asText()));
        return new AnalysisResult(claims, resp);
    }
}
