package com.verityngn.orchestrator.provider.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.verityngn.orchestrator.provider.ProviderAvailability;
import com.verityngn.orchestrator.provider.StageInput;
import com.verityngn.orchestrator.provider.StageProvider;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Remote stage service (ingestion, claim extraction, verification).
 * POST {base-url}/execute with the job context and prior stage payloads.
 */
public class HttpStageProvider implements StageProvider {

    private final String             name;
    private final boolean            enabled;
    private final String             healthPath;
    private final HttpProviderClient client;

    public HttpStageProvider(String name, boolean enabled, String healthPath, HttpProviderClient client) {
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
    public JsonNode execute(StageInput input) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("job_id",          input.jobId().toString());
        body.put("stage",           input.stageName());
        body.put("video_reference", input.videoReference());
        body.put("max_video_duration", input.options().maxVideoDurationSeconds());
        body.put("prior_results",   input.priorResults());
        return client.post("/execute", body);
    }
}
