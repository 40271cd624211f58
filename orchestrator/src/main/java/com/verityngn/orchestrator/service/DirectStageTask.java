package com.verityngn.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.verityngn.orchestrator.provider.ProviderRegistry;
import com.verityngn.orchestrator.provider.StageProvider;

/** DIRECT stages: one provider call, payload stored as returned. */
public class DirectStageTask implements StageTask<StageProvider> {

    private final ProviderRegistry registry;

    public DirectStageTask(ProviderRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Class<StageProvider> providerType() {
        return StageProvider.class;
    }

    @Override
    public JsonNode execute(StageProvider provider, StageContext ctx) {
        return registry.call(provider, () -> provider.execute(ctx.stageInput()));
    }
}
