package com.verityngn.orchestrator.provider;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Provider for DIRECT stages (ingestion, claim preparation, verification).
 */
public interface StageProvider extends Provider {

    @Override
    default Capability capability() { return Capability.STAGE; }

    /**
     * Run the stage once and return its payload.
     *
     * @throws ProviderException on a transient, rate-limit, timeout or availability failure
     */
    JsonNode execute(StageInput input) throws ProviderException;
}
