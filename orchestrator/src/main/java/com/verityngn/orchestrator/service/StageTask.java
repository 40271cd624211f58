package com.verityngn.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.verityngn.orchestrator.provider.Provider;
import com.verityngn.orchestrator.provider.ProviderException;

/**
 * How one stage kind drives a provider during a single attempt.
 *
 * A task runs on a provider-call thread and may be interrupted when the
 * attempt times out or the job is cancelled.
 */
public interface StageTask<P extends Provider> {

    /** Capability interface fallback-chain entries must implement for this task. */
    Class<P> providerType();

    /**
     * Run one attempt against {@code provider}.
     *
     * @return the stage payload
     * @throws ProviderException on provider failure
     */
    JsonNode execute(P provider, StageContext ctx);
}
