package com.verityngn.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.verityngn.orchestrator.model.StageOverride;

/**
 * Per-stage override inside submission options.
 *
 * @param timeout    attempt timeout in seconds
 * @param maxRetries retries per provider
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StageOverrideRequest(Long timeout, Integer maxRetries) {

    public StageOverride toOverride() {
        return new StageOverride(timeout, maxRetries);
    }
}
