package com.verityngn.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.verityngn.orchestrator.model.StageOutcome;
import com.verityngn.orchestrator.model.StageResult;

import java.time.Instant;

/**
 * Read-only view of a recorded stage returned by GET /jobs/{id}/stages.
 * payload is the provider output, passed through as JSON.
 */
public record StageResultResponse(
        String       stage,
        StageOutcome outcome,
        int          attemptCount,
        String       providerUsed,
        String       message,
        Instant      recordedAt,
        @JsonRawValue String payload
) {
    public static StageResultResponse from(StageResult r) {
        return new StageResultResponse(
                r.getStageName(),
                r.getOutcome(),
                r.getAttemptCount(),
                r.getProviderUsed(),
                r.getMessage(),
                r.getRecordedAt(),
                r.getPayload()
        );
    }
}
