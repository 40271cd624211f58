package com.verityngn.orchestrator.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.verityngn.orchestrator.model.SubmissionOptions;

import java.util.Map;
import java.util.UUID;

/**
 * Everything a DIRECT stage provider gets to see.
 *
 * @param priorResults payloads of earlier SUCCEEDED stages keyed by stage name, in pipeline order
 */
public record StageInput(
        UUID                  jobId,
        String                stageName,
        String                videoReference,
        SubmissionOptions     options,
        Map<String, JsonNode> priorResults) {}
