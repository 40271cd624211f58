package com.verityngn.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.verityngn.orchestrator.admission.ValidationException;
import com.verityngn.orchestrator.model.StageOverride;
import com.verityngn.orchestrator.model.SubmissionOptions;

import java.util.HashMap;
import java.util.Map;

/**
 * Recognised submission options. Unknown fields are ignored, not rejected.
 *
 * @param maxVideoDuration seconds of video to analyse at most; absent means the default
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OptionsRequest(Long maxVideoDuration, Map<String, StageOverrideRequest> stageOverrides) {

    public SubmissionOptions toOptions() {
        Map<String, StageOverride> overrides = new HashMap<>();
        if (stageOverrides != null) {
            stageOverrides.forEach((stage, o) -> {
                if (o != null) overrides.put(stage, o.toOverride());
            });
        }
        long maxDuration = maxVideoDuration == null
                ? SubmissionOptions.DEFAULT_MAX_VIDEO_DURATION_SECONDS
                : maxVideoDuration;
        try {
            return new SubmissionOptions(maxDuration, overrides);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
    }
}
