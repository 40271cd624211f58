package com.verityngn.orchestrator.model;

import java.util.Map;

/**
 * Recognised submission options, stored on the job as JSON.
 *
 * @param maxVideoDurationSeconds analysed span of the video is capped at this many seconds; must be positive
 * @param stageOverrides          per-stage timeout / retry overrides keyed by stage name
 */
public record SubmissionOptions(long maxVideoDurationSeconds, Map<String, StageOverride> stageOverrides) {

    public static final long DEFAULT_MAX_VIDEO_DURATION_SECONDS = 3600;

    public SubmissionOptions {
        if (maxVideoDurationSeconds <= 0) {
            throw new IllegalArgumentException("maxVideoDuration must be positive, got " + maxVideoDurationSeconds);
        }
        stageOverrides = stageOverrides == null ? Map.of() : Map.copyOf(stageOverrides);
    }

    public static SubmissionOptions defaults() {
        return new SubmissionOptions(DEFAULT_MAX_VIDEO_DURATION_SECONDS, Map.of());
    }
}
