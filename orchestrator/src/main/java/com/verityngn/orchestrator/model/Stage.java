package com.verityngn.orchestrator.model;

import java.time.Duration;
import java.util.List;

/**
 * Static definition of one pipeline stage.
 *
 * @param name          unique stage name, also the key of its StageResult
 * @param ordinal       position in the pipeline, 0-based
 * @param kind          how the executor drives the provider
 * @param timeout       limit for a single provider attempt; positive and at most {@link #MAX_TIMEOUT}
 * @param maxRetries    retries per provider after the first attempt
 * @param fallbackChain provider names tried in order
 * @param optional      when true an exhausted chain skips the stage instead of failing the job
 * @param inputStage    stage whose payload feeds an EVIDENCE_SEARCH stage, null otherwise
 */
public record Stage(
        String       name,
        int          ordinal,
        StageKind    kind,
        Duration     timeout,
        int          maxRetries,
        List<String> fallbackChain,
        boolean      optional,
        String       inputStage) {

    public static final Duration MAX_TIMEOUT = Duration.ofHours(24);

    public Stage {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("stage name is required");
        }
        if (kind == null) {
            throw new IllegalArgumentException("stage '" + name + "' has no kind");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("stage '" + name + "' timeout must be positive");
        }
        if (timeout.compareTo(MAX_TIMEOUT) > 0) {
            throw new IllegalArgumentException("stage '" + name + "' timeout must not exceed " + MAX_TIMEOUT);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("stage '" + name + "' max-retries must be >= 0");
        }
        if (fallbackChain == null || fallbackChain.isEmpty()) {
            throw new IllegalArgumentException("stage '" + name + "' needs at least one provider");
        }
        if (kind == StageKind.EVIDENCE_SEARCH && (inputStage == null || inputStage.isBlank())) {
            throw new IllegalArgumentException("evidence stage '" + name + "' needs an input-stage");
        }
        fallbackChain = List.copyOf(fallbackChain);
    }

    public Stage withOverride(StageOverride override) {
        if (override == null) {
            return this;
        }
        Long seconds = override.timeoutSeconds();
        if (seconds != null && (seconds <= 0 || seconds > MAX_TIMEOUT.toSeconds())) {
            throw new IllegalArgumentException("stage '" + name + "' timeout override must be between 1 and "
                    + MAX_TIMEOUT.toSeconds() + " seconds");
        }
        Duration t = seconds == null ? timeout : Duration.ofSeconds(seconds);
        int r      = override.maxRetries() == null ? maxRetries : override.maxRetries();
        return new Stage(name, ordinal, kind, t, r, fallbackChain, optional, inputStage);
    }
}
