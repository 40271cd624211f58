package com.verityngn.orchestrator.model;

/**
 * Per-job replacement for a stage's timeout or retry budget. Null fields keep
 * the configured value.
 */
public record StageOverride(Long timeoutSeconds, Integer maxRetries) {}
