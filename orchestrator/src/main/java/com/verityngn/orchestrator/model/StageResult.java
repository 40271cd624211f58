package com.verityngn.orchestrator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

import java.time.Instant;
import java.util.Objects;

/**
 * Recorded outcome of one pipeline stage. Written once per job and stage,
 * never changed afterwards.
 *
 * payload is the provider output as JSON and is opaque to the orchestrator;
 * only the Report Assembler looks inside it.
 */
@Embeddable
public class StageResult {

    @Column(name = "stage_name", nullable = false)
    private String stageName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StageOutcome outcome;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "provider_used")
    private String providerUsed;

    @Column(columnDefinition = "TEXT")
    private String payload;

    // Last error for FAILED, reason for SKIPPED, null for SUCCEEDED.
    @Column(columnDefinition = "TEXT")
    private String message;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    protected StageResult() {}   // required by JPA

    private StageResult(String stageName, StageOutcome outcome, int attemptCount,
                        String providerUsed, String payload, String message, Instant recordedAt) {
        this.stageName    = stageName;
        this.outcome      = outcome;
        this.attemptCount = attemptCount;
        this.providerUsed = providerUsed;
        this.payload      = payload;
        this.message      = message;
        this.recordedAt   = recordedAt;
    }

    public static StageResult succeeded(String stageName, int attempts, String provider,
                                        String payload, Instant now) {
        return new StageResult(stageName, StageOutcome.SUCCEEDED, attempts, provider, payload, null, now);
    }

    public static StageResult skipped(String stageName, int attempts, String reason, Instant now) {
        return new StageResult(stageName, StageOutcome.SKIPPED, attempts, null, null, reason, now);
    }

    public static StageResult failed(String stageName, int attempts, String provider,
                                     String error, Instant now) {
        return new StageResult(stageName, StageOutcome.FAILED, attempts, provider, null, error, now);
    }

    public String       getStageName()    { return stageName; }
    public StageOutcome getOutcome()      { return outcome; }
    public int          getAttemptCount() { return attemptCount; }
    public String       getProviderUsed() { return providerUsed; }
    public String       getPayload()      { return payload; }
    public String       getMessage()      { return message; }
    public Instant      getRecordedAt()   { return recordedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StageResult that)) return false;
        return attemptCount == that.attemptCount
                && stageName.equals(that.stageName)
                && outcome == that.outcome
                && Objects.equals(providerUsed, that.providerUsed)
                && Objects.equals(payload, that.payload)
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stageName, outcome, attemptCount, providerUsed, payload, message);
    }

    @Override
    public String toString() {
        return "StageResult[" + stageName + ", " + outcome + ", attempts=" + attemptCount
                + ", provider=" + providerUsed + "]";
    }
}
