package com.verityngn.orchestrator.model;

/**
 * Sub-state of the stage currently executing inside a RUNNING job.
 *
 *   ATTEMPTING → SUCCEEDED
 *   ATTEMPTING → RETRYING     (transient error / timeout, same provider again)
 *   ATTEMPTING → FALLING_BACK (provider unavailable or its retries exhausted)
 *   ATTEMPTING → FAILED       (fallback chain exhausted on a required stage)
 *
 * Not persisted; surfaces in the job's progress message and in logs.
 */
public enum StageAttemptState {
    ATTEMPTING,
    SUCCEEDED,
    RETRYING,
    FALLING_BACK,
    FAILED
}
