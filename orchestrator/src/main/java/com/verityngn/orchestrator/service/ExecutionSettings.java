package com.verityngn.orchestrator.service;

import java.time.Duration;

/**
 * Worker-side tuning, resolved once at startup.
 *
 * @param workerId        identity written to jobs this process runs
 * @param workerCount     size of the job worker pool
 * @param stallTimeout    RUNNING jobs without a heartbeat for this long are reclaimed
 * @param resumeOnStartup reclaim every RUNNING job when the process starts
 */
public record ExecutionSettings(
        String   workerId,
        int      workerCount,
        Duration stallTimeout,
        boolean  resumeOnStartup) {

    public ExecutionSettings {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("worker-id is required");
        }
        if (workerCount < 1) {
            throw new IllegalArgumentException("worker count must be >= 1");
        }
    }
}
