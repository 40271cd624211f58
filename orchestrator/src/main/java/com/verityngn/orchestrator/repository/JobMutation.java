package com.verityngn.orchestrator.repository;

import com.verityngn.orchestrator.model.Job;

/**
 * A change applied to a job inside a compare-and-update. May run more than
 * once when the writer retries after a version conflict, so it must only
 * depend on the job it is given.
 */
@FunctionalInterface
public interface JobMutation {
    void apply(Job job);
}
