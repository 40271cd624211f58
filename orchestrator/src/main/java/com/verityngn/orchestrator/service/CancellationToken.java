package com.verityngn.orchestrator.service;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * In-process cancellation signal for one running job. Backoff sleeps wait on
 * the token so a cancel request wakes them immediately.
 */
public class CancellationToken {

    private final UUID           jobId;
    private final CountDownLatch signal = new CountDownLatch(1);

    public CancellationToken(UUID jobId) {
        this.jobId = jobId;
    }

    public void cancel() {
        signal.countDown();
    }

    public boolean isCancelled() {
        return signal.getCount() == 0;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new JobCancelledException(jobId);
        }
    }

    /**
     * Sleep for {@code delay} unless cancelled first.
     *
     * @throws JobCancelledException      if the token fires before or during the sleep
     * @throws WorkerInterruptedException if the thread is interrupted
     */
    public void sleep(Duration delay) {
        throwIfCancelled();
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            if (signal.await(delay.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new JobCancelledException(jobId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerInterruptedException("Interrupted during backoff for job " + jobId, e);
        }
    }

    public UUID jobId() {
        return jobId;
    }
}
