package com.verityngn.orchestrator.progress;

import com.verityngn.orchestrator.model.IllegalJobTransitionException;
import com.verityngn.orchestrator.model.PipelineDefinition;
import com.verityngn.orchestrator.repository.JobWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns in-flight stage activity into persisted progress.
 *
 * Writes are throttled per job: an intermediate report is dropped when the
 * previous write for that job happened less than {@code throttleInterval}
 * ago. Boundary reports (stage start, finished segment) bypass the throttle.
 * The job itself keeps progress monotonic, so a dropped or reordered report
 * can never lower it.
 */
public class ProgressReporter {

    private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);

    private final JobWriter          writer;
    private final PipelineDefinition pipeline;
    private final Clock              clock;
    private final Duration           throttleInterval;

    private final Map<UUID, Instant> lastWrite = new ConcurrentHashMap<>();

    public ProgressReporter(JobWriter writer, PipelineDefinition pipeline,
                            Clock clock, Duration throttleInterval) {
        this.writer           = writer;
        this.pipeline         = pipeline;
        this.clock            = clock;
        this.throttleInterval = throttleInterval;
    }

    /**
     * Report progress inside a stage. May be coalesced away.
     *
     * @return true when a write was issued
     */
    public boolean report(UUID jobId, String stageName, double fractionComplete, String message) {
        Instant now = clock.instant();
        Instant previous = lastWrite.get(jobId);
        if (previous != null && now.isBefore(previous.plus(throttleInterval))) {
            return false;
        }
        return write(jobId, stageName, fractionComplete, message, now);
    }

    /** Report progress at a discrete boundary; never throttled. */
    public boolean reportBoundary(UUID jobId, String stageName, double fractionComplete, String message) {
        return write(jobId, stageName, fractionComplete, message, clock.instant());
    }

    /** Drop throttle state once a job stops running on this worker. */
    public void forget(UUID jobId) {
        lastWrite.remove(jobId);
    }

    private boolean write(UUID jobId, String stageName, double fraction, String message, Instant now) {
        int stageIndex = indexOf(stageName);
        int percent = ProgressCalculator.overall(stageIndex, fraction, pipeline.size());
        lastWrite.put(jobId, now);
        try {
            writer.update(jobId, job -> job.raiseProgress(percent, message));
            return true;
        } catch (IllegalJobTransitionException e) {
            log.debug("Progress for job {} ignored: {}", jobId, e.getMessage());
            return false;
        }
    }

    private int indexOf(String stageName) {
        for (int i = 0; i < pipeline.size(); i++) {
            if (pipeline.stage(i).name().equals(stageName)) {
                return i;
            }
        }
        throw new IllegalArgumentException("Unknown stage '" + stageName + "'");
    }
}
