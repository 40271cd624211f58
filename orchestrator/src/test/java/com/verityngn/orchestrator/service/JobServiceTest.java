package com.verityngn.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.verityngn.orchestrator.admission.AdmissionController;
import com.verityngn.orchestrator.admission.AdmissionDeniedException;
import com.verityngn.orchestrator.admission.ValidationException;
import com.verityngn.orchestrator.model.ErrorKind;
import com.verityngn.orchestrator.model.Job;
import com.verityngn.orchestrator.model.JobStatus;
import com.verityngn.orchestrator.model.PipelineDefinition;
import com.verityngn.orchestrator.model.StageResult;
import com.verityngn.orchestrator.report.ReportPublisher;
import com.verityngn.orchestrator.repository.JobMutation;
import com.verityngn.orchestrator.repository.JobStore;
import com.verityngn.orchestrator.repository.JobWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static com.verityngn.orchestrator.support.TestOrchestrator.direct;
import static com.verityngn.orchestrator.support.TestOrchestrator.pipeline;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for JobService. Store, writer and dispatcher are mocked, so no
 * thread ever runs a pipeline here.
 */
@ExtendWith(MockitoExtension.class)
class JobServiceTest {

    static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    static final String  VIDEO = "https://video.example/v";

    @Mock AdmissionController  admission;
    @Mock JobDispatcher        dispatcher;
    @Mock JobStore             store;
    @Mock JobWriter            writer;
    @Mock CancellationRegistry cancellations;
    @Mock ReportPublisher      reports;

    final PipelineDefinition pipeline =
            pipeline(direct("ingestion", 0, "p"), direct("claim_verification", 1, "p"));

    JobService service;

    @BeforeEach
    void setUp() {
        service = new JobService(admission, dispatcher, store, writer, cancellations, reports, pipeline);
    }

    Job job(JobStatus status) {
        Job job = new Job("t", VIDEO, null, 2, NOW);
        if (status != JobStatus.QUEUED) {
            job.promote("w1", NOW);
        }
        switch (status) {
            case COMPLETED -> job.complete("file:///reports/r.json");
            case FAILED    -> job.fail(ErrorKind.STAGE_FAILED, "ingestion", "boom");
            case CANCELLED -> job.cancel();
            default -> { }
        }
        return job;
    }

    // ------------------------------------------------------------------
    // submit()
    // ------------------------------------------------------------------

    @Test
    void submit_admitsThenDispatchesImmediately() {
        Job queued = job(JobStatus.QUEUED);
        when(admission.submit("t", VIDEO, null)).thenReturn(queued.getId());
        when(store.get(queued.getId())).thenReturn(queued);

        Job result = service.submit("t", VIDEO, null);

        assertThat(result).isSameAs(queued);
        verify(dispatcher).dispatchNow();
    }

    @Test
    void submit_dispatchFailure_stillReturnsQueuedJob() {
        Job queued = job(JobStatus.QUEUED);
        when(admission.submit("t", VIDEO, null)).thenReturn(queued.getId());
        when(dispatcher.dispatchNow()).thenThrow(new IllegalStateException("store hiccup"));
        when(store.get(queued.getId())).thenReturn(queued);

        assertThat(service.submit("t", VIDEO, null).getStatus()).isEqualTo(JobStatus.QUEUED);
    }

    @Test
    void submit_denied_propagatesAndDoesNotDispatch() {
        when(admission.submit("t", VIDEO, null)).thenThrow(new AdmissionDeniedException("t", "full"));

        assertThatThrownBy(() -> service.submit("t", VIDEO, null))
                .isInstanceOf(AdmissionDeniedException.class);
        verifyNoInteractions(dispatcher);
    }

    // ------------------------------------------------------------------
    // Polling
    // ------------------------------------------------------------------

    @Test
    void list_withStatuses_queriesTenantAndStatuses() {
        Job running = job(JobStatus.RUNNING);
        when(store.listByTenantAndStatus("t", EnumSet.of(JobStatus.RUNNING))).thenReturn(List.of(running));

        assertThat(service.list("t", EnumSet.of(JobStatus.RUNNING))).containsExactly(running);
    }

    @Test
    void list_withoutStatuses_queriesEveryStatus() {
        when(store.listByTenantAndStatus("t", EnumSet.allOf(JobStatus.class))).thenReturn(List.of());

        assertThat(service.list("t", Set.of())).isEmpty();
        verify(store).listByTenantAndStatus("t", EnumSet.allOf(JobStatus.class));
    }

    @Test
    void list_blankTenant_isRejected() {
        assertThatThrownBy(() -> service.list(" ", null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("tenantId");
        verifyNoInteractions(store);
    }

    @Test
    void currentStage_followsIndexAndClampsForFinishedJobs() {
        Job running = job(JobStatus.RUNNING);
        assertThat(service.currentStage(running)).isEqualTo("ingestion");

        running.recordStageResult(0, StageResult.succeeded("ingestion", 1, "p", "{}", NOW), 50);
        running.recordStageResult(1, StageResult.succeeded("claim_verification", 1, "p", "{}", NOW), 99);
        assertThat(service.currentStage(running)).isEqualTo("claim_verification");
    }

    @Test
    void currentStage_ofFailedJob_isTheFailedStage() {
        assertThat(service.currentStage(job(JobStatus.FAILED))).isEqualTo("ingestion");
    }

    @Test
    void report_beforePublish_isEmpty() {
        Job running = job(JobStatus.RUNNING);
        when(store.get(running.getId())).thenReturn(running);

        assertThat(service.report(running.getId())).isEmpty();
        verifyNoInteractions(reports);
    }

    @Test
    void report_afterCompletion_readsArtifact() {
        Job done = job(JobStatus.COMPLETED);
        when(store.get(done.getId())).thenReturn(done);
        when(reports.read("file:///reports/r.json")).thenReturn(new ObjectMapper().createObjectNode());

        assertThat(service.report(done.getId())).isPresent();
    }

    // ------------------------------------------------------------------
    // cancel()
    // ------------------------------------------------------------------

    @Test
    void cancel_runningJob_setsFlagAndSignalsLocalWorker() {
        Job running = job(JobStatus.RUNNING);
        UUID id = running.getId();
        when(store.get(id)).thenReturn(running);
        when(writer.update(eq(id), any(JobMutation.class))).thenAnswer(inv -> {
            inv.<JobMutation>getArgument(1).apply(running);
            return running;
        });

        Job result = service.cancel(id);

        assertThat(result.isCancelRequested()).isTrue();
        assertThat(result.getStatus()).isEqualTo(JobStatus.RUNNING);
        verify(cancellations).signal(id);
    }

    @Test
    void cancel_queuedJob_cancelsWithoutSignal() {
        Job queued = job(JobStatus.QUEUED);
        UUID id = queued.getId();
        when(store.get(id)).thenReturn(queued);
        when(writer.update(eq(id), any(JobMutation.class))).thenAnswer(inv -> {
            inv.<JobMutation>getArgument(1).apply(queued);
            return queued;
        });

        assertThat(service.cancel(id).getStatus()).isEqualTo(JobStatus.CANCELLED);
        verify(cancellations, never()).signal(any());
    }

    @Test
    void cancel_terminalJob_isReturnedUnchanged() {
        Job done = job(JobStatus.COMPLETED);
        when(store.get(done.getId())).thenReturn(done);

        assertThat(service.cancel(done.getId()).getStatus()).isEqualTo(JobStatus.COMPLETED);
        verifyNoInteractions(writer, cancellations);
    }
}
