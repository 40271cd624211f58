package com.verityngn.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.verityngn.orchestrator.admission.AdmissionController;
import com.verityngn.orchestrator.admission.AdmissionPolicy;
import com.verityngn.orchestrator.config.OrchestratorProperties.ProviderProperties;
import com.verityngn.orchestrator.config.OrchestratorProperties.StageProperties;
import com.verityngn.orchestrator.model.PipelineDefinition;
import com.verityngn.orchestrator.model.Stage;
import com.verityngn.orchestrator.model.StageKind;
import com.verityngn.orchestrator.progress.ProgressReporter;
import com.verityngn.orchestrator.provider.Provider;
import com.verityngn.orchestrator.provider.ProviderRegistry;
import com.verityngn.orchestrator.provider.http.HttpAnalysisProvider;
import com.verityngn.orchestrator.provider.http.HttpEvidenceProvider;
import com.verityngn.orchestrator.provider.http.HttpProviderClient;
import com.verityngn.orchestrator.provider.http.HttpStageProvider;
import com.verityngn.orchestrator.report.ArtifactStore;
import com.verityngn.orchestrator.report.FileSystemArtifactStore;
import com.verityngn.orchestrator.report.ReportAssembler;
import com.verityngn.orchestrator.report.ReportPublisher;
import com.verityngn.orchestrator.repository.InMemoryJobStore;
import com.verityngn.orchestrator.repository.JobRepository;
import com.verityngn.orchestrator.repository.JobStore;
import com.verityngn.orchestrator.repository.JobWriter;
import com.verityngn.orchestrator.repository.JpaJobStore;
import com.verityngn.orchestrator.service.BackoffPolicy;
import com.verityngn.orchestrator.service.CancellationRegistry;
import com.verityngn.orchestrator.service.DirectStageTask;
import com.verityngn.orchestrator.service.EvidenceSearchTask;
import com.verityngn.orchestrator.service.ExecutionSettings;
import com.verityngn.orchestrator.service.PipelineExecutor;
import com.verityngn.orchestrator.service.SegmentPlanner;
import com.verityngn.orchestrator.service.SegmentedAnalysisTask;
import com.verityngn.orchestrator.service.StageRunner;
import com.verityngn.orchestrator.service.StageTask;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the orchestrator from {@link OrchestratorProperties}.
 *
 * Configuration is read here and nowhere else: each component receives the
 * immutable values it needs through its constructor. Invalid settings fail
 * the startup.
 */
@Configuration
@EnableConfigurationProperties(OrchestratorProperties.class)
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ------------------------------------------------------------------
    // Pipeline and admission
    // ------------------------------------------------------------------

    @Bean
    public PipelineDefinition pipelineDefinition(OrchestratorProperties props) {
        List<Stage> stages = new ArrayList<>();
        try {
            for (int i = 0; i < props.stages().size(); i++) {
                StageProperties s = props.stages().get(i);
                stages.add(new Stage(s.name(), i, s.kind(), s.timeout(), s.maxRetries(),
                        s.fallbackChain(), s.optional(), s.inputStage()));
            }
            PipelineDefinition pipeline = new PipelineDefinition(stages);
            log.info("Pipeline: {}", pipeline.stages().stream().map(Stage::name).toList());
            return pipeline;
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid pipeline configuration: " + e.getMessage(), e);
        }
    }

    @Bean
    public AdmissionPolicy admissionPolicy(OrchestratorProperties props) {
        OrchestratorProperties.Admission a = props.admission();
        return new AdmissionPolicy(a.globalCap(), a.defaultTenantCap(), a.tenantCaps(), a.maxQueuedPerTenant());
    }

    @Bean
    public AdmissionController admissionController(JobStore store, PipelineDefinition pipeline,
                                                   AdmissionPolicy policy, ObjectMapper objectMapper,
                                                   Clock clock) {
        return new AdmissionController(store, pipeline, policy, objectMapper, clock);
    }

    // ------------------------------------------------------------------
    // Job Store
    // ------------------------------------------------------------------

    @Bean
    @ConditionalOnProperty(name = "verity.orchestrator.store.type", havingValue = "jpa", matchIfMissing = true)
    public JobStore jpaJobStore(JobRepository jobRepository, Clock clock) {
        return new JpaJobStore(jobRepository, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "verity.orchestrator.store.type", havingValue = "memory")
    public JobStore inMemoryJobStore(Clock clock) {
        log.warn("Using the in-memory job store; job state is lost on restart");
        return new InMemoryJobStore(clock);
    }

    // ------------------------------------------------------------------
    // Providers
    // ------------------------------------------------------------------

    /**
     * HTTP providers from configuration plus any {@link Provider} beans
     * (local implementations) present in the context.
     */
    @Bean
    public ProviderRegistry providerRegistry(OrchestratorProperties props, ObjectProvider<Provider> localProviders,
                                             ObjectMapper objectMapper, MeterRegistry meterRegistry,
                                             Clock clock) {
        List<Provider> all = new ArrayList<>();
        localProviders.orderedStream().forEach(all::add);
        for (ProviderProperties p : props.providers()) {
            all.add(httpProvider(p, objectMapper));
        }
        return new ProviderRegistry(all, meterRegistry, clock, props.providerHealthTtl());
    }

    private static Provider httpProvider(ProviderProperties p, ObjectMapper objectMapper) {
        if (p.name() == null || p.name().isBlank() || p.capability() == null) {
            throw new IllegalStateException("Every provider needs a name and a capability");
        }
        HttpProviderClient client = new HttpProviderClient(p.name(), p.baseUrl(), p.requestTimeout(), objectMapper);
        return switch (p.capability()) {
            case STAGE    -> new HttpStageProvider(p.name(), p.enabled(), p.healthPath(), client);
            case ANALYSIS -> new HttpAnalysisProvider(p.name(), p.enabled(), p.healthPath(), client);
            case EVIDENCE -> new HttpEvidenceProvider(p.name(), p.enabled(), p.healthPath(), client);
        };
    }

    @Bean
    public CommandLineRunner probeProviders(ProviderRegistry registry) {
        return args -> registry.probeAll();
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    @Bean
    public ExecutionSettings executionSettings(OrchestratorProperties props) {
        OrchestratorProperties.Execution e = props.execution();
        String workerId = e.workerId() == null || e.workerId().isBlank()
                ? "worker-" + UUID.randomUUID().toString().substring(0, 8)
                : e.workerId();
        return new ExecutionSettings(workerId, props.admission().globalCap(), e.stallTimeout(), e.resumeOnStartup());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService providerCallPool() {
        return Executors.newCachedThreadPool();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService segmentPool(OrchestratorProperties props) {
        return Executors.newFixedThreadPool(
                props.admission().globalCap() * props.execution().segmentConcurrency());
    }

    @Bean
    public StageRunner stageRunner(OrchestratorProperties props, ProviderRegistry registry,
                                   ExecutorService providerCallPool, ObjectMapper objectMapper, Clock clock) {
        OrchestratorProperties.Execution e = props.execution();
        return new StageRunner(registry, new BackoffPolicy(e.backoffBase(), e.backoffMax()),
                providerCallPool, e.cancelGracePeriod(), objectMapper, clock);
    }

    @Bean
    public ProgressReporter progressReporter(JobWriter writer, PipelineDefinition pipeline,
                                             OrchestratorProperties props, Clock clock) {
        return new ProgressReporter(writer, pipeline, clock, props.progress().throttleInterval());
    }

    @Bean
    public ReportAssembler reportAssembler(PipelineDefinition pipeline, OrchestratorProperties props,
                                           ObjectMapper objectMapper) {
        return new ReportAssembler(pipeline, props.report().verdictStage(),
                props.report().evidenceStage(), objectMapper);
    }

    @Bean
    public ArtifactStore artifactStore(OrchestratorProperties props) {
        return new FileSystemArtifactStore(Path.of(props.report().artifactDir()));
    }

    @Bean
    public ReportPublisher reportPublisher(ArtifactStore artifactStore) {
        return new ReportPublisher(artifactStore);
    }

    @Bean
    public PipelineExecutor pipelineExecutor(OrchestratorProperties props, JobStore store, JobWriter writer,
                                             PipelineDefinition pipeline, StageRunner runner,
                                             ProviderRegistry registry, ExecutorService segmentPool,
                                             ProgressReporter progress, ReportAssembler assembler,
                                             ReportPublisher publisher, CancellationRegistry cancellations,
                                             MeterRegistry meterRegistry, ObjectMapper objectMapper) {
        OrchestratorProperties.Execution e = props.execution();
        Map<StageKind, StageTask<?>> tasks = new EnumMap<>(StageKind.class);
        tasks.put(StageKind.DIRECT, new DirectStageTask(registry));
        tasks.put(StageKind.SEGMENTED_ANALYSIS, new SegmentedAnalysisTask(registry,
                new SegmentPlanner(e.segmentDuration()), segmentPool, e.segmentConcurrency()));
        tasks.put(StageKind.EVIDENCE_SEARCH, new EvidenceSearchTask(registry));
        return new PipelineExecutor(store, writer, pipeline, runner, tasks, progress, assembler, publisher,
                cancellations, meterRegistry, objectMapper, props.report().allowPartial());
    }
}
