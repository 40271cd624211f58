package com.verityngn.orchestrator.config;

import com.verityngn.orchestrator.model.StageKind;
import com.verityngn.orchestrator.provider.Capability;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Everything under {@code verity.orchestrator.*}, bound once at startup.
 * {@link OrchestratorConfig} turns it into the immutable values the
 * components are constructed with.
 */
@ConfigurationProperties(prefix = "verity.orchestrator")
public record OrchestratorProperties(
        @DefaultValue Admission          admission,
        @DefaultValue Execution          execution,
        @DefaultValue Progress           progress,
        @DefaultValue Reporting          report,
        @DefaultValue Store              store,
        @DefaultValue("PT30S") Duration  providerHealthTtl,
        List<StageProperties>            stages,
        List<ProviderProperties>         providers) {

    public OrchestratorProperties {
        stages    = stages == null ? List.of() : List.copyOf(stages);
        providers = providers == null ? List.of() : List.copyOf(providers);
    }

    public record Admission(
            @DefaultValue("4")     int                  globalCap,
            @DefaultValue("2")     int                  defaultTenantCap,
                                   Map<String, Integer> tenantCaps,
            @DefaultValue("0")     int                  maxQueuedPerTenant,
            @DefaultValue("PT1S")  Duration             dispatchInterval) {}

    public record Execution(
                                   String   workerId,
            @DefaultValue("PT1S")  Duration backoffBase,
            @DefaultValue("PT30S") Duration backoffMax,
            @DefaultValue("PT10S") Duration cancelGracePeriod,
            @DefaultValue("4")     int      segmentConcurrency,
            @DefaultValue("PT5M")  Duration segmentDuration,
            @DefaultValue("PT10S") Duration heartbeatInterval,
            @DefaultValue("PT60S") Duration recoveryInterval,
            @DefaultValue("PT5M")  Duration stallTimeout,
            @DefaultValue("true")  boolean  resumeOnStartup) {}

    public record Progress(
            @DefaultValue("PT2S") Duration throttleInterval) {}

    public record Reporting(
            @DefaultValue("claim_verification") String  verdictStage,
            @DefaultValue("evidence_search")    String  evidenceStage,
            @DefaultValue("false")              boolean allowPartial,
            @DefaultValue("./artifacts")        String  artifactDir) {}

    public record Store(
            @DefaultValue("jpa") String type) {}

    public record StageProperties(
                                  String       name,
                                  StageKind    kind,
                                  Duration     timeout,
            @DefaultValue("2")    int          maxRetries,
                                  List<String> fallbackChain,
            @DefaultValue("false") boolean     optional,
                                  String       inputStage) {}

    public record ProviderProperties(
                                    String     name,
                                    Capability capability,
                                    String     baseUrl,
            @DefaultValue("true")   boolean    enabled,
            @DefaultValue("/health") String    healthPath,
            @DefaultValue("PT60S")  Duration   requestTimeout) {}
}
